package com.geico.poc.planexplain.explain;

import com.geico.poc.planexplain.config.PlanExplainConfig;
import com.geico.poc.planexplain.model.InputInfo;
import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.plan.PlanInputs;
import com.geico.poc.planexplain.plan.PlanNode;
import com.geico.poc.planexplain.stats.PlanStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a plan node tree into a {@link PlanDescription} tree.
 * <p>
 * Each node describes itself; the builder attaches recorded row-count samples,
 * applies the metadata a parent supplies about each input, and mirrors the
 * input order exactly.
 */
@Component
public class PlanDescriptionBuilder {
    
    private static final Logger log = LoggerFactory.getLogger(PlanDescriptionBuilder.class);
    
    private final int maxDepth;
    
    public PlanDescriptionBuilder(PlanExplainConfig config) {
        this.maxDepth = config.getMaxDepth();
    }
    
    /**
     * Build the description of a plan without runtime statistics
     */
    public PlanDescription build(PlanNode root) {
        return build(root, null);
    }
    
    /**
     * Build the description of a plan.
     *
     * @param root  plan root
     * @param stats recorded samples, or null when the plan was not profiled.
     *              Nodes without samples get empty stats.
     * @throws PlanEncodingException if the tree is deeper than the configured maximum
     */
    public PlanDescription build(PlanNode root, PlanStatistics stats) {
        return build(root, stats, 1);
    }
    
    private PlanDescription build(PlanNode node, PlanStatistics stats, int depth) {
        if (depth > maxDepth) {
            throw new PlanEncodingException("plan tree deeper than " + maxDepth
                + " levels; cyclic plans are not supported");
        }
        // Input name comes only from the parent, stats only from the caller's samples
        PlanDescription.Builder description = node.describe().toBuilder()
            .inputName(null)
            .stats(stats != null ? stats.samplesFor(node) : List.of());
        
        PlanInputs inputs = node.inputs();
        List<PlanNode> nodes = inputs.getNodes();
        List<InputInfo> infos = inputs.getInfos();
        List<PlanDescription> children = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            PlanDescription child = build(nodes.get(i), stats, depth + 1);
            if (infos != null) {
                child = applyInputInfo(child, infos.get(i));
            }
            children.add(child);
        }
        // Leaf nodes get an explicit empty list, never a missing one
        description.inputs(children);
        
        PlanDescription result = description.build();
        log.debug("Described {} at depth {} with {} inputs", result.getLabel(), depth, children.size());
        return result;
    }
    
    /**
     * The info's name becomes the input name; its fields override the child's own
     */
    static PlanDescription applyInputInfo(PlanDescription child, InputInfo info) {
        PlanDescription.Builder merged = child.toBuilder();
        if (info.getInputName() != null) {
            merged.inputName(info.getInputName());
        }
        merged.fields(info.getFields());
        return merged.build();
    }
}
