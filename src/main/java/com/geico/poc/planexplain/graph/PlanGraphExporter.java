package com.geico.poc.planexplain.graph;

import com.geico.poc.planexplain.config.PlanExplainConfig;
import com.geico.poc.planexplain.explain.PlanEncodingException;
import com.geico.poc.planexplain.model.ExtensionFields;
import com.geico.poc.planexplain.model.PlanDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a description tree as a {@link PlanGraph}.
 * <p>
 * Inputs are added before their parent, so every edge points from a node to
 * an already-built input node. Extension fields become attributes in key order:
 * {@code Query} is shown as the tooltip, {@code FieldQuery} is left out, string
 * lists add the key followed by one attribute per element, and anything else
 * becomes a single {@code key:value} attribute.
 */
@Component
public class PlanGraphExporter {
    
    private static final Logger log = LoggerFactory.getLogger(PlanGraphExporter.class);
    
    static final String QUERY_FIELD = "Query";
    static final String FIELD_QUERY_FIELD = "FieldQuery";
    
    private final int maxDepth;
    private final String graphName;
    
    public PlanGraphExporter(PlanExplainConfig config) {
        this.maxDepth = config.getMaxDepth();
        this.graphName = config.getGraph().getName();
    }
    
    public PlanGraph export(PlanDescription description) {
        PlanGraph graph = new PlanGraph(graphName);
        addToGraph(description, graph, 1);
        log.debug("Exported plan graph with {} nodes and {} edges", graph.getNodes().size(), graph.getEdges().size());
        return graph;
    }
    
    private GraphNode addToGraph(PlanDescription description, PlanGraph graph, int depth) {
        if (depth > maxDepth) {
            throw new PlanEncodingException("plan description deeper than " + maxDepth + " levels");
        }
        List<GraphNode> inputs = new ArrayList<>(description.getInputs().size());
        for (PlanDescription input : description.getInputs()) {
            inputs.add(addToGraph(input, graph, depth + 1));
        }
        
        GraphNode node = graph.addNode(description.getLabel());
        for (Map.Entry<String, Object> field : description.getOther().asMap().entrySet()) {
            String key = field.getKey();
            Object value = field.getValue();
            if (QUERY_FIELD.equals(key)) {
                if (value != null) {
                    node.addTooltip(value.toString());
                }
            } else if (FIELD_QUERY_FIELD.equals(key)) {
                continue;
            } else if (ExtensionFields.isStringList(value)) {
                node.addAttribute(key);
                for (Object element : (List<?>) value) {
                    node.addAttribute(element.toString());
                }
            } else {
                node.addAttribute(key + ":" + value);
            }
        }
        
        for (GraphNode input : inputs) {
            graph.addEdge(node, input);
        }
        return node;
    }
}
