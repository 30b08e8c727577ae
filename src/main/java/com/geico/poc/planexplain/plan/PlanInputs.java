package com.geico.poc.planexplain.plan;

import com.geico.poc.planexplain.model.InputInfo;

import java.util.List;

/**
 * Ordered inputs of a plan node plus optional metadata for each.
 * <p>
 * When infos are present there is exactly one per input, in the same order.
 * When absent, no input of the node gets a name or extra fields.
 */
public class PlanInputs {
    
    private static final PlanInputs NONE = new PlanInputs(List.of(), null);
    
    private final List<PlanNode> nodes;
    private final List<InputInfo> infos;
    
    private PlanInputs(List<PlanNode> nodes, List<InputInfo> infos) {
        this.nodes = nodes;
        this.infos = infos;
    }
    
    public static PlanInputs none() {
        return NONE;
    }
    
    public static PlanInputs of(List<? extends PlanNode> nodes) {
        return new PlanInputs(List.copyOf(nodes), null);
    }
    
    public static PlanInputs of(List<? extends PlanNode> nodes, List<InputInfo> infos) {
        if (infos == null) {
            return of(nodes);
        }
        if (infos.size() != nodes.size()) {
            throw new IllegalArgumentException("expected " + nodes.size() + " input infos, got " + infos.size());
        }
        return new PlanInputs(List.copyOf(nodes), List.copyOf(infos));
    }
    
    public List<PlanNode> getNodes() {
        return nodes;
    }
    
    /**
     * Per-input metadata, or null if the node supplies none
     */
    public List<InputInfo> getInfos() {
        return infos;
    }
    
    public int size() {
        return nodes.size();
    }
    
    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
