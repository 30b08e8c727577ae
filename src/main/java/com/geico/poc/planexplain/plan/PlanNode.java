package com.geico.poc.planexplain.plan;

import com.geico.poc.planexplain.model.PlanDescription;

/**
 * A node of an executable query plan, as seen by explain and graph output.
 */
public interface PlanNode {
    
    /**
     * Describe this node's own fields. Inputs, input name and stats of the
     * returned description are ignored and filled in by the description builder.
     */
    PlanDescription describe();
    
    /**
     * Ordered inputs of this node, with optional per-input metadata
     */
    PlanInputs inputs();
}
