package com.geico.poc.planexplain.primitive;

import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.plan.PlanInputs;
import com.geico.poc.planexplain.plan.PlanNode;

import java.util.List;

/**
 * UNION ALL of its sources, in source order.
 */
public class Concatenate implements PlanNode {
    
    private final List<PlanNode> sources;
    private final List<String> noNeedToTypeCheck;
    
    public Concatenate(List<? extends PlanNode> sources, List<String> noNeedToTypeCheck) {
        this.sources = List.copyOf(sources);
        this.noNeedToTypeCheck = List.copyOf(noNeedToTypeCheck);
    }
    
    @Override
    public PlanDescription describe() {
        PlanDescription.Builder description = PlanDescription.builder("Concatenate");
        if (!noNeedToTypeCheck.isEmpty()) {
            description.field("NoNeedToTypeCheck", noNeedToTypeCheck);
        }
        return description.build();
    }
    
    @Override
    public PlanInputs inputs() {
        return PlanInputs.of(sources);
    }
    
    @Override
    public String toString() {
        return "Concatenate" + sources;
    }
}
