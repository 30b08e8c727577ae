package com.geico.poc.planexplain.primitive;

import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.plan.PlanInputs;
import com.geico.poc.planexplain.plan.PlanNode;

import java.util.List;
import java.util.Objects;

/**
 * Returns at most {@code count} rows of its input, after skipping {@code offset}.
 */
public class Limit implements PlanNode {
    
    private final long count;
    private final long offset;
    private final PlanNode input;
    
    public Limit(long count, long offset, PlanNode input) {
        this.count = count;
        this.offset = offset;
        this.input = Objects.requireNonNull(input, "input");
    }
    
    @Override
    public PlanDescription describe() {
        return PlanDescription.builder("Limit")
            .field("Count", count)
            .field("Offset", offset)
            .build();
    }
    
    @Override
    public PlanInputs inputs() {
        return PlanInputs.of(List.of(input));
    }
    
    @Override
    public String toString() {
        return "Limit(" + count + ", " + input + ")";
    }
}
