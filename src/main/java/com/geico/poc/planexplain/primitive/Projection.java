package com.geico.poc.planexplain.primitive;

import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.plan.PlanInputs;
import com.geico.poc.planexplain.plan.PlanNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates expressions over each input row.
 */
public class Projection implements PlanNode {
    
    private final List<String> columns;
    private final List<String> expressions;
    private final PlanNode input;
    
    public Projection(List<String> columns, List<String> expressions, PlanNode input) {
        if (columns.size() != expressions.size()) {
            throw new IllegalArgumentException("expected one column name per expression");
        }
        this.columns = List.copyOf(columns);
        this.expressions = List.copyOf(expressions);
        this.input = Objects.requireNonNull(input, "input");
    }
    
    @Override
    public PlanDescription describe() {
        List<String> exprs = new ArrayList<>(expressions.size());
        for (int i = 0; i < expressions.size(); i++) {
            exprs.add(expressions.get(i) + " as " + columns.get(i));
        }
        return PlanDescription.builder("Projection")
            .field("Expressions", exprs)
            .build();
    }
    
    @Override
    public PlanInputs inputs() {
        return PlanInputs.of(List.of(input));
    }
    
    @Override
    public String toString() {
        return "Projection(" + expressions + ")";
    }
}
