package com.geico.poc.planexplain.primitive;

import com.geico.poc.planexplain.model.InputInfo;
import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.plan.PlanInputs;
import com.geico.poc.planexplain.plan.PlanNode;
import com.geico.poc.planexplain.util.OrderedMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Nested-loop join: runs the right input once per left row, binding join
 * variables from the left row.
 */
public class Join implements PlanNode {
    
    private final boolean leftJoin;
    private final PlanNode left;
    private final PlanNode right;
    private final List<Integer> columns;
    private final Map<String, Integer> vars;
    private final String tableName;
    
    /**
     * @param columns output columns; negative values index the left row, positive the right
     * @param vars    bind variable name to left column index
     */
    public Join(boolean leftJoin, PlanNode left, PlanNode right, List<Integer> columns,
                Map<String, Integer> vars, String tableName) {
        this.leftJoin = leftJoin;
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.columns = List.copyOf(columns);
        this.vars = Map.copyOf(vars);
        this.tableName = tableName;
    }
    
    @Override
    public PlanDescription describe() {
        PlanDescription.Builder description = PlanDescription.builder("Join")
            .variant(leftJoin ? "LeftJoin" : "Join")
            .field("JoinColumnIndexes", columns.stream().map(String::valueOf).collect(Collectors.joining(",")))
            .field("TableName", tableName);
        if (!vars.isEmpty()) {
            description.field("JoinVars", OrderedMap.of(vars));
        }
        return description.build();
    }
    
    @Override
    public PlanInputs inputs() {
        return PlanInputs.of(List.of(left, right),
            List.of(InputInfo.named("Outer"), InputInfo.named("Inner")));
    }
    
    public PlanNode getLeft() {
        return left;
    }
    
    public PlanNode getRight() {
        return right;
    }
    
    @Override
    public String toString() {
        return (leftJoin ? "LeftJoin" : "Join") + "(" + left + ", " + right + ")";
    }
}
