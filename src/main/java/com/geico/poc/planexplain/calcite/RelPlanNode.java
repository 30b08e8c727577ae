package com.geico.poc.planexplain.calcite;

import com.geico.poc.planexplain.model.InputInfo;
import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.plan.PlanInputs;
import com.geico.poc.planexplain.plan.PlanNode;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.util.Pair;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exposes a Calcite {@link RelNode} tree as a plan.
 * <p>
 * The operator type is the rel type name (e.g. {@code LogicalJoin}); the rel's
 * explain terms become extension fields, and the terms naming inputs (such as
 * {@code left} and {@code right}) become input names.
 */
public class RelPlanNode implements PlanNode {
    
    private final RelNode relNode;
    private PlanInputs inputs;
    
    public RelPlanNode(RelNode relNode) {
        this.relNode = Objects.requireNonNull(relNode, "relNode");
    }
    
    @Override
    public PlanDescription describe() {
        PlanDescription.Builder description = PlanDescription.builder(relNode.getRelTypeName());
        for (Pair<String, Object> term : RelTermCollector.termsOf(relNode)) {
            if (term.right instanceof RelNode) {
                continue;
            }
            description.field(capitalize(term.left), fieldValue(term.right));
        }
        return description.build();
    }
    
    /**
     * Inputs are wrapped once, so samples recorded against them are found again
     * when the plan is described
     */
    @Override
    public PlanInputs inputs() {
        if (inputs == null) {
            inputs = wrapInputs();
        }
        return inputs;
    }
    
    private PlanInputs wrapInputs() {
        // Input terms are written in input order, so roles are matched by position
        List<String> roles = new ArrayList<>();
        for (Pair<String, Object> term : RelTermCollector.termsOf(relNode)) {
            if (term.right instanceof RelNode) {
                roles.add(term.left);
            }
        }
        
        List<RelNode> relInputs = relNode.getInputs();
        List<RelPlanNode> nodes = new ArrayList<>(relInputs.size());
        List<InputInfo> infos = new ArrayList<>(relInputs.size());
        for (int i = 0; i < relInputs.size(); i++) {
            nodes.add(new RelPlanNode(relInputs.get(i)));
            String role = roles.size() == relInputs.size() ? roles.get(i) : null;
            // Single-input rels name their input just "input"
            if (role == null || role.equals("input")) {
                infos.add(InputInfo.unnamed());
            } else {
                infos.add(InputInfo.named(capitalize(role)));
            }
        }
        return PlanInputs.of(nodes, infos);
    }
    
    private static Object fieldValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value.toString();
    }
    
    private static String capitalize(String term) {
        if (term.isEmpty()) {
            return term;
        }
        return Character.toUpperCase(term.charAt(0)) + term.substring(1);
    }
    
    @Override
    public String toString() {
        return relNode.getRelTypeName() + "#" + relNode.getId();
    }
}
