package com.geico.poc.planexplain.model;

import com.geico.poc.planexplain.topo.Destination;
import com.geico.poc.planexplain.topo.Keyspace;
import com.geico.poc.planexplain.topo.TabletType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Serializable mirror of one plan node and its inputs.
 * <p>
 * All operators share this shape so explain output and graphs look the same
 * regardless of operator. Instances are immutable; use {@link #toBuilder()} to
 * derive a modified copy.
 */
public final class PlanDescription {
    
    private final String operatorType;
    private final String variant;
    private final Keyspace keyspace;
    private final Destination targetDestination;
    private final TabletType targetTabletType;
    private final ExtensionFields other;
    private final String inputName;
    private final List<PlanDescription> inputs;
    private final List<Integer> stats;
    
    private PlanDescription(Builder builder) {
        this.operatorType = builder.operatorType;
        this.variant = builder.variant;
        this.keyspace = builder.keyspace;
        this.targetDestination = builder.targetDestination;
        this.targetTabletType = builder.targetTabletType;
        this.other = ExtensionFields.copyOf(builder.other);
        this.inputName = builder.inputName;
        this.inputs = List.copyOf(builder.inputs);
        this.stats = List.copyOf(builder.stats);
    }
    
    public static Builder builder(String operatorType) {
        return new Builder(operatorType);
    }
    
    public Builder toBuilder() {
        Builder builder = new Builder(operatorType)
            .variant(variant)
            .keyspace(keyspace)
            .targetDestination(targetDestination)
            .targetTabletType(targetTabletType)
            .inputName(inputName)
            .inputs(inputs)
            .stats(stats);
        builder.other.putAll(other);
        return builder;
    }
    
    public String getOperatorType() {
        return operatorType;
    }
    
    /**
     * Operator variant, or null
     */
    public String getVariant() {
        return variant;
    }
    
    public Keyspace getKeyspace() {
        return keyspace;
    }
    
    public Destination getTargetDestination() {
        return targetDestination;
    }
    
    /**
     * Never null; {@link TabletType#UNKNOWN} when no tablet type was targeted
     */
    public TabletType getTargetTabletType() {
        return targetTabletType;
    }
    
    public ExtensionFields getOther() {
        return other;
    }
    
    /**
     * Role assigned by the parent node, or null
     */
    public String getInputName() {
        return inputName;
    }
    
    /**
     * Child descriptions in plan order. Never null; empty for leaf nodes.
     */
    public List<PlanDescription> getInputs() {
        return inputs;
    }
    
    /**
     * Row-count samples recorded during execution. Empty when none were recorded.
     */
    public List<Integer> getStats() {
        return stats;
    }
    
    public boolean hasStats() {
        return !stats.isEmpty();
    }
    
    /**
     * Label used for graph nodes: {@code operatorType:variant}, or just the operator type
     */
    public String getLabel() {
        if (variant == null || variant.isEmpty()) {
            return operatorType;
        }
        return operatorType + ":" + variant;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlanDescription)) return false;
        PlanDescription that = (PlanDescription) o;
        return operatorType.equals(that.operatorType)
            && Objects.equals(variant, that.variant)
            && Objects.equals(keyspace, that.keyspace)
            && Objects.equals(targetDestination, that.targetDestination)
            && targetTabletType == that.targetTabletType
            && other.equals(that.other)
            && Objects.equals(inputName, that.inputName)
            && inputs.equals(that.inputs)
            && stats.equals(that.stats);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(operatorType, variant, keyspace, targetDestination, targetTabletType,
            other, inputName, inputs, stats);
    }
    
    @Override
    public String toString() {
        return "PlanDescription(" + getLabel() + ", inputs=" + inputs.size() + ")";
    }
    
    public static final class Builder {
        private final String operatorType;
        private String variant;
        private Keyspace keyspace;
        private Destination targetDestination;
        private TabletType targetTabletType = TabletType.UNKNOWN;
        private final ExtensionFields other = new ExtensionFields();
        private String inputName;
        private List<PlanDescription> inputs = new ArrayList<>();
        private List<Integer> stats = new ArrayList<>();
        
        private Builder(String operatorType) {
            this.operatorType = Objects.requireNonNull(operatorType, "operatorType");
        }
        
        public Builder variant(String variant) {
            this.variant = variant;
            return this;
        }
        
        public Builder keyspace(Keyspace keyspace) {
            this.keyspace = keyspace;
            return this;
        }
        
        public Builder targetDestination(Destination targetDestination) {
            this.targetDestination = targetDestination;
            return this;
        }
        
        public Builder targetTabletType(TabletType targetTabletType) {
            this.targetTabletType = targetTabletType != null ? targetTabletType : TabletType.UNKNOWN;
            return this;
        }
        
        public Builder field(String key, Object value) {
            other.put(key, value);
            return this;
        }
        
        public Builder fields(ExtensionFields fields) {
            other.putAll(fields);
            return this;
        }
        
        public Builder inputName(String inputName) {
            this.inputName = inputName;
            return this;
        }
        
        public Builder inputs(List<PlanDescription> inputs) {
            this.inputs = inputs != null ? new ArrayList<>(inputs) : new ArrayList<>();
            return this;
        }
        
        public Builder stats(List<Integer> stats) {
            this.stats = stats != null ? new ArrayList<>(stats) : new ArrayList<>();
            return this;
        }
        
        public PlanDescription build() {
            return new PlanDescription(this);
        }
    }
}
