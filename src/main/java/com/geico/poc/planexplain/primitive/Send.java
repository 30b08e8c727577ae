package com.geico.poc.planexplain.primitive;

import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.plan.PlanInputs;
import com.geico.poc.planexplain.plan.PlanNode;
import com.geico.poc.planexplain.topo.Destination;
import com.geico.poc.planexplain.topo.Keyspace;
import com.geico.poc.planexplain.topo.TabletType;

/**
 * Sends a query verbatim to an explicit destination, bypassing routing.
 */
public class Send implements PlanNode {
    
    private final Keyspace keyspace;
    private final Destination targetDestination;
    private final TabletType targetTabletType;
    private final String query;
    private final boolean dml;
    private final boolean singleShardOnly;
    
    public Send(Keyspace keyspace, Destination targetDestination, TabletType targetTabletType,
                String query, boolean dml, boolean singleShardOnly) {
        this.keyspace = keyspace;
        this.targetDestination = targetDestination;
        this.targetTabletType = targetTabletType;
        this.query = query;
        this.dml = dml;
        this.singleShardOnly = singleShardOnly;
    }
    
    @Override
    public PlanDescription describe() {
        return PlanDescription.builder("Send")
            .keyspace(keyspace)
            .targetDestination(targetDestination)
            .targetTabletType(targetTabletType)
            .field("Query", query)
            .field("IsDML", dml)
            .field("SingleShardOnly", singleShardOnly)
            .build();
    }
    
    @Override
    public PlanInputs inputs() {
        return PlanInputs.none();
    }
    
    @Override
    public String toString() {
        return "Send(" + keyspace + ", " + targetDestination + ")";
    }
}
