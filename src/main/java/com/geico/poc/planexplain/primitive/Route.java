package com.geico.poc.planexplain.primitive;

import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.plan.PlanInputs;
import com.geico.poc.planexplain.plan.PlanNode;
import com.geico.poc.planexplain.topo.Keyspace;

import java.util.Objects;

/**
 * Sends a query to one or more shards of a keyspace.
 */
public class Route implements PlanNode {
    
    /**
     * How the shards to query are chosen
     */
    public enum Opcode {
        Unsharded,
        EqualUnique,
        Equal,
        IN,
        MultiEqual,
        Scatter,
        Next,
        DBA,
        Reference,
        None,
        ByDestination
    }
    
    private final Opcode opcode;
    private final Keyspace keyspace;
    private final String query;
    private final String fieldQuery;
    private final String tableName;
    private int queryTimeout;
    private boolean scatterErrorsAsWarnings;
    
    public Route(Opcode opcode, Keyspace keyspace, String query, String fieldQuery, String tableName) {
        this.opcode = Objects.requireNonNull(opcode, "opcode");
        this.keyspace = keyspace;
        this.query = query;
        this.fieldQuery = fieldQuery;
        this.tableName = tableName;
    }
    
    public Route withQueryTimeout(int queryTimeout) {
        this.queryTimeout = queryTimeout;
        return this;
    }
    
    public Route withScatterErrorsAsWarnings(boolean scatterErrorsAsWarnings) {
        this.scatterErrorsAsWarnings = scatterErrorsAsWarnings;
        return this;
    }
    
    @Override
    public PlanDescription describe() {
        return PlanDescription.builder("Route")
            .variant(opcode.name())
            .keyspace(keyspace)
            .field("Query", query)
            .field("FieldQuery", fieldQuery)
            .field("Table", tableName)
            .field("QueryTimeout", queryTimeout)
            .field("ScatterErrorsAsWarnings", scatterErrorsAsWarnings)
            .build();
    }
    
    @Override
    public PlanInputs inputs() {
        return PlanInputs.none();
    }
    
    @Override
    public String toString() {
        return "Route(" + opcode + ", " + keyspace + ", " + query + ")";
    }
}
