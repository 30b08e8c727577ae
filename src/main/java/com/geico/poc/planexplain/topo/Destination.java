package com.geico.poc.planexplain.topo;

/**
 * An explicit routing target within a keyspace.
 * <p>
 * Every implementation renders its canonical form as
 * {@code Destination<Kind>(<args>)}, for example {@code DestinationShard(-80)}.
 * Explain output relies on that naming convention.
 */
public interface Destination {
    
    String NAME_PREFIX = "Destination";
    
    /**
     * Canonical textual form, always starting with {@link #NAME_PREFIX}.
     */
    @Override
    String toString();
}
