package com.geico.poc.planexplain.topo;

/**
 * Targets any single shard of the keyspace.
 */
public class DestinationAnyShard implements Destination {
    
    public static final DestinationAnyShard INSTANCE = new DestinationAnyShard();
    
    @Override
    public String toString() {
        return "DestinationAnyShard()";
    }
}
