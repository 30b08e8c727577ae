package com.geico.poc.planexplain.topo;

/**
 * Targets every shard of the keyspace.
 */
public class DestinationAllShards implements Destination {
    
    public static final DestinationAllShards INSTANCE = new DestinationAllShards();
    
    @Override
    public String toString() {
        return "DestinationAllShards()";
    }
}
