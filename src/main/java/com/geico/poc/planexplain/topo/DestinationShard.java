package com.geico.poc.planexplain.topo;

import java.util.Objects;

/**
 * Targets exactly one shard by name.
 */
public class DestinationShard implements Destination {
    
    private final String shard;
    
    public DestinationShard(String shard) {
        this.shard = Objects.requireNonNull(shard, "shard");
    }
    
    @Override
    public String toString() {
        return "DestinationShard(" + shard + ")";
    }
}
