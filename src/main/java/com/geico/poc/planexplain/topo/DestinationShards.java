package com.geico.poc.planexplain.topo;

import java.util.List;

/**
 * Targets a fixed list of shards.
 */
public class DestinationShards implements Destination {
    
    private final List<String> shards;
    
    public DestinationShards(List<String> shards) {
        this.shards = List.copyOf(shards);
    }
    
    @Override
    public String toString() {
        return "DestinationShards(" + String.join(",", shards) + ")";
    }
}
