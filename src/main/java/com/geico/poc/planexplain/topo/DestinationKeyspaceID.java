package com.geico.poc.planexplain.topo;

import java.util.HexFormat;

/**
 * Targets the shard owning a keyspace id. Rendered as lowercase hex.
 */
public class DestinationKeyspaceID implements Destination {
    
    private final byte[] keyspaceId;
    
    public DestinationKeyspaceID(byte[] keyspaceId) {
        this.keyspaceId = keyspaceId.clone();
    }
    
    @Override
    public String toString() {
        return "DestinationKeyspaceID(" + HexFormat.of().formatHex(keyspaceId) + ")";
    }
}
