package com.geico.poc.planexplain.topo;

/**
 * Type of tablet a query may be sent to. {@link #UNKNOWN} means no explicit target.
 */
public enum TabletType {
    UNKNOWN,
    PRIMARY,
    MASTER,
    REPLICA,
    RDONLY,
    BATCH,
    SPARE,
    EXPERIMENTAL,
    BACKUP,
    RESTORE,
    DRAINED;
    
    public boolean isUnknown() {
        return this == UNKNOWN;
    }
}
