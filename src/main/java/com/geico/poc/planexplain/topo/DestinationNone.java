package com.geico.poc.planexplain.topo;

public class DestinationNone implements Destination {
    
    public static final DestinationNone INSTANCE = new DestinationNone();
    
    @Override
    public String toString() {
        return "DestinationNone()";
    }
}
