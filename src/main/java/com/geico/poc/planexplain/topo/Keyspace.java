package com.geico.poc.planexplain.topo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A keyspace queries are routed to. Serialized as {@code {"Name":..,"Sharded":..}}.
 */
@JsonPropertyOrder({"Name", "Sharded"})
public class Keyspace {
    
    private final String name;
    private final boolean sharded;
    
    @JsonCreator
    public Keyspace(@JsonProperty("Name") String name, @JsonProperty("Sharded") boolean sharded) {
        this.name = Objects.requireNonNull(name, "name");
        this.sharded = sharded;
    }
    
    @JsonProperty("Name")
    public String getName() {
        return name;
    }
    
    @JsonProperty("Sharded")
    public boolean isSharded() {
        return sharded;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Keyspace)) return false;
        Keyspace other = (Keyspace) o;
        return sharded == other.sharded && name.equals(other.name);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, sharded);
    }
    
    @Override
    public String toString() {
        return name;
    }
}
