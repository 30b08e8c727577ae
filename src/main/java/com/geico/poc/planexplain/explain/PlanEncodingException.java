package com.geico.poc.planexplain.explain;

/**
 * Exception thrown when a plan cannot be described, serialized or exported
 */
public class PlanEncodingException extends RuntimeException {
    
    public PlanEncodingException(String message) {
        super(message);
    }
    
    public PlanEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
