package com.eduhub.tenant;

/**
 * Thrown when an internal endpoint is called without a valid service key.
 */
public class ServiceKeyRejectedException extends RuntimeException {
    
    public ServiceKeyRejectedException(String message) {
        super(message);
    }
}
