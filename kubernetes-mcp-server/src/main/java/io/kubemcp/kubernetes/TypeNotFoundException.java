package io.kubemcp.kubernetes;

/**
 * Discovery does not know the requested kind or resource.
 */
public class TypeNotFoundException extends RuntimeException {

    public TypeNotFoundException(String message) {
        super(message);
    }
}
