package com.hyperunmix.server.unmixing.error;

/**
 * Bad shapes or out-of-range parameters, raised before any heavy computation.
 */
public class ValidationException extends UnmixingException {

    public ValidationException(String message) {
        super(message);
    }
}
