package com.hyperunmix.server.unmixing.error;

/**
 * Base class for every failure raised by the unmixing pipeline.
 */
public class UnmixingException extends RuntimeException {

    public UnmixingException(String message) {
        super(message);
    }

    public UnmixingException(String message, Throwable cause) {
        super(message, cause);
    }
}
