package com.hyperunmix.server.unmixing.error;

/**
 * A decomposition or solve that could not be recovered by flooring or fallback.
 */
public class NumericalException extends UnmixingException {

    public NumericalException(String message) {
        super(message);
    }

    public NumericalException(String message, Throwable cause) {
        super(message, cause);
    }
}
