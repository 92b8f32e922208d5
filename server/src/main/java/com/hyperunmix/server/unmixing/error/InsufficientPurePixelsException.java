package com.hyperunmix.server.unmixing.error;

/**
 * The purity percentile selected no pixel. Always fatal to endmember extraction.
 */
public class InsufficientPurePixelsException extends UnmixingException {

    public InsufficientPurePixelsException(String message) {
        super(message);
    }
}
