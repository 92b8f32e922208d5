package com.hyperunmix.server.unmixing.error;

public class NoiseEstimationException extends NumericalException {

    public NoiseEstimationException(String message) {
        super(message);
    }
}
