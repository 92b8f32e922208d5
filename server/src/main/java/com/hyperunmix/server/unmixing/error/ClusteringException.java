package com.hyperunmix.server.unmixing.error;

public class ClusteringException extends UnmixingException {

    public ClusteringException(String message) {
        super(message);
    }

    public ClusteringException(String message, Throwable cause) {
        super(message, cause);
    }
}
