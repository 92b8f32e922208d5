package com.hyperunmix.server.unmixing;

/**
 * Cooperative cancellation flag polled between units of work.
 */
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();
}
