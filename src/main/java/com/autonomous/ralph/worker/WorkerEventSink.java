package com.autonomous.ralph.worker;

/**
 * Outbound side of the worker connection. Implementations must accept calls from
 * several threads and keep each thread's frames in order.
 */
public interface WorkerEventSink {

    void emit(String type, Object payload);
}
