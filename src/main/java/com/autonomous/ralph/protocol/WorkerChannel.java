package com.autonomous.ralph.protocol;

import java.io.IOException;

/**
 * Hub-side handle on one worker connection.
 */
public interface WorkerChannel {

    String getConnectionId();

    boolean isOpen();

    void send(String type, Object payload) throws IOException;

    void close();
}
