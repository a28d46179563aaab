package com.autonomous.ralph.service;

import com.autonomous.ralph.model.RelayEvent;

import java.io.IOException;

/**
 * A client watching relayed task and terminal events.
 */
public interface RelayObserver {

    String getId();

    boolean isOpen();

    void deliver(RelayEvent event) throws IOException;
}
