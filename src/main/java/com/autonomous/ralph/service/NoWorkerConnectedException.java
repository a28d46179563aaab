package com.autonomous.ralph.service;

public class NoWorkerConnectedException extends RuntimeException {

    public NoWorkerConnectedException() {
        super("No worker connected");
    }
}
