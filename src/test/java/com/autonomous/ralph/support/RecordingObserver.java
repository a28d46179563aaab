package com.autonomous.ralph.support;

import com.autonomous.ralph.model.RelayEvent;
import com.autonomous.ralph.model.RelayEventType;
import com.autonomous.ralph.service.RelayObserver;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingObserver implements RelayObserver {

    private final String id;
    private final List<RelayEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failing;

    public RecordingObserver(String id) {
        this.id = id;
    }

    public void close() {
        open = false;
    }

    public void failDeliveries() {
        failing = true;
    }

    public List<RelayEvent> events() {
        return events;
    }

    public List<RelayEventType> types() {
        return events.stream().map(RelayEvent::getType).collect(Collectors.toList());
    }

    public long count(RelayEventType type) {
        return events.stream().filter(e -> e.getType() == type).count();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void deliver(RelayEvent event) throws IOException {
        if (failing) {
            throw new IOException("broken pipe");
        }
        events.add(event);
    }
}
