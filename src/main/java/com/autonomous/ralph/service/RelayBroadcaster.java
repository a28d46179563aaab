package com.autonomous.ralph.service;

import com.autonomous.ralph.model.RelayEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Broadcasts every relay event to every connected observer.
 *
 * <p>Delivery happens on the caller's thread, in observer registration order. No
 * filtering and no replay: an observer only sees events broadcast after it joined.
 */
@Slf4j
@Service
@Profile("!worker")
public class RelayBroadcaster {

    private final List<RelayObserver> observers = new CopyOnWriteArrayList<>();
    private final Map<String, RelayObserver> byId = new ConcurrentHashMap<>();

    public void register(RelayObserver observer) {
        if (byId.putIfAbsent(observer.getId(), observer) == null) {
            observers.add(observer);
            log.debug("Observer connected: {} ({} total)", observer.getId(), observers.size());
        }
    }

    public void unregister(String observerId) {
        RelayObserver removed = byId.remove(observerId);
        if (removed != null) {
            observers.remove(removed);
            log.debug("Observer disconnected: {} ({} total)", observerId, observers.size());
        }
    }

    public void broadcast(RelayEvent event) {
        for (RelayObserver observer : observers) {
            if (!observer.isOpen()) {
                unregister(observer.getId());
                continue;
            }
            try {
                observer.deliver(event);
            } catch (Exception e) {
                log.warn("Dropping observer {} after failed delivery of {}: {}",
                    observer.getId(), event.getType().getWireName(), e.getMessage());
                unregister(observer.getId());
            }
        }
    }

    public int observerCount() {
        return observers.size();
    }
}
