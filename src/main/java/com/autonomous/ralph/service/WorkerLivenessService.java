package com.autonomous.ralph.service;

import com.autonomous.ralph.model.RelayEvent;
import com.autonomous.ralph.model.RelayEventType;
import com.autonomous.ralph.model.WorkerInfo;
import com.autonomous.ralph.protocol.MessageTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pings workers and gives up on the ones that stay silent past the grace period.
 *
 * <p>A worker given up on is dropped from the registry and its task is failed with
 * {@code worker-lost}. Tasks left behind by a plain disconnect are failed the same
 * way once they have been idle for the grace period.
 */
@Slf4j
@Service
@Profile("!worker")
public class WorkerLivenessService {

    @Value("${ralph.liveness.enabled:true}")
    private boolean enabled;

    @Value("${ralph.liveness.grace-period-ms:60000}")
    private long gracePeriodMs;

    private final WorkerRegistry registry;
    private final TaskDispatcherService dispatcher;
    private final TerminalMultiplexerService terminals;
    private final RelayBroadcaster relay;
    private final Clock clock;

    public WorkerLivenessService(WorkerRegistry registry, TaskDispatcherService dispatcher,
                                 TerminalMultiplexerService terminals, RelayBroadcaster relay, Clock clock) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.terminals = terminals;
        this.relay = relay;
        this.clock = clock;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setGracePeriodMs(long gracePeriodMs) {
        this.gracePeriodMs = gracePeriodMs;
    }

    @Scheduled(fixedDelayString = "${ralph.liveness.ping-interval-ms:15000}",
               initialDelayString = "${ralph.liveness.ping-interval-ms:15000}")
    public void sweep() {
        if (!enabled) return;

        Duration grace = Duration.ofMillis(gracePeriodMs);
        Instant cutoff = clock.instant().minus(grace);

        for (WorkerInfo worker : registry.snapshot()) {
            if (worker.getLastSeen().isBefore(cutoff)) {
                giveUp(worker);
            } else {
                ping(worker);
            }
        }

        int orphans = dispatcher.failOrphans(grace);
        if (orphans > 0) {
            log.warn("Failed {} tasks orphaned by disconnected workers", orphans);
        }
    }

    private void ping(WorkerInfo worker) {
        try {
            worker.getChannel().send(MessageTypes.PING, Map.of());
        } catch (IOException e) {
            log.warn("Ping to {} failed: {}", worker, e.getMessage());
        }
    }

    private void giveUp(WorkerInfo worker) {
        log.warn("Worker {} silent since {}, dropping it", worker, worker.getLastSeen());
        if (registry.remove(worker.getConnectionId()).isEmpty()) {
            return;
        }
        worker.getChannel().close();
        dispatcher.onWorkerLost(worker.getConnectionId());
        terminals.onWorkerDisconnected(worker.getConnectionId());

        Map<String, Object> offline = new LinkedHashMap<>();
        offline.put("workerId", worker.getConnectionId());
        offline.put("hostname", worker.getHostname());
        offline.put("reason", "liveness-timeout");
        relay.broadcast(RelayEvent.of(RelayEventType.WORKER_OFFLINE, offline));
    }
}
