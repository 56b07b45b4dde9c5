package com.ai.reservation.service;

import com.ai.reservation.dto.ReservationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Relays reservation events to connected dashboards over server-sent events.
 * Delivery is best effort; a subscriber that fails a send is dropped.
 */
@Service
public class DashboardEventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(DashboardEventBroadcaster.class);

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L);
        emitters.add(emitter);

        Runnable remove = () -> emitters.remove(emitter);
        emitter.onCompletion(remove);
        emitter.onTimeout(remove);
        emitter.onError(e -> remove.run());

        log.info("Dashboard subscribed ({} connected)", emitters.size());
        return emitter;
    }

    public void publish(List<ReservationEvent> events) {
        if (events.isEmpty() || emitters.isEmpty()) {
            return;
        }
        for (ReservationEvent event : events) {
            for (SseEmitter emitter : emitters) {
                try {
                    emitter.send(SseEmitter.event()
                            .name(event.type().wireName())
                            .data(event));
                } catch (IOException | IllegalStateException e) {
                    log.debug("Dropping dashboard subscriber: {}", e.getMessage());
                    emitters.remove(emitter);
                }
            }
        }
    }
}
