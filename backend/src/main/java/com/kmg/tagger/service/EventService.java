package com.kmg.tagger.service;

import com.kmg.tagger.dto.EventMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-sent job and per-image events. A subscriber that connects while a batch is running
 * first receives the most recent event, so it can show where the batch is.
 */
@Service
public class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    public static final String JOB_STARTED = "job-started";
    public static final String JOB_COMPLETED = "job-completed";
    public static final String JOB_FAILED = "job-failed";
    public static final String ITEM_COMPLETED = "item-completed";
    public static final String ITEM_FAILED = "item-failed";

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final AtomicReference<EventMessage> latest = new AtomicReference<>();

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L);
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(ex -> emitters.remove(emitter));

        EventMessage last = latest.get();
        if (last != null) {
            send(emitter, last);
        }
        return emitter;
    }

    public void publish(String type, String jobId, String message, Object payload) {
        EventMessage event = new EventMessage(type, jobId, message, OffsetDateTime.now().toString(), payload);
        latest.set(event);
        for (SseEmitter emitter : emitters) {
            send(emitter, event);
        }
    }

    public Optional<EventMessage> latest() {
        return Optional.ofNullable(latest.get());
    }

    private void send(SseEmitter emitter, EventMessage event) {
        try {
            emitter.send(SseEmitter.event().name(event.type()).data(event));
        } catch (IOException | IllegalStateException e) {
            log.debug("Removing SSE emitter after send failure: {}", e.getMessage());
            emitters.remove(emitter);
        }
    }
}
