package com.clauselens.infrastructure.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

@Slf4j
public class SseStatusEventSink implements StatusEventSink {

    private final SseEmitter emitter;
    private final ObjectMapper objectMapper;

    public SseStatusEventSink(SseEmitter emitter, ObjectMapper objectMapper) {
        this.emitter = emitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(String eventName, Object payload) throws IOException {
        try {
            emitter.send(SseEmitter.event()
                    .name(eventName)
                    .data(objectMapper.writeValueAsString(payload)));
        } catch (IllegalStateException e) {
            // Emitter already completed
            throw new IOException("SSE stream is closed", e);
        }
    }

    @Override
    public void complete() {
        emitter.complete();
    }

    @Override
    public void onClose(Runnable callback) {
        emitter.onCompletion(callback);
        emitter.onTimeout(callback);
        emitter.onError(e -> {
            log.debug("[StatusStream] SSE connection error: {}", e.getMessage());
            callback.run();
        });
    }

    public SseEmitter getEmitter() {
        return emitter;
    }
}
