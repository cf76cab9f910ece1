package info.mouts.foodorders.feed;

import java.io.IOException;

import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link FeedSink} writing Server-Sent Events through an {@link SseEmitter}.
 */
@Slf4j
public class SseEmitterFeedSink implements FeedSink {
    private final SseEmitter emitter;

    public SseEmitterFeedSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(String eventName, Object payload) throws IOException {
        emitter.send(SseEmitter.event()
                .name(eventName)
                .data(payload, MediaType.APPLICATION_JSON));
    }

    @Override
    public void heartbeat() throws IOException {
        emitter.send(SseEmitter.event().comment("heartbeat"));
    }

    @Override
    public void complete() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("Emitter already completed: {}", e.getMessage());
        }
    }
}
