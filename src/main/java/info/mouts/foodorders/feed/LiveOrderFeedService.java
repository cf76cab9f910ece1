package info.mouts.foodorders.feed;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

public interface LiveOrderFeedService {
    /**
     * Opens a live order feed for one administrator connection.
     *
     * @return The emitter the events are streamed through.
     */
    SseEmitter openFeed();

    int activeSessions();
}
