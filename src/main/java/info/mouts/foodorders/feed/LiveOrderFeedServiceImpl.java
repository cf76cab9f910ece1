package info.mouts.foodorders.feed;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import info.mouts.foodorders.event.OrderChangeStream;
import info.mouts.foodorders.mapper.OrderMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link LiveOrderFeedService} interface.
 * Each connection gets its own {@link OrderFeedSession}, whose writer runs on
 * the {@code orderFeedExecutor}. Completion, timeout or error of the emitter
 * closes the session.
 */
@Service
@Slf4j
public class LiveOrderFeedServiceImpl implements LiveOrderFeedService {
    private final OrderChangeStream changeStream;
    private final OrderMapper orderMapper;
    private final AsyncTaskExecutor feedExecutor;
    private final int windowSize;
    private final int queueCapacity;
    private final Duration heartbeatInterval;
    private final Duration emitterTimeout;

    /**
     * Constructs an instance of {@code LiveOrderFeedServiceImpl}.
     *
     * @param changeStream      The stream sessions subscribe to.
     * @param orderMapper       The mapper turning changes into feed payloads.
     * @param feedExecutor      The executor running the session writers.
     * @param windowSize        Number of most recent orders a session watches.
     * @param queueCapacity     Events buffered per session.
     * @param heartbeatInterval Idle time after which a heartbeat is written.
     * @param emitterTimeout    Lifetime of a connection, zero for unlimited.
     */
    public LiveOrderFeedServiceImpl(OrderChangeStream changeStream, OrderMapper orderMapper,
            @Qualifier("orderFeedExecutor") AsyncTaskExecutor feedExecutor,
            @Value("${app.feed.window-size:50}") int windowSize,
            @Value("${app.feed.queue-capacity:256}") int queueCapacity,
            @Value("${app.feed.heartbeat-interval:30s}") Duration heartbeatInterval,
            @Value("${app.feed.emitter-timeout:0s}") Duration emitterTimeout) {
        this.changeStream = changeStream;
        this.orderMapper = orderMapper;
        this.feedExecutor = feedExecutor;
        this.windowSize = windowSize;
        this.queueCapacity = queueCapacity;
        this.heartbeatInterval = heartbeatInterval;
        this.emitterTimeout = emitterTimeout;
    }

    @Override
    public SseEmitter openFeed() {
        SseEmitter emitter = new SseEmitter(emitterTimeout.toMillis());
        String sessionId = UUID.randomUUID().toString();
        OrderFeedSession session = new OrderFeedSession(sessionId, new SseEmitterFeedSink(emitter), orderMapper,
                queueCapacity, heartbeatInterval);

        emitter.onCompletion(session::close);
        emitter.onTimeout(session::close);
        emitter.onError(error -> {
            log.debug("Feed session {} emitter error: {}", sessionId, error.getMessage());
            session.close();
        });

        try {
            session.open(changeStream, windowSize);
            session.startWriter(feedExecutor);
        } catch (IOException e) {
            log.info("Feed session {} client left before the feed started", sessionId);
            session.close();
        } catch (TaskRejectedException e) {
            log.warn("Rejecting feed session {}: no writer available", sessionId);
            session.close();
        }

        return emitter;
    }

    @Override
    public int activeSessions() {
        return changeStream.activeSubscriptions();
    }
}
