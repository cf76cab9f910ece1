package info.mouts.foodorders.feed;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.core.task.AsyncTaskExecutor;

import info.mouts.foodorders.dto.OrderFeedEventDTO;
import info.mouts.foodorders.event.OrderChange;
import info.mouts.foodorders.event.OrderChangeStream;
import info.mouts.foodorders.event.OrderChangeSubscription;
import info.mouts.foodorders.event.OrderChangeType;
import info.mouts.foodorders.mapper.OrderMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * One administrator's live order feed connection.
 * <p>
 * Order changes arrive on the committing thread and are only translated and
 * queued there. A writer running on its own thread drains the queue into the
 * {@link FeedSink} and writes a heartbeat whenever the queue stays empty for
 * the heartbeat interval. Stopping the writer cancels its task, so a pool
 * thread that has moved on to another session is never interrupted. The
 * session ends on the first failed write or on
 * {@link #close()}, whichever comes first, and cancels its change
 * subscription exactly once.
 * </p>
 */
@Slf4j
public class OrderFeedSession implements Runnable {
    static final String CONNECTED_EVENT = "connected";

    private final String sessionId;
    private final FeedSink sink;
    private final OrderMapper orderMapper;
    private final BlockingQueue<OrderFeedEventDTO> queue;
    private final Duration heartbeatInterval;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile OrderChangeSubscription subscription;
    private volatile Future<?> writerTask;

    /**
     * Constructs an instance of {@code OrderFeedSession}.
     *
     * @param sessionId         Identifier used in logs.
     * @param sink              Destination of the events.
     * @param orderMapper       Mapper turning changes into feed payloads.
     * @param queueCapacity     Events buffered before new ones are dropped.
     * @param heartbeatInterval Idle time after which a heartbeat is written.
     */
    public OrderFeedSession(String sessionId, FeedSink sink, OrderMapper orderMapper, int queueCapacity,
            Duration heartbeatInterval) {
        this.sessionId = sessionId;
        this.sink = sink;
        this.orderMapper = orderMapper;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.heartbeatInterval = heartbeatInterval;
    }

    /**
     * Sends the {@code connected} event and subscribes to order changes. The
     * current window is queued before this method returns.
     *
     * @param changeStream stream to subscribe to
     * @param windowSize   number of most recent orders watched
     * @throws IOException if the client is already gone
     */
    public void open(OrderChangeStream changeStream, int windowSize) throws IOException {
        sink.send(CONNECTED_EVENT, Map.of("type", CONNECTED_EVENT));

        OrderChangeSubscription opened = changeStream.subscribe(windowSize, this::onChange);
        this.subscription = opened;
        if (closed.get()) {
            opened.cancel();
        }
        log.info("Feed session {} opened", sessionId);
    }

    /**
     * Translates a change into a feed event and queues it. Removals are not
     * forwarded. Never blocks; a full queue drops the event.
     *
     * @param change the committed order change
     */
    void onChange(OrderChange change) {
        if (closed.get() || change.getType() == OrderChangeType.REMOVED) {
            return;
        }

        OrderFeedEventDTO event = orderMapper.toFeedEventDto(change);
        event.setType(change.getType() == OrderChangeType.ADDED ? OrderFeedEventDTO.NEW_ORDER
                : OrderFeedEventDTO.ORDER_UPDATE);

        if (!queue.offer(event)) {
            log.warn("Feed session {} queue full, dropping {} for order {}", sessionId, event.getType(),
                    change.getOrderId());
        }
    }

    /**
     * Submits the writer to {@code executor}.
     *
     * @param executor executor owning the writer thread
     * @throws org.springframework.core.task.TaskRejectedException if no writer
     *         thread is available
     */
    public void startWriter(AsyncTaskExecutor executor) {
        Future<?> task = executor.submit(this);
        writerTask = task;
        if (closed.get()) {
            task.cancel(true);
        }
    }

    @Override
    public void run() {
        try {
            while (!closed.get()) {
                OrderFeedEventDTO event = queue.poll(heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (closed.get()) {
                    break;
                }
                if (event == null) {
                    sink.heartbeat();
                } else {
                    sink.send(event.getType(), event);
                }
            }
        } catch (IOException e) {
            log.info("Feed session {} lost its client: {}", sessionId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Feed session {} writer failed: {}", sessionId, e.getMessage(), e);
        } finally {
            close(false);
        }
    }

    /**
     * Ends the session: cancels the subscription, stops the writer and
     * completes the sink. Later calls do nothing.
     */
    public void close() {
        close(true);
    }

    private void close(boolean stopWriter) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        OrderChangeSubscription current = subscription;
        if (current != null) {
            current.cancel();
        }
        queue.clear();

        Future<?> task = writerTask;
        if (stopWriter && task != null) {
            task.cancel(true);
        }
        sink.complete();
        log.info("Feed session {} closed", sessionId);
    }

    public boolean isClosed() {
        return closed.get();
    }

    int queuedEvents() {
        return queue.size();
    }
}
