package info.mouts.foodorders.feed;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import info.mouts.foodorders.event.OrderChangeListener;
import info.mouts.foodorders.event.OrderChangeStream;
import info.mouts.foodorders.event.OrderChangeSubscription;
import info.mouts.foodorders.mapper.OrderMapper;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class LiveOrderFeedServiceImplTest {
    @Mock
    private OrderChangeStream changeStream;

    @Mock
    private OrderChangeSubscription subscription;

    @Mock
    private OrderMapper orderMapper;

    @Mock
    private AsyncTaskExecutor feedExecutor;

    private LiveOrderFeedServiceImpl feedService;

    @BeforeEach
    void setUp() {
        feedService = new LiveOrderFeedServiceImpl(changeStream, orderMapper, feedExecutor, 50, 16,
                Duration.ofSeconds(30), Duration.ZERO);
        when(changeStream.subscribe(anyInt(), any(OrderChangeListener.class))).thenReturn(subscription);
        when(subscription.cancel()).thenReturn(true);
    }

    @Test
    @DisplayName("Should subscribe with the configured window and hand the writer to the executor")
    void shouldStartWriter() {
        SseEmitter emitter = feedService.openFeed();

        assertNotNull(emitter);
        verify(changeStream).subscribe(eq(50), any(OrderChangeListener.class));
        verify(feedExecutor).submit(any(Runnable.class));
        verify(subscription, never()).cancel();
    }

    @Test
    @DisplayName("Should release the subscription when no writer thread is available")
    void shouldCloseSessionWhenExecutorRejects() {
        when(feedExecutor.submit(any(Runnable.class))).thenThrow(new TaskRejectedException("pool exhausted"));

        feedService.openFeed();

        verify(subscription).cancel();
    }
}
