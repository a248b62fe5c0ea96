package io.postscheduler.config;

import io.postscheduler.PostScheduler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostSchedulerLifecycleTest {

    @Mock
    private PostScheduler scheduler;

    @Test
    void startAndStopShouldDelegateToScheduler() throws Exception {
        when(scheduler.awaitStopped(Duration.ofSeconds(3))).thenReturn(true);
        PostSchedulerLifecycle lifecycle = new PostSchedulerLifecycle(scheduler, true, Duration.ofSeconds(3));

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();

        lifecycle.stop();
        assertThat(lifecycle.isRunning()).isFalse();

        InOrder order = inOrder(scheduler);
        order.verify(scheduler).start();
        order.verify(scheduler).stop();
        order.verify(scheduler).awaitStopped(Duration.ofSeconds(3));
    }

    @Test
    void stopShouldNotHangWhenLoopIsBusy() throws Exception {
        when(scheduler.awaitStopped(Duration.ofMillis(10))).thenReturn(false);
        PostSchedulerLifecycle lifecycle = new PostSchedulerLifecycle(scheduler, false, Duration.ofMillis(10));

        lifecycle.stop();

        verify(scheduler).stop();
        assertThat(lifecycle.isRunning()).isFalse();
        assertThat(lifecycle.isAutoStartup()).isFalse();
    }
}
