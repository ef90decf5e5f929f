package com.williamcallahan.media_list_sync.scheduler;

import com.williamcallahan.media_list_sync.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CronTriggerSourceTest {

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> future;

    private CronTriggerSource triggerSource;

    @BeforeEach
    void setUp() {
        triggerSource = new CronTriggerSource(taskScheduler, ZoneOffset.UTC);
    }

    @Test
    void bind_schedulesSixFieldCronTrigger() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        Runnable firing = () -> { };

        ScheduledTrigger trigger = triggerSource.bind("sync", "0 */6 * * *", firing);

        ArgumentCaptor<Trigger> captor = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler).schedule(eq(firing), captor.capture());
        assertThat(captor.getValue()).isInstanceOf(CronTrigger.class);
        assertThat(((CronTrigger) captor.getValue()).getExpression()).isEqualTo("0 0 */6 * * *");
        assertThat(trigger.isActive()).isTrue();
        assertThat(trigger.nextFireTime()).isPresent();
    }

    @Test
    void stop_cancelsWithoutInterrupting() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        ScheduledTrigger trigger = triggerSource.bind("sync", "*/5 * * * *", () -> { });

        trigger.stop();
        trigger.stop();

        verify(future, times(1)).cancel(false);
        assertThat(trigger.isActive()).isFalse();
        assertThat(trigger.nextFireTime()).isEmpty();
    }

    @Test
    void start_afterStop_reschedules() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        ScheduledTrigger trigger = triggerSource.bind("sync", "*/5 * * * *", () -> { });

        trigger.stop();
        trigger.start();
        trigger.start();

        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Trigger.class));
        assertThat(trigger.isActive()).isTrue();
    }

    @Test
    void validate_rejectsInvalidExpression() {
        assertThatThrownBy(() -> triggerSource.validate("every five minutes"))
                .isInstanceOf(ConfigurationException.class);
    }
}
