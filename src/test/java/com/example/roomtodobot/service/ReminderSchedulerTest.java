package com.example.roomtodobot.service;

import com.example.roomtodobot.exception.ReminderRejectedException;
import com.example.roomtodobot.model.Category;
import com.example.roomtodobot.model.ReminderHandle;
import com.example.roomtodobot.model.ScheduledReminder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ReminderSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T10:30:00Z");

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ReminderDelivery delivery;

    @Mock
    private ScheduledFuture<Object> future;

    private ReminderScheduler reminderScheduler;

    @BeforeEach
    void setUp() {
        reminderScheduler = new ReminderScheduler(taskScheduler, delivery, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("a future reminder is handed to the task scheduler at its fire time")
    void schedulesAtFireTime() {
        Instant fireAt = NOW.plus(Duration.ofHours(2));

        ReminderHandle handle = reminderScheduler.schedule(fireAt, reminder(7L));

        verify(taskScheduler).schedule(any(Runnable.class), eq(fireAt));
        assertThat(handle.getTodoId()).isEqualTo(7L);
        assertThat(handle.getFireAt()).isEqualTo(fireAt);
        assertThat(reminderScheduler.pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("now and past times are rejected without arming a timer")
    void rejectsPastAndPresent() {
        assertThatThrownBy(() -> reminderScheduler.schedule(NOW, reminder(1L)))
                .isInstanceOf(ReminderRejectedException.class);
        assertThatThrownBy(() -> reminderScheduler.schedule(NOW.minusSeconds(60), reminder(1L)))
                .isInstanceOf(ReminderRejectedException.class);

        verifyNoInteractions(taskScheduler);
        assertThat(reminderScheduler.pendingCount()).isZero();
    }

    @Test
    @DisplayName("a timer delivers at most once even if it runs twice")
    void firesOnce() {
        ScheduledReminder reminder = reminder(3L);
        reminderScheduler.schedule(NOW.plusSeconds(90), reminder);
        Runnable job = capturedJobs().get(0);

        job.run();
        job.run();

        verify(delivery, times(1)).deliver(reminder);
        assertThat(reminderScheduler.pendingCount()).isZero();
    }

    @Test
    void cancelledReminderNeverDelivers() {
        ReminderHandle handle = reminderScheduler.schedule(NOW.plusSeconds(90), reminder(3L));
        Runnable job = capturedJobs().get(0);

        assertThat(reminderScheduler.cancel(handle)).isTrue();
        assertThat(reminderScheduler.cancel(handle)).isFalse();
        job.run();

        verify(delivery, never()).deliver(any());
        verify(future).cancel(false);
    }

    @Test
    @DisplayName("cancel after the reminder fired reports nothing cancelled")
    void cancelAfterFire() {
        ReminderHandle handle = reminderScheduler.schedule(NOW.plusSeconds(90), reminder(3L));
        capturedJobs().get(0).run();

        assertThat(reminderScheduler.cancel(handle)).isFalse();
        verify(delivery).deliver(any());
    }

    @Test
    void cancelForTodoOnlyTouchesThatTodo() {
        reminderScheduler.schedule(NOW.plusSeconds(60), reminder(1L));
        reminderScheduler.schedule(NOW.plusSeconds(120), reminder(1L));
        reminderScheduler.schedule(NOW.plusSeconds(180), reminder(2L));

        assertThat(reminderScheduler.cancelForTodo(1L)).isEqualTo(2);
        assertThat(reminderScheduler.pendingCount()).isEqualTo(1);

        capturedJobs().forEach(Runnable::run);
        verify(delivery, times(1)).deliver(any());
    }

    @Test
    @DisplayName("a failing delivery is contained and later reminders still fire")
    void deliveryFailureIsContained() {
        ScheduledReminder failing = reminder(1L);
        ScheduledReminder healthy = reminder(2L);
        doThrow(new IllegalStateException("chat not found")).when(delivery).deliver(failing);
        reminderScheduler.schedule(NOW.plusSeconds(60), failing);
        reminderScheduler.schedule(NOW.plusSeconds(120), healthy);

        capturedJobs().forEach(Runnable::run);

        verify(delivery).deliver(healthy);
    }

    @Test
    @DisplayName("shutdown drops pending reminders and refuses new ones")
    void shutdown() {
        reminderScheduler.schedule(NOW.plusSeconds(60), reminder(1L));
        Runnable job = capturedJobs().get(0);

        reminderScheduler.shutdown();
        job.run();

        verify(delivery, never()).deliver(any());
        assertThat(reminderScheduler.pendingCount()).isZero();
        assertThatThrownBy(() -> reminderScheduler.schedule(NOW.plusSeconds(60), reminder(2L)))
                .isInstanceOf(ReminderRejectedException.class);
    }

    private List<Runnable> capturedJobs() {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler, atLeastOnce()).schedule(captor.capture(), any(Instant.class));
        return captor.getAllValues();
    }

    private ScheduledReminder reminder(Long todoId) {
        return new ScheduledReminder(todoId, 100L, "0420", "Flat", Category.MOVIE, "Dune 2 #" + todoId,
                NOW.plusSeconds(60));
    }
}
