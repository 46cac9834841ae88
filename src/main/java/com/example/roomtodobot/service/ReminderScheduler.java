package com.example.roomtodobot.service;

import com.example.roomtodobot.exception.ReminderRejectedException;
import com.example.roomtodobot.model.ReminderHandle;
import com.example.roomtodobot.model.ScheduledReminder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One-shot reminder timers kept in memory. Each job fires its delivery at most once, whichever of
 * fire and cancel wins the race.
 */
@Slf4j
@Component
public class ReminderScheduler {

    private final TaskScheduler taskScheduler;
    private final ReminderDelivery delivery;
    private final Clock clock;

    private final Map<Long, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicLong jobSequence = new AtomicLong();
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public ReminderScheduler(TaskScheduler taskScheduler, ReminderDelivery delivery, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.delivery = delivery;
        this.clock = clock;
    }

    /**
     * Arms a timer for {@code fireAt}.
     *
     * @throws ReminderRejectedException when fireAt is not strictly in the future or after shutdown
     */
    public ReminderHandle schedule(Instant fireAt, ScheduledReminder payload) {
        if (!accepting.get()) {
            throw new ReminderRejectedException("Reminder scheduler is shut down");
        }
        Instant now = clock.instant();
        if (!fireAt.isAfter(now)) {
            throw new ReminderRejectedException("Reminder time " + fireAt + " is not in the future");
        }

        Job job = new Job(jobSequence.incrementAndGet(), payload);
        jobs.put(job.id, job);
        job.future = taskScheduler.schedule(job::fire, fireAt);
        log.info("Reminder {} for todo {} scheduled at {}", job.id, payload.getTodoId(), fireAt);
        return new ReminderHandle(job.id, payload.getTodoId(), fireAt);
    }

    public boolean cancel(ReminderHandle handle) {
        Job job = jobs.get(handle.getJobId());
        return job != null && job.cancel();
    }

    /**
     * Cancels whatever is pending for the todo, e.g. after it was deleted
     *
     * @return number of cancelled jobs
     */
    public int cancelForTodo(Long todoId) {
        int cancelled = 0;
        for (Job job : jobs.values()) {
            if (Objects.equals(job.payload.getTodoId(), todoId) && job.cancel()) cancelled++;
        }
        return cancelled;
    }

    public int pendingCount() {
        return jobs.size();
    }

    /**
     * Stops accepting reminders and cancels the pending ones. Jobs already firing complete.
     */
    @PreDestroy
    public void shutdown() {
        if (!accepting.getAndSet(false)) return;
        int cancelled = 0;
        for (Job job : jobs.values()) {
            if (job.cancel()) cancelled++;
        }
        log.info("Reminder scheduler stopped, {} pending reminders dropped", cancelled);
    }

    private final class Job {
        private final long id;
        private final ScheduledReminder payload;
        private final AtomicBoolean done = new AtomicBoolean();
        private volatile ScheduledFuture<?> future;

        private Job(long id, ScheduledReminder payload) {
            this.id = id;
            this.payload = payload;
        }

        private void fire() {
            if (!done.compareAndSet(false, true)) return;
            jobs.remove(id);
            try {
                delivery.deliver(payload);
            } catch (RuntimeException e) {
                log.error("Reminder {} delivery failed: {}", id, e.getMessage(), e);
            }
        }

        private boolean cancel() {
            if (!done.compareAndSet(false, true)) return false;
            jobs.remove(id);
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) scheduled.cancel(false);
            return true;
        }
    }
}
