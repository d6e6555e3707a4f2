package tech.yump.reconciler.reconcile;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerInterruptGuardTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("interruptIfRunning: Interrupts the worker while it is on the task")
    void interruptsWhileRunning() {
        WorkerInterruptGuard guard = new WorkerInterruptGuard(Thread.currentThread());

        assertThat(guard.interruptIfRunning()).isTrue();
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    @DisplayName("release: Clears an interrupt delivered during the task")
    void releaseClearsPendingInterrupt() {
        WorkerInterruptGuard guard = new WorkerInterruptGuard(Thread.currentThread());
        guard.interruptIfRunning();

        guard.release();

        assertThat(Thread.currentThread().isInterrupted()).isFalse();
    }

    @Test
    @DisplayName("interruptIfRunning: A timeout firing after release leaves the reused worker alone")
    void lateTimeoutDoesNotInterruptNextTask() {
        WorkerInterruptGuard finished = new WorkerInterruptGuard(Thread.currentThread());
        finished.release();

        // The same thread has moved on to the next secret when the old timer fires
        assertThat(finished.interruptIfRunning()).isFalse();
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
    }
}
