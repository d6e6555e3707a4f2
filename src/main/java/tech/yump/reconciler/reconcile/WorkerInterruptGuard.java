package tech.yump.reconciler.reconcile;

/**
 * Lets a timeout interrupt the worker thread only while that worker is still on the task it was armed for.
 * Pool threads are reused, so an interrupt that arrives after the task ends would hit the next secret.
 */
final class WorkerInterruptGuard {

    private final Thread worker;
    private boolean running = true;

    WorkerInterruptGuard(Thread worker) {
        this.worker = worker;
    }

    /**
     * @return {@code true} if the worker was still on the task and has been interrupted
     */
    synchronized boolean interruptIfRunning() {
        if (!running) {
            return false;
        }
        worker.interrupt();
        return true;
    }

    /**
     * Called by the worker as it leaves the task. Clears any interrupt delivered while it was running.
     */
    synchronized void release() {
        running = false;
        Thread.interrupted();
    }
}
