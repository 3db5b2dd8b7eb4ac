package autoexplore.cli;

/**
 * Interrupts the exploring thread from a shutdown hook, but only while the
 * exploration is still running. Once {@link #finished()} has been called the
 * worker is left alone so the partial artifacts can be written.
 */
final class RunInterrupter {

    private final Thread worker;
    private boolean running = true;

    RunInterrupter(Thread worker) {
        this.worker = worker;
    }

    /** @return whether the worker was interrupted */
    synchronized boolean interruptIfRunning() {
        if (!running) {
            return false;
        }
        worker.interrupt();
        return true;
    }

    /**
     * Called by the worker once exploration returns. Clears an interrupt that
     * landed after the explorer stopped checking for it.
     */
    synchronized void finished() {
        running = false;
        if (Thread.currentThread() == worker) {
            Thread.interrupted();
        }
    }
}
