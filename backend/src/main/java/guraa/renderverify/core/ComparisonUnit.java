package guraa.renderverify.core;

import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One comparison between a master and a capture, run independently of the others.
 *
 * The unit owns both images until it is closed. Its outcome can be written once; later
 * writes are ignored. Closing a unit that has not completed cancels its completion
 * signal so nobody keeps waiting on it.
 */
@Slf4j
public class ComparisonUnit implements AutoCloseable {

    private final int index;
    private final CompletableFuture<Boolean> completion = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile BufferedImage master;
    private volatile BufferedImage captured;

    public ComparisonUnit(int index, BufferedImage master, BufferedImage captured) {
        this.index = index;
        this.master = master;
        this.captured = captured;
    }

    public int getIndex() {
        return index;
    }

    public BufferedImage getMaster() {
        checkOpen();
        return master;
    }

    public BufferedImage getCaptured() {
        checkOpen();
        return captured;
    }

    /**
     * @return Signal that completes with the outcome, or is cancelled when the unit is released
     */
    public CompletableFuture<Boolean> getCompletion() {
        return completion;
    }

    /**
     * Records the outcome of the comparison.
     *
     * @param succeeded Whether the capture matched its master
     * @return true if this call wrote the outcome, false if one was already recorded
     */
    public boolean complete(boolean succeeded) {
        boolean written = completion.complete(succeeded);
        if (!written) {
            log.debug("Comparison {} already has an outcome, ignoring {}", index, succeeded);
        }
        return written;
    }

    /**
     * Records that the comparison could not run to a verdict.
     *
     * @param error The failure
     * @return true if this call wrote the outcome
     */
    public boolean fail(Throwable error) {
        log.warn("Comparison {} failed: {}", index, error.getMessage());
        return completion.completeExceptionally(error);
    }

    public boolean isCompleted() {
        return completion.isDone() && !completion.isCancelled();
    }

    /**
     * @return true if the comparison completed and the images matched
     */
    public boolean isSucceeded() {
        return isCompleted() && !completion.isCompletedExceptionally() && Boolean.TRUE.equals(completion.getNow(false));
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Releases the images and the completion signal. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (completion.cancel(false)) {
            log.debug("Released comparison {} before it completed", index);
        }
        release(master);
        release(captured);
        master = null;
        captured = null;
    }

    private static void release(BufferedImage image) {
        if (image != null) {
            image.flush();
        }
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Comparison " + index + " has been released");
        }
    }
}
