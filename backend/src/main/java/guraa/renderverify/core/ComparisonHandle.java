package guraa.renderverify.core;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller-side reference to a tracked comparison.
 */
public final class ComparisonHandle {

    private final ComparisonUnit unit;

    ComparisonHandle(ComparisonUnit unit) {
        this.unit = unit;
    }

    public int getIndex() {
        return unit.getIndex();
    }

    public boolean isCompleted() {
        return unit.isCompleted();
    }

    /**
     * Waits for the comparison to finish.
     *
     * @param timeout Maximum time to wait
     * @return true if it completed within the timeout (whatever the verdict)
     */
    public boolean await(Duration timeout) {
        try {
            unit.getCompletion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            return true;
        } catch (TimeoutException | CancellationException e) {
            return false;
        }
    }
}
