package guraa.renderverify.core;

import guraa.renderverify.model.ComparisonOutcome;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Bookkeeping for a batch of comparisons running concurrently.
 *
 * The tracker does no scheduling. Producers register units from any thread; whoever
 * runs a comparison writes its outcome on the unit. Snapshots always follow
 * registration order. One tracker is meant to live for one batch and be closed with it.
 */
@Slf4j
public class ComparisonResultTracker implements AutoCloseable {

    private final List<ComparisonUnit> units = new ArrayList<>();
    private final Set<Integer> indices = new HashSet<>();
    private final AtomicInteger nextIndex = new AtomicInteger();

    /**
     * Creates a unit owning the two images and starts tracking it.
     *
     * @param master   The master image
     * @param captured The captured image
     * @return The handle of the new unit
     */
    public ComparisonHandle open(BufferedImage master, BufferedImage captured) {
        return register(new ComparisonUnit(nextIndex.getAndIncrement(), master, captured));
    }

    /**
     * Starts tracking a unit. Never blocks on other units.
     *
     * @param unit The unit to track
     * @return A handle to the unit
     * @throws IllegalArgumentException if a unit with the same index is already tracked
     */
    public ComparisonHandle register(ComparisonUnit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("Comparison unit cannot be null");
        }
        synchronized (units) {
            if (!indices.add(unit.getIndex())) {
                throw new IllegalArgumentException("A comparison with index " + unit.getIndex() + " is already tracked");
            }
            units.add(unit);
            nextIndex.accumulateAndGet(unit.getIndex() + 1, Math::max);
        }
        log.debug("Tracking comparison {}", unit.getIndex());
        return new ComparisonHandle(unit);
    }

    /**
     * @return The units' completion signals, in registration order
     */
    public List<CompletableFuture<Boolean>> completionSignals() {
        synchronized (units) {
            return units.stream()
                    .map(ComparisonUnit::getCompletion)
                    .collect(Collectors.toList());
        }
    }

    /**
     * Waits for every tracked unit to finish. Units still running when the timeout
     * expires are left as they are.
     *
     * @param timeout Maximum time to wait
     * @return true if every unit completed
     */
    public boolean awaitAll(Duration timeout) {
        List<CompletableFuture<Boolean>> signals = completionSignals();
        if (signals.isEmpty()) {
            return true;
        }

        try {
            CompletableFuture.allOf(signals.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} comparison(s)", signals.size());
        } catch (ExecutionException | CancellationException e) {
            log.debug("At least one comparison failed or was released: {}", e.getMessage());
        } catch (TimeoutException e) {
            log.warn("Timed out after {} ms waiting for comparisons", timeout.toMillis());
        }

        return signals.stream().allMatch(CompletableFuture::isDone)
                && signals.stream().noneMatch(CompletableFuture::isCancelled);
    }

    /**
     * @return The outcome of every tracked unit, in registration order
     */
    public List<ComparisonOutcome> results() {
        synchronized (units) {
            return units.stream()
                    .map(unit -> new ComparisonOutcome(unit.getIndex(), unit.isSucceeded(), unit.isCompleted()))
                    .collect(Collectors.toList());
        }
    }

    public int size() {
        synchronized (units) {
            return units.size();
        }
    }

    /**
     * Releases every tracked unit, including ones that never completed, and forgets them.
     * Does not wait for running comparisons.
     */
    public void clearAll() {
        List<ComparisonUnit> released;
        synchronized (units) {
            released = new ArrayList<>(units);
            units.clear();
            indices.clear();
        }

        long unfinished = released.stream().filter(unit -> !unit.isCompleted()).count();
        for (ComparisonUnit unit : released) {
            unit.close();
        }
        if (!released.isEmpty()) {
            log.debug("Released {} comparison(s), {} unfinished", released.size(), unfinished);
        }
    }

    @Override
    public void close() {
        clearAll();
    }
}
