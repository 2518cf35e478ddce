package com.musicgraph.harvester.discovery;

import com.musicgraph.harvester.Utils;
import com.musicgraph.harvester.catalog.CatalogServiceInterface;
import com.musicgraph.harvester.error.OperationCancelledException;
import com.musicgraph.harvester.model.YearRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides whether a candidate has releases inside the requested year range.
 * <p>
 * Each attempt is bounded by a timeout; failed attempts are retried with doubling backoff. When
 * every attempt fails the answer is {@code true}: a wrongly admitted artist costs a few empty
 * downloads, a wrongly rejected one is lost from the run.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class YearContentProbe implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(YearContentProbe.class);

    private final CatalogServiceInterface catalog;
    private final int maxAttempts;
    private final Duration attemptTimeout;
    private final Duration initialBackoff;
    private final ExecutorService attempts;

    public YearContentProbe(CatalogServiceInterface catalog) {
        this(catalog, 3, Duration.ofSeconds(10), Duration.ofSeconds(1));
    }

    public YearContentProbe(CatalogServiceInterface catalog, int maxAttempts, Duration attemptTimeout, Duration initialBackoff) {
        this.catalog = catalog;
        this.maxAttempts = maxAttempts;
        this.attemptTimeout = attemptTimeout;
        this.initialBackoff = initialBackoff;
        AtomicInteger counter = new AtomicInteger();
        this.attempts = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "year-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param artistId candidate artist
     * @param years inclusive range
     * @return false only when the catalog positively reported no content in range
     * @throws OperationCancelledException if the calling thread is interrupted
     */
    public boolean hasContent(String artistId, YearRange years) {
        Boolean result = Utils.retryWithBackoff(() -> attempt(artistId, years), maxAttempts, initialBackoff,
            "year probe for artist " + artistId);
        if (result == null) {
            logger.warn("Could not check {} content for artist {}, including it", years, artistId);
            return true;
        }
        return result;
    }

    private boolean attempt(String artistId, YearRange years) throws Exception {
        Future<Boolean> future = attempts.submit(() -> catalog.hasContentInYears(artistId, years));
        try {
            return future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Year probe for " + artistId + " timed out after " + attemptTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted during year probe for " + artistId);
        }
    }

    @Override
    public void close() {
        attempts.shutdownNow();
    }
}
