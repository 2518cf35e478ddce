package com.musicgraph.harvester;

import com.musicgraph.harvester.error.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Utility class for common helper methods used in discovery and file operations.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {
    }

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\\\\\s]", "_");
    }

    /**
     * Retries an action up to {@code maxAttempts} times, doubling the delay after each failure.
     * <p>
     * The first retry waits {@code initialDelay}, the next twice that, and so on; there is no wait
     * after the last attempt. A cancelled action, or an interrupt while waiting, stops retrying with an
     * {@link OperationCancelledException} and keeps the interrupt flag set.
     *
     * @param action Callable action to execute
     * @param maxAttempts Maximum number of attempts
     * @param initialDelay delay before the first retry
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return Result of action, or null if all attempts fail
     * @throws OperationCancelledException if the action was cancelled or the thread was interrupted
     */
    public static <T> T retryWithBackoff(Callable<T> action, int maxAttempts, Duration initialDelay, String actionDesc) {
        long delayMs = initialDelay.toMillis();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.call();
            } catch (OperationCancelledException e) {
                throw e;
            } catch (Exception e) {
                logger.debug("Failed {} (attempt {}/{}): {}", actionDesc, attempt, maxAttempts, e.getMessage());
                if (attempt == maxAttempts) break;
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new OperationCancelledException("Interrupted while retrying " + actionDesc);
                }
                delayMs *= 2;
            }
        }
        logger.warn("Giving up on {} after {} attempts.", actionDesc, maxAttempts);
        return null;
    }
}
