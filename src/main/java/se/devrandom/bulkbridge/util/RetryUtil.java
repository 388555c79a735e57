/*
 * Bulkbridge - Salesforce Bulk Data Integration
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.bulkbridge.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.bulkbridge.bulk.exception.BulkApiException;

import java.util.function.Supplier;

/**
 * Utility class for executing Bulk API calls with retry logic and exponential backoff.
 * Only retries errors the exception marks as retryable (5xx, network failures, throttling).
 * Everything else propagates on the first attempt.
 */
public class RetryUtil {
    private static final Logger log = LoggerFactory.getLogger(RetryUtil.class);

    private RetryUtil() {
    }

    /**
     * @param operation      The call to execute
     * @param maxAttempts    Maximum number of attempts (e.g., 3)
     * @param initialDelayMs Initial delay in milliseconds, doubled after every failed attempt
     * @param operationName  Name of the operation for logging purposes
     * @return The result from the operation
     * @throws BulkApiException the last failure once attempts are exhausted, or the first non-retryable one
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            int maxAttempts,
            long initialDelayMs,
            String operationName) {

        for (int attempt = 1; ; attempt++) {
            try {
                return operation.get();
            } catch (BulkApiException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempts: {}", operationName, attempt, e.getMessage());
                    throw e;
                }

                // 1x, 2x, 4x, ... the initial delay
                long delayMs = initialDelayMs * (1L << (attempt - 1));

                log.warn("{} attempt {}/{} failed, retrying in {}ms: {}",
                    operationName, attempt, maxAttempts, delayMs, e.getMessage());

                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Retry of " + operationName + " interrupted", ie);
                }
            }
        }
    }
}
