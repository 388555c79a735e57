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
package se.devrandom.bulkbridge.salesforce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Service;
import se.devrandom.bulkbridge.bulk.exception.RateLimitException;

import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Follows daily API usage through the {@code Sforce-Limit-Info} response header and stops the
 * run once a configured share of the org's daily limit is consumed.
 */
@Service
@ConditionalOnExpression("!'${bulkbridge.api-limit.stop-at-percent:}'.isEmpty()")
public class ApiLimitTracker {
    private static final Logger log = LoggerFactory.getLogger(ApiLimitTracker.class);

    private static final Pattern USAGE_PATTERN = Pattern.compile("api-usage=(\\d+)/(\\d+)");
    private static final long LOG_INTERVAL_MS = 60_000;

    private final int stopAtPercent;

    private final AtomicLong used = new AtomicLong(0);
    private final AtomicLong dailyLimit = new AtomicLong(0);
    private final AtomicLong maxAllowed = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong lastLogTime = new AtomicLong(0);

    public ApiLimitTracker(@Value("${bulkbridge.api-limit.stop-at-percent}") int stopAtPercent) {
        if (stopAtPercent <= 0 || stopAtPercent > 100) {
            throw new IllegalArgumentException("bulkbridge.api-limit.stop-at-percent must be within 1..100");
        }
        this.stopAtPercent = stopAtPercent;
        log.info("ApiLimitTracker created: will stop at {}% of daily API limit", stopAtPercent);
    }

    public void updateFromHeader(String sforceHeaderValue) {
        if (sforceHeaderValue == null) return;

        Matcher matcher = USAGE_PATTERN.matcher(sforceHeaderValue);
        if (!matcher.find()) return;

        long headerUsed = Long.parseLong(matcher.group(1));
        long headerLimit = Long.parseLong(matcher.group(2));

        used.set(headerUsed);
        if (headerLimit > 0) {
            dailyLimit.set(headerLimit);
            maxAllowed.set(headerLimit * stopAtPercent / 100);
        }

        // Throttled logging - max once per 60 seconds
        long now = System.currentTimeMillis();
        long lastLog = lastLogTime.get();
        if (now - lastLog >= LOG_INTERVAL_MS && lastLogTime.compareAndSet(lastLog, now)) {
            log.info("API Usage: {}/{} | stop at {} ({}%)", headerUsed, headerLimit, maxAllowed.get(), stopAtPercent);
        }
    }

    /**
     * @throws RateLimitException when the budget is used up; not retryable
     */
    public void checkBudget(String operation) {
        if (isLimitReached()) {
            log.warn("API LIMIT REACHED: used {} >= max allowed {} ({}% of {})",
                    used.get(), maxAllowed.get(), stopAtPercent, dailyLimit.get());
            throw RateLimitException.budgetExhausted(operation, used.get(), maxAllowed.get());
        }
    }

    public boolean isLimitReached() {
        return used.get() >= maxAllowed.get();
    }

    public long getUsedNow() {
        return used.get();
    }

    public long getMaxAllowed() {
        return maxAllowed.get();
    }
}
