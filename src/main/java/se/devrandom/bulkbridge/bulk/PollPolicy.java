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
package se.devrandom.bulkbridge.bulk;

import java.time.Duration;

/**
 * How long to wait between status polls and how long to keep polling at all.
 * A multiplier of 1 gives a constant interval.
 */
public final class PollPolicy {
    private final Duration initialInterval;
    private final Duration maxInterval;
    private final double multiplier;
    private final Duration maxWait;

    private PollPolicy(Duration initialInterval, Duration maxInterval, double multiplier, Duration maxWait) {
        if (initialInterval.isNegative() || initialInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1");
        }
        this.initialInterval = initialInterval;
        this.maxInterval = maxInterval.compareTo(initialInterval) < 0 ? initialInterval : maxInterval;
        this.multiplier = multiplier;
        this.maxWait = maxWait;
    }

    public static PollPolicy constant(Duration interval, Duration maxWait) {
        return new PollPolicy(interval, interval, 1.0, maxWait);
    }

    public static PollPolicy exponential(Duration initialInterval, double multiplier, Duration maxInterval, Duration maxWait) {
        return new PollPolicy(initialInterval, maxInterval, multiplier, maxWait);
    }

    /**
     * Delay after the given poll (0-based), capped at the max interval.
     */
    public Duration delayAfter(int pollNumber) {
        double millis = initialInterval.toMillis() * Math.pow(multiplier, pollNumber);
        return millis >= maxInterval.toMillis() ? maxInterval : Duration.ofMillis((long) millis);
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    public Duration getInitialInterval() {
        return initialInterval;
    }

    public Duration getMaxInterval() {
        return maxInterval;
    }

    public double getMultiplier() {
        return multiplier;
    }
}
