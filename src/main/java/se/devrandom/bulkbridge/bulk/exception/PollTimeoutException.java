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
package se.devrandom.bulkbridge.bulk.exception;

import se.devrandom.bulkbridge.bulk.JobState;

import java.time.Duration;

/**
 * The polling budget ran out while the job was still running.
 * The job is left running server-side; poll again with the same job id to resume.
 */
public class PollTimeoutException extends BulkApiException {
    private final JobState lastState;
    private final Duration waited;

    public PollTimeoutException(String jobId, JobState lastState, Duration waited) {
        super(String.format("Gave up waiting after %ds, job still %s", waited.toSeconds(), lastState),
                "pollUntilDone", jobId);
        this.lastState = lastState;
        this.waited = waited;
    }

    public JobState getLastState() {
        return lastState;
    }

    public Duration getWaited() {
        return waited;
    }
}
