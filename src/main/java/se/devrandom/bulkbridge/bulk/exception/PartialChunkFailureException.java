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

import java.util.List;

public class PartialChunkFailureException extends DataConsistencyException {
    private final List<String> failedPartitions;

    public PartialChunkFailureException(String parentJobId, List<String> failedPartitions) {
        this(String.format("%d partition(s) did not complete: %s", failedPartitions.size(),
                String.join(", ", failedPartitions)), parentJobId, failedPartitions);
    }

    private PartialChunkFailureException(String message, String parentJobId, List<String> failedPartitions) {
        super(message, "export", parentJobId);
        this.failedPartitions = List.copyOf(failedPartitions);
    }

    /**
     * The parent completed but listed no partitions, so there is no result set to merge.
     */
    public static PartialChunkFailureException noPartitions(String parentJobId) {
        return new PartialChunkFailureException("Chunked job " + parentJobId + " completed without listing any chunk jobs",
                parentJobId, List.of());
    }

    public List<String> getFailedPartitions() {
        return failedPartitions;
    }
}
