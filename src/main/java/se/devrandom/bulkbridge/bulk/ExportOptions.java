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

/**
 * Knobs for one export run.
 *
 * @param pageSize     {@code maxRecords} per result page
 * @param chunkSize    PK chunk size, null or 0 for an unchunked query
 * @param chunkWorkers threads polling and downloading partitions
 * @param pollPolicy   wait policy for the parent job and every partition
 * @param resumeJobId  id of an existing query job to continue instead of creating one
 */
public record ExportOptions(int pageSize, Integer chunkSize, int chunkWorkers, PollPolicy pollPolicy, String resumeJobId) {

    public ExportOptions {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        if (chunkWorkers <= 0) {
            throw new IllegalArgumentException("chunkWorkers must be positive");
        }
    }

    public boolean chunked() {
        return chunkSize != null && chunkSize > 0;
    }
}
