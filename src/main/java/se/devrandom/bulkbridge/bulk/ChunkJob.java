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

import se.devrandom.bulkbridge.salesforce.objects.BulkJobInfo;

import java.time.Instant;

/**
 * One PK-chunk partition of a chunked query. Owned by its parent job;
 * {@link #getPartition()} is the position in the server's chunk listing and defines merge order.
 */
public class ChunkJob extends BulkJob {
    private final String parentJobId;
    private final int partition;

    ChunkJob(BulkJobInfo info, BulkJob parent, int partition, Instant now) {
        super(info.getId(), parent.getOperation(), parent.getTarget(), null,
                info.getState() == null ? JobState.UPLOAD_COMPLETE : JobState.fromWire(info.getState()), now);
        this.parentJobId = parent.getJobId();
        this.partition = partition;
        copyCounters(info);
        markClosedIfTerminal(now);
    }

    public String getParentJobId() {
        return parentJobId;
    }

    public int getPartition() {
        return partition;
    }

    /**
     * Label used in logs and failure reports, e.g. {@code #2 (750xx0000001)}.
     */
    public String describe() {
        return "#" + partition + " (" + getJobId() + ")";
    }
}
