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

import java.util.List;

/**
 * One page of query results. Every page returned by the service starts with the CSV header;
 * {@code firstPage} tells whether it is the first page of its owning job.
 *
 * @param rows            logical CSV records, header first, without line terminators
 * @param firstPage       true for the page fetched without a locator
 * @param nextLocator     locator of the following page, null when this was the last one
 * @param numberOfRecords data row count announced by the service, -1 when absent
 */
public record ResultBatch(List<String> rows, boolean firstPage, String nextLocator, int numberOfRecords) {

    public ResultBatch {
        rows = List.copyOf(rows);
    }

    public boolean hasNext() {
        return nextLocator != null;
    }

    public String headerRow() {
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<String> dataRows() {
        return rows.size() <= 1 ? List.of() : rows.subList(1, rows.size());
    }
}
