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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits CSV text into logical records without re-quoting them, so pages can be concatenated byte for byte.
 */
public final class CsvRecords {

    private CsvRecords() {
    }

    /**
     * Reads complete CSV records (which may span multiple lines if fields contain newlines).
     * Accepts LF and CRLF terminators; the terminator is not part of the record.
     */
    public static List<String> split(String text) {
        List<String> records = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return records;
        }
        StringBuilder record = new StringBuilder();
        boolean inQuotes = false;
        int length = text.length();

        for (int i = 0; i < length; i++) {
            char ch = text.charAt(i);
            if (ch == '"') {
                // "" inside quotes is an escaped quote and leaves the quote state unchanged
                record.append(ch);
                if (inQuotes && i + 1 < length && text.charAt(i + 1) == '"') {
                    record.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (ch == '\n' && !inQuotes) {
                records.add(record.toString());
                record.setLength(0);
            } else if (ch == '\r' && !inQuotes && i + 1 < length && text.charAt(i + 1) == '\n') {
                records.add(record.toString());
                record.setLength(0);
                i++;
            } else {
                record.append(ch);
            }
        }

        if (record.length() > 0) {
            records.add(record.toString());
        }
        return records;
    }
}
