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
package se.devrandom.bulkbridge.transform;

import java.nio.file.Path;

/**
 * Bytes that are not valid in the input charset, or characters the output charset cannot represent.
 */
public class EncodingException extends TransformException {
    private final Path file;
    private final long lineNumber;

    public EncodingException(String message, Path file, long lineNumber, Throwable cause) {
        super(String.format("%s (%s, line %d)", message, file, lineNumber), cause);
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public Path getFile() {
        return file;
    }

    /**
     * 1-based.
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
