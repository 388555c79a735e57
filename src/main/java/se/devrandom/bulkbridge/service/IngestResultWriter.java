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
package se.devrandom.bulkbridge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import se.devrandom.bulkbridge.bulk.IngestResults;
import se.devrandom.bulkbridge.config.BulkProperties;
import se.devrandom.bulkbridge.util.CsvRecords;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Saves the per-record results of an ingest job. Each result set is written twice: as returned by
 * the service (UTF-8, LF) and in a spreadsheet friendly form (UTF-8 with BOM, CRLF).
 */
@Component
public class IngestResultWriter {
    private static final Logger log = LoggerFactory.getLogger(IngestResultWriter.class);
    private static final String BOM = "\uFEFF";

    private final BulkProperties bulkProperties;

    public IngestResultWriter(BulkProperties bulkProperties) {
        this.bulkProperties = bulkProperties;
    }

    public List<Path> write(String masterKey, IngestResults results) {
        Path dir = Paths.get(bulkProperties.getOutputDir());
        String prefix = results.getJobId() + "_" + masterKey;
        try {
            Files.createDirectories(dir);
            Path success = write(dir.resolve(prefix + "_success.csv"), results.getSuccessCsv());
            Path error = write(dir.resolve(prefix + "_error.csv"), results.getFailureCsv());
            Path successExcel = write(dir.resolve(prefix + "_success_excel.csv"), toExcel(results.getSuccessCsv()));
            Path errorExcel = write(dir.resolve(prefix + "_error_excel.csv"), toExcel(results.getFailureCsv()));
            log.info("Saved results of job {} to {}", results.getJobId(), dir.toAbsolutePath());
            return List.of(success, error, successExcel, errorExcel);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not save results of job " + results.getJobId(), e);
        }
    }

    private static Path write(Path file, String content) throws IOException {
        return Files.writeString(file, content == null ? "" : content, StandardCharsets.UTF_8);
    }

    static String toExcel(String csv) {
        StringBuilder sb = new StringBuilder(BOM);
        for (String record : CsvRecords.split(csv)) {
            sb.append(record).append("\r\n");
        }
        return sb.toString();
    }
}
