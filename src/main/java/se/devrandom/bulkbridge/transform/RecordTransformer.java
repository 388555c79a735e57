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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts legacy master-data files into Bulk API upload CSVs according to a {@link MappingSpec}.
 * Decoding and encoding are strict: a byte or character that does not fit the configured charset
 * fails the conversion instead of being replaced.
 */
@Component
public class RecordTransformer {
    private static final Logger log = LoggerFactory.getLogger(RecordTransformer.class);

    /**
     * Output column names: mapped fields in declaration order, then the owner column, then extra fields.
     */
    public List<String> header(MappingSpec spec) {
        List<String> header = new ArrayList<>();
        for (FieldMapping m : spec.getMapping()) {
            header.add(m.getField());
        }
        if (spec.hasOwnerColumn()) {
            header.add(spec.getOwnerIdColumn());
        }
        header.addAll(spec.getExtraFields().keySet());
        return header;
    }

    /**
     * Maps one source row. Columns not referenced by the mapping are dropped.
     *
     * @param lineNumber 1-based row number, used in error messages
     * @throws MappingException when a mapped index is beyond the end of the row
     */
    public List<String> transform(List<String> row, MappingSpec spec, long lineNumber) {
        List<String> out = new ArrayList<>(spec.getMapping().size() + 1 + spec.getExtraFields().size());
        for (FieldMapping m : spec.getMapping()) {
            Integer index = m.getIndex();
            if (index == null) {
                throw new MappingException("Column '" + m.getColumn() + "' has not been resolved against a header row");
            }
            if (index >= row.size()) {
                throw new MappingException(String.format("Row %d has %d column(s), mapping for %s needs index %d",
                        lineNumber, row.size(), m.getField(), index));
            }
            out.add(row.get(index));
        }
        if (spec.hasOwnerColumn()) {
            out.add(spec.getOwnerIdValue() == null ? "" : spec.getOwnerIdValue());
        }
        for (Map.Entry<String, String> extra : spec.getExtraFields().entrySet()) {
            out.add(extra.getValue() == null ? "" : extra.getValue());
        }
        return out;
    }

    /**
     * Converts a whole file. The output is written next to its final location and moved into place
     * when complete, so a failed conversion never leaves a partial CSV behind.
     *
     * @return number of data rows written
     */
    public int convert(Path input, MappingSpec spec, Path output) {
        Charset inputCharset = Charset.forName(spec.getInputEncoding());
        Charset outputCharset = Charset.forName(spec.getOutputEncoding());
        CharsetEncoder encoder = outputCharset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CSVFormat outputFormat = CSVFormat.DEFAULT.builder()
                .setRecordSeparator(spec.getLineTerminator())
                .build();

        String text = decode(input, inputCharset);
        Path target = output.toAbsolutePath();
        Path temp = null;
        int rows = 0;
        try (CSVParser parser = CSVParser.parse(text, inputFormat(spec))) {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".part");

            try (OutputStream out = Files.newOutputStream(temp)) {
                MappingSpec effective = spec;
                boolean headerPending = spec.isHasHeader();
                writeLine(out, outputFormat.format(header(spec).toArray()), spec, encoder, output, 1);

                for (CSVRecord record : parser) {
                    List<String> values = record.toList();
                    if (headerPending) {
                        effective = spec.resolveColumns(values);
                        headerPending = false;
                        continue;
                    }
                    List<String> mapped = transform(values, effective, record.getRecordNumber());
                    rows++;
                    writeLine(out, outputFormat.format(mapped.toArray()), spec, encoder, output, rows + 1);
                }
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            temp = null;
        } catch (IOException e) {
            throw new UncheckedIOException("Conversion of " + input + " to " + output + " failed", e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
                }
            }
        }
        log.info("Converted {} row(s) from {} to {} ({} -> {})", rows, input, output,
                inputCharset.name(), outputCharset.name());
        return rows;
    }

    /**
     * Reads an upload CSV produced by {@link #convert(Path, MappingSpec, Path)} (or prepared by hand)
     * using the output side of the mapping.
     */
    public CsvTable readCsv(Path csv, MappingSpec spec) {
        String text = decode(csv, Charset.forName(spec.getOutputEncoding()));
        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(text, CSVFormat.DEFAULT)) {
            for (CSVRecord record : parser) {
                if (header == null) {
                    header = record.toList();
                } else {
                    rows.add(record.toList());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + csv, e);
        }
        if (header == null) {
            throw new MappingException(csv + " is empty, expected a header row");
        }
        return new CsvTable(header, rows);
    }

    private static CSVFormat inputFormat(MappingSpec spec) {
        return CSVFormat.DEFAULT.builder()
                .setDelimiter(spec.getDelimiter())
                .build();
    }

    private static void writeLine(OutputStream out, String line, MappingSpec spec, CharsetEncoder encoder,
                                  Path output, long lineNumber) throws IOException {
        try {
            ByteBuffer bytes = encoder.reset().encode(CharBuffer.wrap(line + spec.getLineTerminator()));
            out.write(bytes.array(), bytes.arrayOffset() + bytes.position(), bytes.remaining());
        } catch (CharacterCodingException e) {
            throw new EncodingException("Value not representable in " + encoder.charset().name(), output, lineNumber, e);
        }
    }

    /**
     * Decodes the whole file strictly. A leading byte order mark is dropped.
     *
     * @throws EncodingException naming the line of the first malformed byte sequence
     */
    static String decode(Path file, Charset charset) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes);
        CharBuffer out = CharBuffer.allocate((int) (bytes.length * (double) decoder.maxCharsPerByte()) + 16);
        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            throw new EncodingException("Invalid " + charset.name() + " byte sequence", file,
                    lineOf(bytes, in.position()), null);
        }
        out.flip();
        String text = out.toString();
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    private static long lineOf(byte[] bytes, int position) {
        long line = 1;
        for (int i = 0; i < position && i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                line++;
            }
        }
        return line;
    }
}
