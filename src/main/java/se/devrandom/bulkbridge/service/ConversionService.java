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

import org.springframework.stereotype.Service;
import se.devrandom.bulkbridge.config.BulkProperties;
import se.devrandom.bulkbridge.transform.MappingConfigLoader;
import se.devrandom.bulkbridge.transform.MappingSpec;
import se.devrandom.bulkbridge.transform.RecordTransformer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Offline ALL to CSV conversion. Needs no Salesforce connection.
 */
@Service
public class ConversionService {
    private final MappingConfigLoader mappingConfigLoader;
    private final RecordTransformer recordTransformer;
    private final BulkProperties bulkProperties;

    public ConversionService(MappingConfigLoader mappingConfigLoader, RecordTransformer recordTransformer,
                             BulkProperties bulkProperties) {
        this.mappingConfigLoader = mappingConfigLoader;
        this.recordTransformer = recordTransformer;
        this.bulkProperties = bulkProperties;
    }

    public ConversionResult convert(Path input, Path mappingFile, Path output) {
        return convert(input, mappingConfigLoader.load(mappingFile), output);
    }

    /**
     * @param output target file, or null for the mapping's {@code output_csv} or
     *               {@code <outputDir>/<masterKey>_upsert_ready.csv}
     */
    public ConversionResult convert(Path input, MappingSpec spec, Path output) {
        Path target = output != null ? output : defaultOutput(spec);
        int rows = recordTransformer.convert(input, spec, target);
        return new ConversionResult(spec, target, rows);
    }

    Path defaultOutput(MappingSpec spec) {
        if (spec.getOutputCsv() != null && !spec.getOutputCsv().isBlank()) {
            return Paths.get(spec.getOutputCsv());
        }
        return Paths.get(bulkProperties.getOutputDir(), spec.getMasterKey() + "_upsert_ready.csv");
    }

    public record ConversionResult(MappingSpec spec, Path output, int rows) {
    }
}
