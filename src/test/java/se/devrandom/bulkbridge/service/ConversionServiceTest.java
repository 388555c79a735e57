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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import se.devrandom.bulkbridge.config.BulkProperties;
import se.devrandom.bulkbridge.transform.MappingConfigLoader;
import se.devrandom.bulkbridge.transform.MappingSpec;
import se.devrandom.bulkbridge.transform.RecordTransformer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

class ConversionServiceTest {

    @TempDir
    Path tempDir;

    private BulkProperties properties;
    private ConversionService service;

    @BeforeEach
    void setUp() {
        properties = new BulkProperties();
        properties.setOutputDir(tempDir.resolve("output").toString());
        service = new ConversionService(new MappingConfigLoader(properties), new RecordTransformer(), properties);
    }

    @Test
    void convert_withoutOutput_writesMasterKeyFileInOutputDir() throws IOException {
        Path mapping = Files.writeString(tempDir.resolve("itm.yml"), """
                input_encoding: UTF-8
                owner_id_value: "005000000000001"
                mapping:
                  - index: 1
                    field: Name
                """);
        Path input = Files.writeString(tempDir.resolve("ITM.ALL"), "I1,Apple\nI2,Pear\n");

        ConversionService.ConversionResult result = service.convert(input, mapping, null);

        assertThat(result.rows()).isEqualTo(2);
        assertThat(result.spec().getMasterKey()).isEqualTo("ITM");
        assertThat(result.output()).isEqualTo(tempDir.resolve("output").resolve("ITM_upsert_ready.csv"));
        assertThat(Files.readString(result.output())).isEqualTo("Name,OwnerId\nApple,005000000000001\nPear,005000000000001\n");
    }

    @Test
    void defaultOutput_prefersMappingOutputCsv() {
        MappingSpec spec = new MappingSpec();
        spec.setMasterKey("DPT");
        spec.setOutputCsv("custom/dpt.csv");

        assertThat(service.defaultOutput(spec)).isEqualTo(Paths.get("custom/dpt.csv"));
    }
}
