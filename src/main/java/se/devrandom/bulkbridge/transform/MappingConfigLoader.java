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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import se.devrandom.bulkbridge.bulk.BulkOperation;
import se.devrandom.bulkbridge.bulk.JobKind;
import se.devrandom.bulkbridge.config.BulkProperties;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads mapping files (YAML or JSON) and keeps a registry of them by master key.
 */
@Component
public class MappingConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(MappingConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final BulkProperties bulkProperties;

    public MappingConfigLoader(BulkProperties bulkProperties) {
        this.bulkProperties = bulkProperties;
    }

    /**
     * Parses one mapping file and fills job defaults. Only the conversion part is validated here,
     * see {@link #validateForIngest(MappingSpec)} for the job settings.
     */
    public MappingSpec load(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new MappingException("Mapping file not found: " + configPath);
        }
        String fileName = configPath.getFileName().toString();
        String lower = fileName.toLowerCase(Locale.ROOT);
        ObjectMapper mapper;
        if (lower.endsWith(".yml") || lower.endsWith(".yaml")) {
            mapper = YAML_MAPPER;
        } else if (lower.endsWith(".json")) {
            mapper = JSON_MAPPER;
        } else {
            throw new MappingException("Mapping file must end in .yml, .yaml or .json: " + configPath);
        }

        MappingSpec spec;
        try (InputStream in = Files.newInputStream(configPath)) {
            spec = mapper.readValue(in, MappingSpec.class);
        } catch (IOException e) {
            throw new MappingException("Could not parse mapping file " + configPath + ": " + e.getMessage(), e);
        }
        if (spec == null) {
            throw new MappingException("Mapping file is empty: " + configPath);
        }

        if (isBlank(spec.getMasterKey())) {
            spec.setMasterKey(fileName.substring(0, fileName.lastIndexOf('.')).toUpperCase(Locale.ROOT));
        }
        BulkProperties.Ingest defaults = bulkProperties.getIngest();
        if (isBlank(spec.getSfObject())) {
            spec.setSfObject(blankToNull(defaults.getDefaultObject()));
        }
        if (isBlank(spec.getOperation())) {
            spec.setOperation(blankToNull(defaults.getDefaultOperation()));
        }
        if (isBlank(spec.getExternalIdField())) {
            spec.setExternalIdField(blankToNull(defaults.getDefaultExternalIdField()));
        }

        validateMapping(spec, configPath);
        log.debug("Loaded mapping {} from {} ({} field(s))", spec.getMasterKey(), configPath, spec.getMapping().size());
        return spec;
    }

    private void validateMapping(MappingSpec spec, Path source) {
        if (spec.getMapping().isEmpty()) {
            throw new MappingException(source + ": 'mapping' must contain at least one entry");
        }
        Set<String> fields = new HashSet<>();
        for (FieldMapping m : spec.getMapping()) {
            if (isBlank(m.getField())) {
                throw new MappingException(source + ": mapping entry " + m + " has no 'field'");
            }
            if (m.getIndex() == null && isBlank(m.getColumn())) {
                throw new MappingException(source + ": mapping entry for " + m.getField() + " needs 'index' or 'column'");
            }
            if (m.getIndex() != null && m.getIndex() < 0) {
                throw new MappingException(source + ": negative index for " + m.getField());
            }
            if (m.getIndex() == null && !spec.isHasHeader()) {
                throw new MappingException(source + ": 'column' for " + m.getField() + " requires has_header: true");
            }
            if (!fields.add(m.getField())) {
                throw new MappingException(source + ": field " + m.getField() + " is mapped twice");
            }
        }
        if (spec.hasOwnerColumn() && !fields.add(spec.getOwnerIdColumn())) {
            throw new MappingException(source + ": owner column " + spec.getOwnerIdColumn() + " is also mapped");
        }
        for (String extra : spec.getExtraFields().keySet()) {
            if (!fields.add(extra)) {
                throw new MappingException(source + ": extra field " + extra + " is also mapped");
            }
        }
        if (spec.getDelimiter() == null || spec.getDelimiter().isEmpty()) {
            throw new MappingException(source + ": delimiter must not be empty");
        }
        if (spec.getLineTerminator() == null || spec.getLineTerminator().isEmpty()) {
            throw new MappingException(source + ": lineterminator must not be empty");
        }
        checkCharset(spec.getInputEncoding(), source);
        checkCharset(spec.getOutputEncoding(), source);
    }

    private static void checkCharset(String name, Path source) {
        try {
            Charset.forName(name);
        } catch (RuntimeException e) {
            throw new MappingException(source + ": unsupported encoding '" + name + "'", e);
        }
    }

    /**
     * Checks the settings needed to create an ingest job from this mapping.
     *
     * @return the parsed operation
     */
    public BulkOperation validateForIngest(MappingSpec spec) {
        if (isBlank(spec.getSfObject())) {
            throw new MappingException(spec.getMasterKey() + ": no sf_object configured");
        }
        BulkOperation operation;
        try {
            operation = BulkOperation.fromWire(spec.getOperation());
        } catch (IllegalArgumentException e) {
            throw new MappingException(spec.getMasterKey() + ": " + e.getMessage(), e);
        }
        if (operation.kind() != JobKind.INGEST) {
            throw new MappingException(spec.getMasterKey() + ": " + operation.wireName() + " is not an ingest operation");
        }
        if (operation == BulkOperation.UPSERT && isBlank(spec.getExternalIdField())) {
            throw new MappingException(spec.getMasterKey() + ": upsert requires external_id_field");
        }
        return operation;
    }

    /**
     * All mapping files in the configured directory, keyed by master key.
     */
    public Map<String, MappingSpec> loadRegistry() {
        Path directory = Paths.get(bulkProperties.getMapping().getDirectory());
        if (!Files.isDirectory(directory)) {
            throw new MappingException("Mapping directory not found: " + directory.toAbsolutePath());
        }
        Map<String, MappingSpec> registry = new TreeMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.{yml,yaml,json}")) {
            for (Path file : files) {
                MappingSpec spec = load(file);
                MappingSpec previous = registry.put(spec.getMasterKey(), spec);
                if (previous != null) {
                    throw new MappingException("Master key " + spec.getMasterKey() + " is defined twice in " + directory);
                }
            }
        } catch (IOException e) {
            throw new MappingException("Could not list mapping directory " + directory, e);
        }
        log.info("Loaded {} mapping(s) from {}: {}", registry.size(), directory, registry.keySet());
        return registry;
    }

    public MappingSpec forMasterKey(String masterKey) {
        Map<String, MappingSpec> registry = loadRegistry();
        MappingSpec spec = registry.get(masterKey);
        if (spec == null) {
            throw new MappingException("No mapping for master key " + masterKey + ". Available: " + registry.keySet());
        }
        validateForIngest(spec);
        return spec;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
