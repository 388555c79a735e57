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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import se.devrandom.bulkbridge.bulk.BulkOperation;
import se.devrandom.bulkbridge.bulk.ExportOptions;
import se.devrandom.bulkbridge.bulk.ExportSummary;
import se.devrandom.bulkbridge.bulk.JobKind;
import se.devrandom.bulkbridge.bulk.QueryResultAssembler;
import se.devrandom.bulkbridge.config.BulkProperties;
import se.devrandom.bulkbridge.salesforce.BulkApiClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs a SOQL export into a timestamped CSV file.
 */
@Service
public class ExportService {
    private static final Logger log = LoggerFactory.getLogger(ExportService.class);

    private static final Pattern FROM_CLAUSE = Pattern.compile("(?i)\\bFROM\\s+([A-Za-z0-9_]+)");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final QueryResultAssembler assembler;
    private final BulkApiClient bulkApiClient;
    private final BulkProperties bulkProperties;
    private final Clock clock;

    public ExportService(QueryResultAssembler assembler, BulkApiClient bulkApiClient, BulkProperties bulkProperties) {
        this(assembler, bulkApiClient, bulkProperties, Clock.systemDefaultZone());
    }

    ExportService(QueryResultAssembler assembler, BulkApiClient bulkApiClient, BulkProperties bulkProperties, Clock clock) {
        this.assembler = assembler;
        this.bulkApiClient = bulkApiClient;
        this.bulkProperties = bulkProperties;
        this.clock = clock;
    }

    public ExportSummary export(ExportRequest request) {
        ExportConfig config = request.configFile() != null ? loadConfig(request.configFile()) : null;

        String soql = request.soql();
        if (soql == null && config != null) {
            soql = resolveSoql(config);
        }
        if (soql == null || soql.isBlank()) {
            if (request.resumeJobId() == null) {
                throw new IllegalArgumentException("Either a query or an export config is required");
            }
        }

        String operationName = firstNonNull(request.operation(), config == null ? null : config.operation, "query");
        BulkOperation operation = BulkOperation.fromWire(operationName);
        if (operation.kind() != JobKind.QUERY) {
            throw new IllegalArgumentException(operationName + " is not a query operation");
        }

        BulkProperties.Export defaults = bulkProperties.getExport();
        int pageSize = firstNonNull(request.pageSize(), config == null ? null : config.page, defaults.getPageSize());
        Integer chunkSize = firstNonNull(request.chunkSize(), config == null ? null : config.pkChunking, null);

        Path output = request.output();
        if (output == null && config != null && config.out != null) {
            output = Paths.get(config.out);
        }
        if (output == null) {
            output = defaultOutput(objectName(soql, config));
        }

        ExportOptions options = new ExportOptions(pageSize, chunkSize, defaults.getChunkWorkers(),
                bulkProperties.getPoll().toPolicy(), request.resumeJobId());
        log.info("Exporting to {}: {}", output, soql == null ? "(resumed job " + request.resumeJobId() + ")" : soql);
        return assembler.export(soql, operation, options, output);
    }

    ExportConfig loadConfig(Path configFile) {
        try (InputStream in = Files.newInputStream(configFile)) {
            ExportConfig config = YAML_MAPPER.readValue(in, ExportConfig.class);
            if (config == null) {
                throw new IllegalArgumentException("Export config is empty: " + configFile);
            }
            return config;
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not read export config " + configFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Literal {@code soql} wins. Otherwise builds {@code SELECT Id, ... FROM object_api} from the mapped
     * fields, dropping duplicates, fields of other objects and fields the org does not know.
     */
    String resolveSoql(ExportConfig config) {
        if (config.soql != null && !config.soql.isBlank()) {
            return config.soql.trim();
        }
        if (config.objectApi == null || config.objectApi.isBlank()) {
            throw new IllegalArgumentException("Export config needs object_api or soql");
        }

        Set<String> requested = new LinkedHashSet<>();
        Set<String> otherObject = new LinkedHashSet<>();
        for (ExportConfig.FieldRef ref : config.mappings) {
            if (ref.api == null || ref.api.isBlank()) {
                continue;
            }
            if (ref.object != null && !ref.object.equals(config.objectApi)) {
                otherObject.add(ref.api);
            } else if (!"Id".equalsIgnoreCase(ref.api)) {
                requested.add(ref.api);
            }
        }
        if (!otherObject.isEmpty()) {
            log.warn("Ignoring fields of other objects in export config: {}", otherObject);
        }

        Set<String> known = bulkApiClient.describeSObject(config.objectApi).getFieldNames();
        List<String> fields = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String field : requested) {
            if (known.contains(field)) {
                fields.add(field);
            } else {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("{}: skipping unknown field(s) {}", config.objectApi, missing);
        }

        StringBuilder soql = new StringBuilder("SELECT Id");
        for (String field : fields) {
            soql.append(", ").append(field);
        }
        soql.append(" FROM ").append(config.objectApi);
        ExportConfig.QueryOptions options = config.queryOptions;
        if (options != null) {
            if (options.where != null && !options.where.isBlank()) {
                soql.append(" WHERE ").append(options.where);
            }
            if (options.orderBy != null && !options.orderBy.isBlank()) {
                soql.append(" ORDER BY ").append(options.orderBy);
            }
            if (options.limit != null && !options.limit.isBlank()) {
                soql.append(" LIMIT ").append(options.limit);
            }
        }
        return soql.toString();
    }

    static String objectName(String soql, ExportConfig config) {
        if (config != null && config.objectApi != null && !config.objectApi.isBlank()) {
            return config.objectApi;
        }
        if (soql != null) {
            Matcher matcher = FROM_CLAUSE.matcher(soql);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return "export";
    }

    Path defaultOutput(String objectName) {
        return Paths.get(bulkProperties.getOutputDir(),
                objectName + "_" + LocalDateTime.now(clock).format(TIMESTAMP) + ".csv");
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
