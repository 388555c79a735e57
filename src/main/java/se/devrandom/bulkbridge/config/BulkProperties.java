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
package se.devrandom.bulkbridge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import se.devrandom.bulkbridge.bulk.PollPolicy;

import java.time.Duration;

@ConfigurationProperties(prefix = "bulkbridge")
public class BulkProperties {
    private String outputDir = "output";
    private final Mapping mapping = new Mapping();
    private final Poll poll = new Poll();
    private final Retry retry = new Retry();
    private final Ingest ingest = new Ingest();
    private final Export export = new Export();

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public Mapping getMapping() {
        return mapping;
    }

    public Poll getPoll() {
        return poll;
    }

    public Retry getRetry() {
        return retry;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public Export getExport() {
        return export;
    }

    public static class Mapping {
        // Directory holding one <MASTER_KEY>.yml|.yaml|.json per master
        private String directory = "config/mappings";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Poll {
        private Duration initialInterval = Duration.ofSeconds(5);
        private Duration maxInterval = Duration.ofSeconds(30);
        private double multiplier = 1.5;
        private Duration maxWait = Duration.ofMinutes(10);

        public PollPolicy toPolicy() {
            return PollPolicy.exponential(initialInterval, multiplier, maxInterval, maxWait);
        }

        public Duration getInitialInterval() {
            return initialInterval;
        }

        public void setInitialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
        }

        public Duration getMaxInterval() {
            return maxInterval;
        }

        public void setMaxInterval(Duration maxInterval) {
            this.maxInterval = maxInterval;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxWait() {
            return maxWait;
        }

        public void setMaxWait(Duration maxWait) {
            this.maxWait = maxWait;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }
    }

    public static class Ingest {
        // Bulk API 2.0 accepts up to 150 MB per upload after base64 overhead; stay well below
        private long maxUploadBytes = 100_000_000L;
        // used when a mapping file leaves sf_object, operation or external_id_field out
        private String defaultObject;
        private String defaultOperation = "upsert";
        private String defaultExternalIdField;

        public long getMaxUploadBytes() {
            return maxUploadBytes;
        }

        public void setMaxUploadBytes(long maxUploadBytes) {
            this.maxUploadBytes = maxUploadBytes;
        }

        public String getDefaultObject() {
            return defaultObject;
        }

        public void setDefaultObject(String defaultObject) {
            this.defaultObject = defaultObject;
        }

        public String getDefaultOperation() {
            return defaultOperation;
        }

        public void setDefaultOperation(String defaultOperation) {
            this.defaultOperation = defaultOperation;
        }

        public String getDefaultExternalIdField() {
            return defaultExternalIdField;
        }

        public void setDefaultExternalIdField(String defaultExternalIdField) {
            this.defaultExternalIdField = defaultExternalIdField;
        }
    }

    public static class Export {
        private int pageSize = 100_000;
        private int chunkWorkers = 4;

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public int getChunkWorkers() {
            return chunkWorkers;
        }

        public void setChunkWorkers(int chunkWorkers) {
            this.chunkWorkers = chunkWorkers;
        }
    }
}
