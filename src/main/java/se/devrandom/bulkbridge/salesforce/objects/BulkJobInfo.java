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
package se.devrandom.bulkbridge.salesforce.objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Job info returned by {@code /jobs/ingest} and {@code /jobs/query} (create, get, patch).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BulkJobInfo {

    private String id;
    private String operation;
    private String object;
    private String createdById;
    private String createdDate;
    private String systemModstamp;
    private String state;
    private String externalIdFieldName;
    private String concurrencyMode;
    private String contentType;
    private String apiVersion;
    private String lineEnding;
    private String columnDelimiter;
    private String jobType;
    private Long numberRecordsProcessed;
    private Long numberRecordsFailed;
    private Integer retries;
    private Long totalProcessingTime;
    private String errorMessage;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOperation() { return operation; }
    public void setOperation(String operation) { this.operation = operation; }

    public String getObject() { return object; }
    public void setObject(String object) { this.object = object; }

    public String getCreatedById() { return createdById; }
    public void setCreatedById(String createdById) { this.createdById = createdById; }

    public String getCreatedDate() { return createdDate; }
    public void setCreatedDate(String createdDate) { this.createdDate = createdDate; }

    public String getSystemModstamp() { return systemModstamp; }
    public void setSystemModstamp(String systemModstamp) { this.systemModstamp = systemModstamp; }

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }

    public String getExternalIdFieldName() { return externalIdFieldName; }
    public void setExternalIdFieldName(String externalIdFieldName) { this.externalIdFieldName = externalIdFieldName; }

    public String getConcurrencyMode() { return concurrencyMode; }
    public void setConcurrencyMode(String concurrencyMode) { this.concurrencyMode = concurrencyMode; }

    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }

    public String getApiVersion() { return apiVersion; }
    public void setApiVersion(String apiVersion) { this.apiVersion = apiVersion; }

    public String getLineEnding() { return lineEnding; }
    public void setLineEnding(String lineEnding) { this.lineEnding = lineEnding; }

    public String getColumnDelimiter() { return columnDelimiter; }
    public void setColumnDelimiter(String columnDelimiter) { this.columnDelimiter = columnDelimiter; }

    public String getJobType() { return jobType; }
    public void setJobType(String jobType) { this.jobType = jobType; }

    public Long getNumberRecordsProcessed() { return numberRecordsProcessed; }
    public void setNumberRecordsProcessed(Long numberRecordsProcessed) { this.numberRecordsProcessed = numberRecordsProcessed; }

    public Long getNumberRecordsFailed() { return numberRecordsFailed; }
    public void setNumberRecordsFailed(Long numberRecordsFailed) { this.numberRecordsFailed = numberRecordsFailed; }

    public Integer getRetries() { return retries; }
    public void setRetries(Integer retries) { this.retries = retries; }

    public Long getTotalProcessingTime() { return totalProcessingTime; }
    public void setTotalProcessingTime(Long totalProcessingTime) { this.totalProcessingTime = totalProcessingTime; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
}
