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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative conversion of one legacy master file into a Bulk API upload CSV.
 * Read from YAML or JSON by {@link MappingConfigLoader}; unset keys keep the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MappingSpec {
    @JsonProperty("master_key")
    private String masterKey;

    @JsonProperty("sf_object")
    private String sfObject;

    private String operation;

    @JsonProperty("external_id_field")
    private String externalIdField;

    @JsonProperty("input_encoding")
    private String inputEncoding = "MS932";

    @JsonProperty("output_encoding")
    private String outputEncoding = "UTF-8";

    @JsonProperty("lineterminator")
    private String lineTerminator = "\n";

    private String delimiter = ",";

    @JsonProperty("has_header")
    private boolean hasHeader = false;

    // null or empty: no owner column
    @JsonProperty("owner_id_column")
    private String ownerIdColumn = "OwnerId";

    @JsonProperty("owner_id_value")
    private String ownerIdValue = "";

    @JsonProperty("extra_fields")
    private LinkedHashMap<String, String> extraFields = new LinkedHashMap<>();

    private List<FieldMapping> mapping = new ArrayList<>();

    @JsonProperty("output_csv")
    private String outputCsv;

    public boolean hasOwnerColumn() {
        return ownerIdColumn != null && !ownerIdColumn.isEmpty();
    }

    /**
     * Copy whose {@code column} references are replaced by indexes into the given header row.
     */
    MappingSpec resolveColumns(List<String> headerRow) {
        MappingSpec copy = copy();
        List<FieldMapping> resolved = new ArrayList<>();
        for (FieldMapping m : mapping) {
            if (m.getIndex() != null) {
                resolved.add(m);
                continue;
            }
            int idx = headerRow.indexOf(m.getColumn());
            if (idx < 0) {
                throw new MappingException("Column '" + m.getColumn() + "' mapped to " + m.getField()
                        + " is not in the input header " + headerRow);
            }
            resolved.add(new FieldMapping(idx, m.getField()));
        }
        copy.mapping = resolved;
        return copy;
    }

    private MappingSpec copy() {
        MappingSpec copy = new MappingSpec();
        copy.masterKey = masterKey;
        copy.sfObject = sfObject;
        copy.operation = operation;
        copy.externalIdField = externalIdField;
        copy.inputEncoding = inputEncoding;
        copy.outputEncoding = outputEncoding;
        copy.lineTerminator = lineTerminator;
        copy.delimiter = delimiter;
        copy.hasHeader = hasHeader;
        copy.ownerIdColumn = ownerIdColumn;
        copy.ownerIdValue = ownerIdValue;
        copy.extraFields = new LinkedHashMap<>(extraFields);
        copy.mapping = new ArrayList<>(mapping);
        copy.outputCsv = outputCsv;
        return copy;
    }

    public String getMasterKey() {
        return masterKey;
    }

    public void setMasterKey(String masterKey) {
        this.masterKey = masterKey;
    }

    public String getSfObject() {
        return sfObject;
    }

    public void setSfObject(String sfObject) {
        this.sfObject = sfObject;
    }

    public String getOperation() {
        return operation;
    }

    public void setOperation(String operation) {
        this.operation = operation;
    }

    public String getExternalIdField() {
        return externalIdField;
    }

    public void setExternalIdField(String externalIdField) {
        this.externalIdField = externalIdField;
    }

    public String getInputEncoding() {
        return inputEncoding;
    }

    public void setInputEncoding(String inputEncoding) {
        this.inputEncoding = inputEncoding;
    }

    public String getOutputEncoding() {
        return outputEncoding;
    }

    public void setOutputEncoding(String outputEncoding) {
        this.outputEncoding = outputEncoding;
    }

    public String getLineTerminator() {
        return lineTerminator;
    }

    public void setLineTerminator(String lineTerminator) {
        this.lineTerminator = lineTerminator;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    public boolean isHasHeader() {
        return hasHeader;
    }

    public void setHasHeader(boolean hasHeader) {
        this.hasHeader = hasHeader;
    }

    public String getOwnerIdColumn() {
        return ownerIdColumn;
    }

    public void setOwnerIdColumn(String ownerIdColumn) {
        this.ownerIdColumn = ownerIdColumn;
    }

    public String getOwnerIdValue() {
        return ownerIdValue;
    }

    public void setOwnerIdValue(String ownerIdValue) {
        this.ownerIdValue = ownerIdValue;
    }

    public Map<String, String> getExtraFields() {
        return extraFields;
    }

    public void setExtraFields(LinkedHashMap<String, String> extraFields) {
        this.extraFields = extraFields == null ? new LinkedHashMap<>() : extraFields;
    }

    public List<FieldMapping> getMapping() {
        return mapping;
    }

    public void setMapping(List<FieldMapping> mapping) {
        this.mapping = mapping == null ? new ArrayList<>() : mapping;
    }

    public String getOutputCsv() {
        return outputCsv;
    }

    public void setOutputCsv(String outputCsv) {
        this.outputCsv = outputCsv;
    }
}
