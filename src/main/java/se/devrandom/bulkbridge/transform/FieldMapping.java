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
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One source column to Salesforce field assignment. The source is either a 0-based {@code index}
 * or, for inputs with a header row, a {@code column} name. In mapping files a textual {@code index}
 * ({@code index: "ColName"}) is read as a column name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldMapping {
    private Integer index;
    private String column;
    private String field;

    public FieldMapping() {
    }

    public FieldMapping(int index, String field) {
        this.index = index;
        this.field = field;
    }

    public Integer getIndex() {
        return index;
    }

    @JsonSetter("index")
    void setIndexNode(JsonNode node) {
        if (node == null || node.isNull()) {
            index = null;
        } else if (node.isIntegralNumber()) {
            index = node.intValue();
        } else if (node.isTextual()) {
            index = null;
            column = node.textValue();
        } else {
            throw new IllegalArgumentException("'index' must be a number or a column name, was " + node);
        }
    }

    public String getColumn() {
        return column;
    }

    public void setColumn(String column) {
        this.column = column;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    @Override
    public String toString() {
        return (index != null ? String.valueOf(index) : "'" + column + "'") + " -> " + field;
    }
}
