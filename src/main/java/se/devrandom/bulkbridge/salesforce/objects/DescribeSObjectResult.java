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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Subset of {@code /sobjects/{name}/describe} needed to check export field lists.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DescribeSObjectResult {
    public String name;
    public List<Field> fields;

    public Set<String> getFieldNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add("Id");
        if (fields != null) for (Field f : fields) names.add(f.name);
        return names;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Field {
        public String name;
        public String type;
        public Boolean createable;
        public Boolean updateable;
    }
}
