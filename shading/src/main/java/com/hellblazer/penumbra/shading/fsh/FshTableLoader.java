/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Penumbra.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.penumbra.shading.fsh;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.penumbra.shading.Orientation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.Month;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads reduction factor tables from JSON.
 * <p>
 * The document holds a {@code tables} array; each table has an {@code id}, a {@code kind} of {@code SCALAR} or
 * {@code CATEGORIZED}, an optional {@code description} and {@code values} keyed by month number (1-12), then by
 * {@link Orientation} name and, for categorized tables, by ho category label. Every value must lie in [0, 1].
 *
 * @author hal.hildebrand
 */
public final class FshTableLoader {

    private static final Logger       log    = LoggerFactory.getLogger(FshTableLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FshTableLoader() {
    }

    public static FshTables loadResource(String resource) throws IOException {
        try (InputStream is = FshTableLoader.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Fsh table resource not found: " + resource);
            }
            var tables = load(is);
            log.info("Loaded Fsh tables {} from {}", tables.getTableIds(), resource);
            return tables;
        }
    }

    public static FshTables load(InputStream is) throws IOException {
        var root = MAPPER.readTree(is);
        var tables = root == null ? null : root.get("tables");
        if (tables == null || !tables.isArray()) {
            throw new FshTableFormatException("Invalid Fsh table document: missing tables array");
        }

        var scalar = new HashMap<String, ScalarFshTable>();
        var categorized = new HashMap<String, CategorizedFshTable>();
        for (var table : tables) {
            var id = requiredText(table, "id");
            if (scalar.containsKey(id) || categorized.containsKey(id)) {
                throw new FshTableFormatException("Duplicate Fsh table: " + id);
            }
            var description = table.path("description").asText("");
            var values = table.get("values");
            if (values == null || !values.isObject()) {
                throw new FshTableFormatException("Table " + id + " has no values object");
            }
            var kind = requiredText(table, "kind");
            switch (kind) {
                case "SCALAR" -> scalar.put(id, new ScalarFshTable(id, description, parseScalar(id, values)));
                case "CATEGORIZED" -> categorized.put(id, new CategorizedFshTable(id, description,
                                                                                  parseCategorized(id, values)));
                default -> throw new FshTableFormatException("Table " + id + " has unknown kind: " + kind);
            }
            log.debug("Parsed Fsh table {} ({})", id, kind);
        }
        return new FshTables(scalar, categorized);
    }

    private static Map<Month, Map<Orientation, Double>> parseScalar(String id, JsonNode values)
    throws FshTableFormatException {
        var result = new EnumMap<Month, Map<Orientation, Double>>(Month.class);
        var months = values.fields();
        while (months.hasNext()) {
            var monthEntry = months.next();
            var month = parseMonth(id, monthEntry.getKey());
            var row = new EnumMap<Orientation, Double>(Orientation.class);
            var cells = monthEntry.getValue().fields();
            while (cells.hasNext()) {
                var cell = cells.next();
                row.put(parseOrientation(id, cell.getKey()), parseValue(id, cell.getValue()));
            }
            result.put(month, row);
        }
        return result;
    }

    private static Map<Month, Map<Orientation, Map<HoCategory, Double>>> parseCategorized(String id,
                                                                                         JsonNode values)
    throws FshTableFormatException {
        var result = new EnumMap<Month, Map<Orientation, Map<HoCategory, Double>>>(Month.class);
        var months = values.fields();
        while (months.hasNext()) {
            var monthEntry = months.next();
            var month = parseMonth(id, monthEntry.getKey());
            var row = new EnumMap<Orientation, Map<HoCategory, Double>>(Orientation.class);
            var orientations = monthEntry.getValue().fields();
            while (orientations.hasNext()) {
                var orientationEntry = orientations.next();
                var orientation = parseOrientation(id, orientationEntry.getKey());
                var cells = new EnumMap<HoCategory, Double>(HoCategory.class);
                var categories = orientationEntry.getValue().fields();
                while (categories.hasNext()) {
                    var cell = categories.next();
                    cells.put(parseCategory(id, cell.getKey()), parseValue(id, cell.getValue()));
                }
                row.put(orientation, cells);
            }
            result.put(month, row);
        }
        return result;
    }

    private static String requiredText(JsonNode node, String field) throws FshTableFormatException {
        var value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new FshTableFormatException("Fsh table entry is missing text field '" + field + "'");
        }
        return value.asText();
    }

    private static Month parseMonth(String id, String key) throws FshTableFormatException {
        try {
            return Month.of(Integer.parseInt(key));
        } catch (NumberFormatException | DateTimeException e) {
            throw new FshTableFormatException("Table " + id + " has invalid month: " + key, e);
        }
    }

    private static Orientation parseOrientation(String id, String key) throws FshTableFormatException {
        try {
            var orientation = Orientation.valueOf(key);
            if (orientation == Orientation.UNKNOWN) {
                throw new FshTableFormatException("Table " + id + " has an entry for " + key);
            }
            return orientation;
        } catch (IllegalArgumentException e) {
            throw new FshTableFormatException("Table " + id + " has invalid orientation: " + key, e);
        }
    }

    private static HoCategory parseCategory(String id, String key) throws FshTableFormatException {
        try {
            return HoCategory.fromLabel(key);
        } catch (IllegalArgumentException e) {
            throw new FshTableFormatException("Table " + id + " has invalid ho category: " + key, e);
        }
    }

    private static double parseValue(String id, JsonNode node) throws FshTableFormatException {
        if (!node.isNumber()) {
            throw new FshTableFormatException("Table " + id + " has non numeric value: " + node);
        }
        double value = node.asDouble();
        if (value < 0.0 || value > 1.0) {
            throw new FshTableFormatException("Table " + id + " has value outside [0, 1]: " + value);
        }
        return value;
    }
}
