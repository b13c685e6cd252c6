package me.golemcore.agentscript.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.agentscript.domain.exception.ConversionException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Path-aware read access to a source JSON object. Missing or {@code null}
 * fields read as absent; fields of the wrong shape fail with a
 * {@link ConversionException} naming their path.
 */
public final class SourceNode {

    private final JsonNode node;
    private final String path;

    private SourceNode(JsonNode node, String path) {
        this.node = node;
        this.path = path;
    }

    public static SourceNode root(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ConversionException("$", "expected a JSON object");
        }
        return new SourceNode(node, "$");
    }

    public String path() {
        return path;
    }

    public boolean has(String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull();
    }

    /**
     * Scalar field as text; numbers and booleans are converted.
     */
    public String text(String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isContainerNode()) {
            throw new ConversionException(child(field), "expected a string");
        }
        return value.asText();
    }

    public Boolean flag(String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual() && ("true".equalsIgnoreCase(value.asText()) || "false".equalsIgnoreCase(value.asText()))) {
            return Boolean.parseBoolean(value.asText());
        }
        throw new ConversionException(child(field), "expected a boolean");
    }

    public boolean flag(String field, boolean fallback) {
        Boolean value = flag(field);
        return value != null ? value : fallback;
    }

    public JsonNode raw(String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value;
    }

    public SourceNode object(String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new ConversionException(child(field), "expected an object");
        }
        return new SourceNode(value, child(field));
    }

    /**
     * Array of objects; absent reads as empty.
     */
    public List<SourceNode> objects(String field) {
        JsonNode array = array(field);
        List<SourceNode> result = new ArrayList<>();
        if (array == null) {
            return result;
        }
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            String elementPath = child(field) + "[" + i + "]";
            if (!element.isObject()) {
                throw new ConversionException(elementPath, "expected an object");
            }
            result.add(new SourceNode(element, elementPath));
        }
        return result;
    }

    /**
     * Array of scalars as text; absent reads as empty.
     */
    public List<String> texts(String field) {
        JsonNode array = array(field);
        List<String> result = new ArrayList<>();
        if (array == null) {
            return result;
        }
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            if (element.isContainerNode()) {
                throw new ConversionException(child(field) + "[" + i + "]", "expected a string");
            }
            if (!element.isNull()) {
                result.add(element.asText());
            }
        }
        return result;
    }

    /**
     * Object whose values are all objects, in declaration order; absent
     * reads as empty.
     */
    public Map<String, SourceNode> properties(String field) {
        SourceNode container = object(field);
        Map<String, SourceNode> result = new LinkedHashMap<>();
        if (container == null) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = container.node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String entryPath = container.path + "." + entry.getKey();
            if (!entry.getValue().isObject()) {
                throw new ConversionException(entryPath, "expected an object");
            }
            result.put(entry.getKey(), new SourceNode(entry.getValue(), entryPath));
        }
        return result;
    }

    private JsonNode array(String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            throw new ConversionException(child(field), "expected an array");
        }
        return value;
    }

    private String child(String field) {
        return path + "." + field;
    }
}
