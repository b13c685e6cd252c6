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

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Produces conformant identifiers for topics, actions, developer names and
 * variables.
 */
@Component
public class NameSanitizer {

    private static final Pattern NON_LOWER_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern NON_UPPER_ALNUM = Pattern.compile("[^A-Z0-9]+");
    private static final Pattern NON_IDENTIFIER_CHAR = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");
    private static final String INPUT_PREFIX = "Input:";
    private static final String OUTPUT_PREFIX = "Output:";

    /**
     * Lowercase key matching {@code ^[a-z][a-z0-9_]*$}.
     */
    public String topicKey(String raw) {
        String key = collapse(NON_LOWER_ALNUM, nullToEmpty(raw).toLowerCase(Locale.ROOT));
        if (key.isEmpty()) {
            return "topic";
        }
        return Character.isDigit(key.charAt(0)) ? "topic_" + key : key;
    }

    /**
     * Action name, case preserved.
     */
    public String actionName(String raw) {
        String name = collapse(NON_ALNUM, nullToEmpty(raw));
        if (name.isEmpty()) {
            return "action";
        }
        return Character.isDigit(name.charAt(0)) ? "action_" + name : name;
    }

    /**
     * Uppercase developer name, truncated to {@code maxLength} without a
     * trailing underscore.
     */
    public String developerName(String raw, int maxLength, String fallback) {
        String name = collapse(NON_UPPER_ALNUM, nullToEmpty(raw).toUpperCase(Locale.ROOT));
        if (name.length() > maxLength) {
            name = EDGE_UNDERSCORES.matcher(name.substring(0, maxLength)).replaceAll("");
        }
        return name.isEmpty() ? fallback : name;
    }

    /**
     * Variable name from a schema property or a reference body. Returns an
     * empty string when nothing usable remains.
     */
    public String variableName(String raw) {
        String name = NON_IDENTIFIER_CHAR.matcher(stripParamPrefix(nullToEmpty(raw).trim())).replaceAll("");
        if (!name.isEmpty() && Character.isDigit(name.charAt(0))) {
            return "_" + name;
        }
        return name;
    }

    /**
     * Drops the {@code Input:}/{@code Output:} prefix vendor schemas put on
     * parameter names.
     */
    public String stripParamPrefix(String raw) {
        if (raw.startsWith(INPUT_PREFIX)) {
            return raw.substring(INPUT_PREFIX.length());
        }
        if (raw.startsWith(OUTPUT_PREFIX)) {
            return raw.substring(OUTPUT_PREFIX.length());
        }
        return raw;
    }

    /**
     * {@code order_status} becomes {@code Order Status}.
     */
    public String formatLabel(String raw) {
        return Arrays.stream(nullToEmpty(raw).replace('_', ' ').trim().split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String collapse(Pattern disallowed, String value) {
        String replaced = disallowed.matcher(value).replaceAll("_");
        return EDGE_UNDERSCORES.matcher(replaced).replaceAll("");
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
