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

import lombok.RequiredArgsConstructor;
import me.golemcore.agentscript.domain.model.ConversionRules;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds variable references in free text and rewrites the legacy reference
 * syntaxes ({@code {!$Name}}, {@code {$!Name}}, {@code {$Name}},
 * {@code {!Name}}) to {@code {!@variables.Name}}.
 *
 * <p>
 * References already in the canonical form are collected but never
 * rewritten, so the rewrite is idempotent.
 */
@Component
@RequiredArgsConstructor
public class VariableReferenceScanner {

    public static final Pattern CANONICAL_REFERENCE = Pattern.compile("\\{!@variables\\.([^}]+)\\}");
    private static final String CANONICAL_PREFIX = "{!@variables.";

    private final NameSanitizer nameSanitizer;

    /**
     * Rewrites legacy references in {@code text} and collects every
     * referenced name.
     */
    public ScanResult scan(String text, ConversionRules.VariableConversion conversion) {
        if (text == null || text.isEmpty()) {
            return new ScanResult(text, Set.of(), Set.of());
        }
        Set<String> rewritten = new LinkedHashSet<>();
        String result = text;
        if (conversion.isEnabled()) {
            for (Pattern legacy : conversion.legacyPatterns()) {
                result = rewriteLegacy(result, legacy, rewritten);
            }
        }
        Set<String> referenced = new LinkedHashSet<>();
        Matcher matcher = CANONICAL_REFERENCE.matcher(result);
        while (matcher.find()) {
            String name = nameSanitizer.variableName(matcher.group(1));
            if (!name.isEmpty()) {
                referenced.add(name);
            }
        }
        return new ScanResult(result, Collections.unmodifiableSet(referenced), Collections.unmodifiableSet(rewritten));
    }

    private String rewriteLegacy(String text, Pattern legacy, Set<String> rewritten) {
        Matcher matcher = legacy.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.groupCount() >= 1 ? nameSanitizer.variableName(matcher.group(1)) : "";
            if (name.isEmpty()) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            rewritten.add(name);
            matcher.appendReplacement(out, Matcher.quoteReplacement(CANONICAL_PREFIX + name + "}"));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * @param text
     *            text with legacy references rewritten
     * @param referenced
     *            every variable name referenced, in order of appearance
     * @param rewritten
     *            names that appeared in legacy syntax
     */
    public record ScanResult(String text, Set<String> referenced, Set<String> rewritten) {
    }
}
