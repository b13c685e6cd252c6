package me.golemcore.agentscript.infrastructure.config;

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

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentscript.domain.exception.InvalidRulesException;
import me.golemcore.agentscript.domain.model.ConversionRules;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the rule document named by {@code converter.rules.location} once at
 * startup and hands out the resulting {@link ConversionRules}.
 *
 * <p>
 * Rule documents are overlays: anything they leave out, or set to
 * {@code null}, keeps its built-in value. A missing document falls back to the built-in rules unless
 * {@code converter.rules.fail-on-missing} is set.
 */
@Service
@Slf4j
public class ConversionRulesLoader {

    private final ConverterProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final ObjectMapper overlayMapper;
    private volatile ConversionRules rules = ConversionRules.defaults();

    public ConversionRulesLoader(ConverterProperties properties, ResourceLoader resourceLoader,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.overlayMapper = objectMapper.copy()
                .setDefaultSetterInfo(JsonSetter.Value.forValueNulls(Nulls.SKIP, Nulls.SKIP));
    }

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * Re-read the rule document.
     */
    public void reload() {
        rules = load(properties.getRules().getLocation());
    }

    /**
     * Rules currently in effect.
     */
    public ConversionRules getRules() {
        return rules;
    }

    /**
     * Current rules with {@code overrides} laid over them. The current rules
     * are left untouched.
     */
    public ConversionRules withOverrides(JsonNode overrides) {
        ConversionRules copy = overlay(ConversionRules.defaults(), objectMapper.valueToTree(rules));
        return overlay(copy, overrides);
    }

    private ConversionRules load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            if (properties.getRules().isFailOnMissing()) {
                throw new InvalidRulesException("Rule document not found: " + location, null);
            }
            log.warn("[Rules] No rule document at {}, using built-in rules", location);
            return ConversionRules.defaults();
        }
        try (InputStream is = resource.getInputStream()) {
            ConversionRules loaded = overlay(ConversionRules.defaults(), objectMapper.readTree(is));
            log.info("[Rules] Loaded from {}: {} security rules, {} variable patterns", location,
                    loaded.getSecurityRules().size(), loaded.getVariableConversion().getPatterns().size());
            return loaded;
        } catch (IOException e) {
            throw new InvalidRulesException("Failed to read rule document " + location + ": " + e.getMessage(), e);
        }
    }

    private ConversionRules overlay(ConversionRules base, JsonNode overrides) {
        if (overrides == null || overrides.isNull()) {
            return base;
        }
        if (!overrides.isObject()) {
            throw new InvalidRulesException("Rule document must be a JSON object", null);
        }
        try {
            ConversionRules merged = overlayMapper.readerForUpdating(base).readValue(overrides);
            merged.getVariableConversion().legacyPatterns();
            return merged;
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidRulesException("Invalid rule document: " + e.getMessage(), e);
        }
    }
}
