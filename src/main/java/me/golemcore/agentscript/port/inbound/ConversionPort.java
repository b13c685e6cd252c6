package me.golemcore.agentscript.port.inbound;

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
import me.golemcore.agentscript.domain.model.ConversionResult;
import me.golemcore.agentscript.domain.model.ConversionRules;

/**
 * Inbound port for converting a source agent document into Agent Script.
 * Each call is independent; implementations hold no per-conversion state.
 */
public interface ConversionPort {

    /**
     * Converts a source document.
     *
     * @param document
     *            parsed source document, must be a JSON object
     * @param rules
     *            rule configuration, or {@code null} for the built-in rule set
     * @throws me.golemcore.agentscript.domain.exception.ConversionException
     *             if the document is structurally invalid; no partial output
     *             is produced
     */
    ConversionResult convert(JsonNode document, ConversionRules rules);

    default ConversionResult convert(JsonNode document) {
        return convert(document, null);
    }
}
