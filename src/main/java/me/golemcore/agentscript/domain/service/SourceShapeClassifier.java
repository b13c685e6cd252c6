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
import me.golemcore.agentscript.domain.model.SourceDocument;
import me.golemcore.agentscript.domain.model.SourceShape;
import org.springframework.stereotype.Component;

/**
 * Decides which {@link SourceShape} a document has: a non-empty
 * {@code plugins} array means a vendor export, otherwise a non-empty
 * {@code topics} array means a simplified export, otherwise generic.
 */
@Component
public class SourceShapeClassifier {

    static final String PLUGINS = "plugins";
    static final String TOPICS = "topics";

    public SourceDocument classify(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConversionException("$", "expected a JSON object");
        }
        if (nonEmptyArray(root, PLUGINS)) {
            return new SourceDocument(SourceShape.VENDOR_EXPORT, root);
        }
        if (nonEmptyArray(root, TOPICS)) {
            return new SourceDocument(SourceShape.SIMPLIFIED_EXPORT, root);
        }
        return new SourceDocument(SourceShape.GENERIC_EXPORT, root);
    }

    private static boolean nonEmptyArray(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isArray()) {
            throw new ConversionException("$." + field, "expected an array");
        }
        return !value.isEmpty();
    }
}
