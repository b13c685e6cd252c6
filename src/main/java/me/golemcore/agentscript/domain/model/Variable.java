package me.golemcore.agentscript.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * An agent-level variable. Object-typed variables are always
 * {@link VariableCategory#MUTABLE}: the constructor coerces a conflicting
 * {@link VariableCategory#LINKED} hint and drops its source.
 */
@Value
public class Variable {

    public static final String DEFAULT_TYPE = "string";
    public static final String ACTION_OUTPUT_SOURCE_PREFIX = "@action.";

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    String name;
    VariableCategory category;
    String dataType;
    /** Only set for linked variables whose source is not an action output placeholder. */
    String source;
    String label;
    String description;
    boolean descriptionGenerated;

    @Builder(toBuilder = true)
    private Variable(String name, VariableCategory category, String dataType, String source, String label,
            String description, boolean descriptionGenerated) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid variable name: " + name);
        }
        this.name = name;
        this.dataType = dataType != null && !dataType.isBlank() ? dataType : DEFAULT_TYPE;
        VariableCategory requested = category != null ? category : VariableCategory.MUTABLE;
        this.category = isObjectType(this.dataType) ? VariableCategory.MUTABLE : requested;
        this.source = this.category == VariableCategory.LINKED && source != null && !source.isBlank()
                && !source.startsWith(ACTION_OUTPUT_SOURCE_PREFIX) ? source : null;
        this.label = label;
        this.description = description;
        this.descriptionGenerated = descriptionGenerated;
    }

    public static boolean isObjectType(String dataType) {
        return "object".equals(dataType) || "list[object]".equals(dataType);
    }
}
