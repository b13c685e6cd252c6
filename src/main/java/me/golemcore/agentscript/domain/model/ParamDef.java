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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * An action input or output parameter. Which flags are rendered depends on
 * the {@link Role}.
 */
@Value
@Builder(toBuilder = true)
public class ParamDef {

    public enum Role {
        INPUT, OUTPUT
    }

    String name;
    Role role;
    String type;
    JsonNode constValue;
    String label;
    String description;
    String complexTypeName;

    // input flags
    boolean required;
    boolean userInput;

    // output flags
    boolean displayable;
    @Builder.Default
    boolean usedByPlanner = true;
}
