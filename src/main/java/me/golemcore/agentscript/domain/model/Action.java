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
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A callable operation of a topic with typed inputs and outputs.
 */
@Value
@Builder(toBuilder = true)
public class Action {

    String name;
    String label;
    String description;
    boolean descriptionGenerated;
    boolean requireConfirmation;
    boolean showProgress;
    String progressMessage;
    /** Readable source API name; never a record id. */
    String source;
    /** {@code kind://name} */
    String target;
    String invocationKind;
    String invocationTargetName;

    @Singular
    Map<String, ParamDef> inputs;

    @Singular
    Map<String, ParamDef> outputs;
}
