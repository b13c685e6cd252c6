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

import java.util.List;
import java.util.Map;

/**
 * Engine-internal representation of a converted agent. Built once per
 * conversion and read-only once defaults have been synthesized.
 */
@Value
@Builder(toBuilder = true)
public class AgentModel {

    SourceShape sourceShape;
    AgentIdentity identity;
    Persona persona;
    AgentMessages messages;
    LocaleSettings locale;

    @Builder.Default
    ConnectionKind connectionKind = ConnectionKind.MESSAGING;

    @Builder.Default
    boolean adaptiveResponseAllowed = true;

    @Singular
    Map<String, Variable> variables;

    @Singular
    List<Topic> topics;

    /** Names found in legacy reference syntax and rewritten, sorted. */
    @Singular
    List<String> rewrittenVariableNames;

    public boolean isVariablesRewritten() {
        return !rewrittenVariableNames.isEmpty();
    }

    public int getActionCount() {
        return topics.stream().mapToInt(topic -> topic.getActions().size()).sum();
    }
}
