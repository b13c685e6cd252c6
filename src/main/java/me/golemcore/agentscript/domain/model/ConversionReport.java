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

/**
 * Structured analysis of a finished conversion, consumed by report
 * renderers.
 */
@Value
@Builder(toBuilder = true)
public class ConversionReport {

    AgentInfo agentInfo;

    @Singular
    List<TopicSummary> topics;

    @Singular
    List<VariableSummary> variables;

    VariablesInInstructions variablesInInstructions;

    /** Flow actions whose target name looks like a record id. */
    @Singular
    List<FlaggedReference> flaggedReferences;

    @Singular
    List<String> notes;

    @Value
    @Builder
    public static class AgentInfo {
        String name;
        String label;
        String description;
        String plannerRole;
        String company;
        String tone;
        String locale;
        String secondaryLocales;
    }

    @Value
    @Builder
    public static class TopicSummary {
        String key;
        String label;
        String description;
        boolean start;
        @Singular
        List<ActionSummary> actions;
    }

    @Value
    @Builder
    public static class ActionSummary {
        String name;
        String label;
        String description;
        String target;
        String actionType;
    }

    @Value
    @Builder
    public static class VariableSummary {
        String name;
        String type;
        String source;
        String description;
    }

    @Value
    @Builder
    public static class VariablesInInstructions {
        boolean hasVariables;
        String alertMessage;
        @Singular
        List<String> variables;
    }

    @Value
    @Builder
    public static class FlaggedReference {
        String topicKey;
        String actionName;
        String invocationKind;
        String targetName;
    }
}
