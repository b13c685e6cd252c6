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
 * A conversational context with its instructions, actions and reasoning
 * references.
 */
@Value
@Builder(toBuilder = true)
public class Topic {

    String key;
    String label;
    String description;

    @Singular
    List<String> instructions;

    boolean canEscalate;
    boolean start;
    /** Description fell back to the generated default. */
    boolean descriptionGenerated;
    /** Created from a template rather than read from the source. */
    boolean synthesized;

    @Singular
    Map<String, Action> actions;

    @Singular
    Map<String, ReasoningRef> reasoningRefs;
}
