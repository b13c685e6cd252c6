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

import java.util.List;

/**
 * A pointer from a topic's reasoning block to an action, another topic, or
 * the escalation utility. Only action references carry parameter clauses.
 */
@Value
public class ReasoningRef {

    public enum Kind {
        ACTION, TRANSITION, ESCALATION
    }

    public static final String ESCALATE_TARGET = "@utils.escalate";
    public static final String ESCALATE_NAME = "escalate_to_human";

    String name;
    Kind kind;
    String target;
    List<String> parameters;
    String description;

    @Builder
    private ReasoningRef(String name, Kind kind, String target, List<String> parameters, String description) {
        List<String> params = parameters != null ? List.copyOf(parameters) : List.of();
        if (kind != Kind.ACTION && !params.isEmpty()) {
            throw new IllegalArgumentException(kind + " reference " + name + " cannot carry parameters");
        }
        this.name = name;
        this.kind = kind;
        this.target = target;
        this.parameters = params;
        this.description = description;
    }

    public static ReasoningRef toAction(Action action) {
        return ReasoningRef.builder()
                .name(action.getName())
                .kind(Kind.ACTION)
                .target("@actions." + action.getName())
                .parameters(List.copyOf(action.getInputs().keySet()))
                .build();
    }

    public static ReasoningRef transition(String topicKey) {
        return transition(topicKey, null);
    }

    public static ReasoningRef transition(String topicKey, String description) {
        return ReasoningRef.builder()
                .name("go_to_" + topicKey)
                .kind(Kind.TRANSITION)
                .target("@utils.transition to @topic." + topicKey)
                .description(description)
                .build();
    }

    public static ReasoningRef escalation(String description) {
        return ReasoningRef.builder()
                .name(ESCALATE_NAME)
                .kind(Kind.ESCALATION)
                .target(ESCALATE_TARGET)
                .description(description)
                .build();
    }
}
