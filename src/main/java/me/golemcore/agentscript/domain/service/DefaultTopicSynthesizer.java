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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentscript.domain.model.AgentModel;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.ReasoningRef;
import me.golemcore.agentscript.domain.model.Topic;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds the structural elements every converted agent needs: the start topic
 * that routes to all others, the escalation / off-topic / ambiguous-question
 * fallbacks, the security rules on the two redirecting fallbacks, and
 * escalation references on topics that may escalate.
 *
 * <p>
 * Topics are matched by exact key. A user topic keyed like a fallback
 * replaces that fallback; a user topic keyed like the selector becomes the
 * start topic and is left as written.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DefaultTopicSynthesizer {

    private final NameSanitizer nameSanitizer;

    public AgentModel synthesize(AgentModel model, ConversionRules rules) {
        ConversionRules.Templates templates = rules.getTemplates();
        String selectorKey = templates.getTopicSelector().getKey();

        Map<String, Topic> userTopics = new LinkedHashMap<>();
        for (Topic topic : model.getTopics()) {
            userTopics.put(topic.getKey(), topic.toBuilder().start(false).build());
        }

        List<Topic> fallbacks = new ArrayList<>();
        for (ConversionRules.TopicTemplate template : templates.fallbacks()) {
            if (!userTopics.containsKey(template.getKey())) {
                fallbacks.add(fromTemplate(template, rules).build());
            }
        }

        Topic start;
        if (userTopics.containsKey(selectorKey)) {
            start = userTopics.remove(selectorKey).toBuilder().start(true).build();
        } else {
            start = selector(templates, userTopics.keySet(), rules);
        }

        List<Topic> topics = new ArrayList<>();
        topics.add(start);
        topics.addAll(userTopics.values());
        topics.addAll(fallbacks);

        List<Topic> finished = new ArrayList<>();
        for (Topic topic : topics) {
            finished.add(withEscalation(withSecurityRules(topic, rules), rules));
        }
        log.debug("[Synthesizer] {} user topic(s), {} fallback(s) added", userTopics.size(), fallbacks.size());
        return model.toBuilder().clearTopics().topics(finished).build();
    }

    private Topic selector(ConversionRules.Templates templates, Iterable<String> userKeys, ConversionRules rules) {
        Topic.TopicBuilder builder = fromTemplate(templates.getTopicSelector(), rules).start(true);
        Map<String, ReasoningRef> transitions = new LinkedHashMap<>();
        for (String key : userKeys) {
            transitions.putIfAbsent("go_to_" + key, ReasoningRef.transition(key));
        }
        for (ConversionRules.TopicTemplate fallback : templates.fallbacks()) {
            ReasoningRef ref = ReasoningRef.transition(fallback.getKey());
            transitions.putIfAbsent(ref.getName(), ref);
        }
        for (ConversionRules.TemplateAction action : templates.getTopicSelector().getActions()) {
            ReasoningRef ref = templateRef(action, rules);
            if (ref != null) {
                transitions.putIfAbsent(ref.getName(), ref);
            }
        }
        return builder.clearReasoningRefs().reasoningRefs(transitions).build();
    }

    private Topic.TopicBuilder fromTemplate(ConversionRules.TopicTemplate template, ConversionRules rules) {
        List<String> instructions = AgentModelBuilder.splitLines(template.getInstructions());
        if (instructions.isEmpty()) {
            instructions.add(rules.getTopics().getFallbackInstruction());
        }
        Topic.TopicBuilder builder = Topic.builder()
                .key(template.getKey())
                .label(template.getLabel())
                .description(template.getDescription())
                .instructions(instructions)
                .synthesized(true);
        for (ConversionRules.TemplateAction action : template.getActions()) {
            ReasoningRef ref = templateRef(action, rules);
            if (ref != null) {
                builder.reasoningRef(ref.getName(), ref);
            }
        }
        return builder;
    }

    private ReasoningRef templateRef(ConversionRules.TemplateAction action, ConversionRules rules) {
        return switch (action.getKind()) {
            case ESCALATION -> ReasoningRef.escalation(
                    FirstPresent.orElse(rules.getTopics().getEscalationDescription(), action.getDescription()));
            case TRANSITION -> {
                if (action.getTopic() == null || action.getTopic().isBlank()) {
                    log.warn("[Synthesizer] Template transition without a topic ignored");
                    yield null;
                }
                yield ReasoningRef.transition(nameSanitizer.topicKey(action.getTopic()), action.getDescription());
            }
            case ACTION -> {
                log.warn("[Synthesizer] Template action references are not supported, ignored");
                yield null;
            }
        };
    }

    private Topic withSecurityRules(Topic topic, ConversionRules rules) {
        boolean applies = rules.getTemplates().fallbacks().stream()
                .anyMatch(template -> template.isIncludeSecurityRules() && template.getKey().equals(topic.getKey()));
        if (!applies || rules.getSecurityRules().isEmpty()) {
            return topic;
        }
        ConversionRules.TopicDefaults defaults = rules.getTopics();
        List<String> block = new ArrayList<>();
        block.add(defaults.getSecurityRulesHeader());
        for (String rule : rules.getSecurityRules()) {
            block.add(defaults.getSecurityRuleIndent() + rule);
        }
        if (topic.getInstructions().containsAll(block)) {
            return topic;
        }
        return topic.toBuilder().instructions(block).build();
    }

    private Topic withEscalation(Topic topic, ConversionRules rules) {
        if (!topic.isCanEscalate() || topic.getReasoningRefs().containsKey(ReasoningRef.ESCALATE_NAME)) {
            return topic;
        }
        return topic.toBuilder()
                .reasoningRef(ReasoningRef.ESCALATE_NAME,
                        ReasoningRef.escalation(rules.getTopics().getEscalationDescription()))
                .build();
    }
}
