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
import me.golemcore.agentscript.domain.model.Action;
import me.golemcore.agentscript.domain.model.AgentModel;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.ParamDef;
import me.golemcore.agentscript.domain.model.ReasoningRef;
import me.golemcore.agentscript.domain.model.Topic;
import me.golemcore.agentscript.domain.model.Variable;
import me.golemcore.agentscript.domain.model.VariableCategory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Rewrites variable references in every text field of a synthesized model
 * and fills the variables section with exactly the variables referenced.
 *
 * <p>
 * Text fields are visited in declaration order: persona, messages, agent
 * description, then per topic its description, instructions, reasoning
 * reference descriptions and action texts. Descriptions of included
 * variables are scanned too, until no new name turns up. Labels and
 * identifiers are never scanned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VariableCollector {

    private final VariableReferenceScanner scanner;

    public AgentModel collect(AgentModel model, Map<String, Variable> declarations, ConversionRules rules) {
        Tally tally = new Tally(scanner, rules.getVariableConversion());

        AgentModel.AgentModelBuilder builder = model.toBuilder()
                .persona(model.getPersona().toBuilder().instructions(tally.apply(model.getPersona().getInstructions()))
                        .build())
                .messages(model.getMessages().toBuilder()
                        .welcome(tally.apply(model.getMessages().getWelcome()))
                        .error(tally.apply(model.getMessages().getError()))
                        .build())
                .identity(model.getIdentity().toBuilder()
                        .description(tally.apply(model.getIdentity().getDescription()))
                        .build())
                .clearTopics();
        for (Topic topic : model.getTopics()) {
            builder.topic(rewriteTopic(topic, tally));
        }

        Map<String, Variable> included = new TreeMap<>();
        Deque<String> pending = new ArrayDeque<>(tally.referenced);
        while (!pending.isEmpty()) {
            String name = pending.poll();
            if (included.containsKey(name)) {
                continue;
            }
            Variable variable = declarations.get(name);
            if (variable == null) {
                variable = Variable.builder()
                        .name(name)
                        .category(VariableCategory.MUTABLE)
                        .dataType(Variable.DEFAULT_TYPE)
                        .description("Variable for " + name)
                        .descriptionGenerated(true)
                        .build();
            }
            int known = tally.referenced.size();
            variable = variable.toBuilder().description(tally.apply(variable.getDescription())).build();
            included.put(name, variable);
            tally.referenced.stream().skip(known).forEach(pending::add);
        }

        long dropped = declarations.keySet().stream().filter(name -> !included.containsKey(name)).count();
        if (dropped > 0) {
            log.debug("[Variables] {} declared variable(s) never referenced, dropped", dropped);
        }
        return builder.clearVariables()
                .variables(included)
                .clearRewrittenVariableNames()
                .rewrittenVariableNames(tally.rewritten)
                .build();
    }

    private Topic rewriteTopic(Topic topic, Tally tally) {
        Topic.TopicBuilder builder = topic.toBuilder()
                .description(tally.apply(topic.getDescription()))
                .clearInstructions();
        for (String line : topic.getInstructions()) {
            builder.instruction(tally.apply(line));
        }

        Map<String, ReasoningRef> refs = new LinkedHashMap<>();
        for (Map.Entry<String, ReasoningRef> entry : topic.getReasoningRefs().entrySet()) {
            ReasoningRef ref = entry.getValue();
            refs.put(entry.getKey(), ref.getDescription() == null ? ref
                    : ReasoningRef.builder()
                            .name(ref.getName())
                            .kind(ref.getKind())
                            .target(ref.getTarget())
                            .parameters(ref.getParameters())
                            .description(tally.apply(ref.getDescription()))
                            .build());
        }
        builder.clearReasoningRefs().reasoningRefs(refs);

        Map<String, Action> actions = new LinkedHashMap<>();
        for (Action action : topic.getActions().values()) {
            actions.put(action.getName(), rewriteAction(action, tally));
        }
        return builder.clearActions().actions(actions).build();
    }

    private Action rewriteAction(Action action, Tally tally) {
        Action.ActionBuilder builder = action.toBuilder()
                .description(tally.apply(action.getDescription()))
                .progressMessage(tally.apply(action.getProgressMessage()))
                .clearInputs()
                .clearOutputs();
        for (ParamDef input : action.getInputs().values()) {
            builder.input(input.getName(), input.toBuilder().description(tally.apply(input.getDescription())).build());
        }
        for (ParamDef output : action.getOutputs().values()) {
            builder.output(output.getName(), output.toBuilder().description(tally.apply(output.getDescription())).build());
        }
        return builder.build();
    }

    private static final class Tally {

        private final VariableReferenceScanner scanner;
        private final ConversionRules.VariableConversion conversion;
        private final Set<String> referenced = new LinkedHashSet<>();
        private final Set<String> rewritten = new TreeSet<>();

        private Tally(VariableReferenceScanner scanner, ConversionRules.VariableConversion conversion) {
            this.scanner = scanner;
            this.conversion = conversion;
        }

        String apply(String text) {
            if (text == null) {
                return null;
            }
            VariableReferenceScanner.ScanResult result = scanner.scan(text, conversion);
            referenced.addAll(result.referenced());
            rewritten.addAll(result.rewritten());
            return result.text();
        }
    }
}
