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
import me.golemcore.agentscript.domain.model.Action;
import me.golemcore.agentscript.domain.model.AgentModel;
import me.golemcore.agentscript.domain.model.ConversionReport;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.ReasoningRef;
import me.golemcore.agentscript.domain.model.Topic;
import me.golemcore.agentscript.domain.model.Variable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts the structured analysis of a finished model: agent info, topic
 * and action enumeration, variables, rewritten variable names, flow actions
 * pointing at record ids, and review notes.
 */
@Component
@RequiredArgsConstructor
public class ConversionReportExtractor {

    private static final String ESCALATION_ACTION_TYPE = "escalation";

    private final OpaqueIdentifierDetector opaqueIdentifierDetector;

    public ConversionReport extract(AgentModel model, ConversionRules rules) {
        ConversionRules.ReportDefaults defaults = rules.getReport();
        ConversionReport.ConversionReportBuilder report = ConversionReport.builder()
                .agentInfo(agentInfo(model, defaults));

        for (Topic topic : model.getTopics()) {
            report.topic(topicSummary(topic, defaults));
        }
        for (Variable variable : model.getVariables().values()) {
            report.variable(ConversionReport.VariableSummary.builder()
                    .name(variable.getName())
                    .type(variable.getCategory().getKeyword() + " " + variable.getDataType())
                    .source(variable.getSource())
                    .description(variable.getDescription())
                    .build());
        }

        boolean rewritten = model.isVariablesRewritten();
        report.variablesInInstructions(ConversionReport.VariablesInInstructions.builder()
                .hasVariables(rewritten)
                .alertMessage(rewritten ? rules.getVariableConversion().getAlertMessage() : null)
                .variables(model.getRewrittenVariableNames())
                .build());

        List<ConversionReport.FlaggedReference> flagged = flaggedReferences(model, defaults);
        report.flaggedReferences(flagged);
        report.notes(notes(model, flagged, rules));
        return report.build();
    }

    private ConversionReport.AgentInfo agentInfo(AgentModel model, ConversionRules.ReportDefaults defaults) {
        return ConversionReport.AgentInfo.builder()
                .name(FirstPresent.orElse(model.getIdentity().getLabel(), model.getIdentity().getName()))
                .label(model.getIdentity().getLabel())
                .description(model.getIdentity().isDescriptionProvided() ? model.getIdentity().getDescription()
                        : defaults.getMissingDescription())
                .plannerRole(model.getPersona().getRole())
                .company(model.getPersona().getCompany())
                .tone(model.getPersona().getTone().name())
                .locale(model.getLocale().getDefaultLocale())
                .secondaryLocales(String.join(", ", model.getLocale().getAdditionalLocales()))
                .build();
    }

    private ConversionReport.TopicSummary topicSummary(Topic topic, ConversionRules.ReportDefaults defaults) {
        ConversionReport.TopicSummary.TopicSummaryBuilder summary = ConversionReport.TopicSummary.builder()
                .key(topic.getKey())
                .label(topic.getLabel())
                .description(topic.getDescription())
                .start(topic.isStart());
        for (Action action : topic.getActions().values()) {
            summary.action(ConversionReport.ActionSummary.builder()
                    .name(action.getName())
                    .label(action.getLabel())
                    .description(action.getDescription())
                    .target(action.getTarget())
                    .actionType(action.getInvocationKind())
                    .build());
        }
        if (topic.isCanEscalate()) {
            summary.action(ConversionReport.ActionSummary.builder()
                    .name(ReasoningRef.ESCALATE_NAME)
                    .label(defaults.getEscalationActionLabel())
                    .description(defaults.getEscalationActionDescription())
                    .target(ReasoningRef.ESCALATE_TARGET)
                    .actionType(ESCALATION_ACTION_TYPE)
                    .build());
        }
        return summary.build();
    }

    private List<ConversionReport.FlaggedReference> flaggedReferences(AgentModel model,
            ConversionRules.ReportDefaults defaults) {
        Set<String> kinds = defaults.getFlaggedInvocationKinds().stream()
                .map(kind -> kind.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<ConversionReport.FlaggedReference> flagged = new ArrayList<>();
        for (Topic topic : model.getTopics()) {
            for (Action action : topic.getActions().values()) {
                String kind = action.getInvocationKind();
                if (kind != null && kinds.contains(kind.toLowerCase(Locale.ROOT))
                        && opaqueIdentifierDetector.isOpaque(action.getInvocationTargetName())) {
                    flagged.add(ConversionReport.FlaggedReference.builder()
                            .topicKey(topic.getKey())
                            .actionName(action.getName())
                            .invocationKind(kind)
                            .targetName(action.getInvocationTargetName())
                            .build());
                }
            }
        }
        return flagged;
    }

    private List<String> notes(AgentModel model, List<ConversionReport.FlaggedReference> flagged,
            ConversionRules rules) {
        List<String> notes = new ArrayList<>();
        List<Topic> sourceTopics = model.getTopics().stream().filter(topic -> !topic.isSynthesized()).toList();

        List<String> undescribedTopics = sourceTopics.stream().filter(Topic::isDescriptionGenerated)
                .map(Topic::getKey).toList();
        if (!undescribedTopics.isEmpty()) {
            notes.add("- " + undescribedTopics.size() + " topic(s) are missing descriptions: "
                    + String.join(", ", undescribedTopics));
        }

        List<String> emptyTopics = sourceTopics.stream().filter(topic -> topic.getActions().isEmpty())
                .map(Topic::getKey).toList();
        if (!emptyTopics.isEmpty()) {
            notes.add("- " + emptyTopics.size() + " topic(s) have no actions: " + String.join(", ", emptyTopics));
        }

        List<String> undescribedActions = sourceTopics.stream()
                .flatMap(topic -> topic.getActions().values().stream())
                .filter(Action::isDescriptionGenerated)
                .map(Action::getName)
                .toList();
        if (!undescribedActions.isEmpty()) {
            notes.add("- " + undescribedActions.size() + " action(s) are missing descriptions: "
                    + String.join(", ", undescribedActions));
        }

        List<String> undescribedVariables = model.getVariables().values().stream()
                .filter(Variable::isDescriptionGenerated)
                .map(Variable::getName)
                .toList();
        if (!undescribedVariables.isEmpty()) {
            notes.add("- " + undescribedVariables.size() + " variable(s) are missing descriptions: "
                    + String.join(", ", undescribedVariables));
        }

        if (!flagged.isEmpty()) {
            notes.add("- MANUAL ACTION REQUIRED: " + flagged.size()
                    + " flow reference(s) use record ids instead of API names and must be replaced:");
            for (ConversionReport.FlaggedReference reference : flagged) {
                notes.add("  " + reference.getTopicKey() + "." + reference.getActionName() + " -> "
                        + reference.getInvocationKind() + "://" + reference.getTargetName());
            }
        }

        if (model.isVariablesRewritten()) {
            notes.add("- " + rules.getVariableConversion().getStatusSuffix());
        }
        return notes;
    }
}
