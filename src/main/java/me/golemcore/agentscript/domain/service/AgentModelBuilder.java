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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentscript.domain.exception.TopicKeyCollisionException;
import me.golemcore.agentscript.domain.model.Action;
import me.golemcore.agentscript.domain.model.AgentIdentity;
import me.golemcore.agentscript.domain.model.AgentMessages;
import me.golemcore.agentscript.domain.model.AgentModel;
import me.golemcore.agentscript.domain.model.ConnectionKind;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.LocaleSettings;
import me.golemcore.agentscript.domain.model.MappedType;
import me.golemcore.agentscript.domain.model.ParamDef;
import me.golemcore.agentscript.domain.model.Persona;
import me.golemcore.agentscript.domain.model.PropertyDescriptor;
import me.golemcore.agentscript.domain.model.ReasoningRef;
import me.golemcore.agentscript.domain.model.SourceDocument;
import me.golemcore.agentscript.domain.model.Tone;
import me.golemcore.agentscript.domain.model.Topic;
import me.golemcore.agentscript.domain.model.Variable;
import me.golemcore.agentscript.domain.model.VariableCategory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Walks a classified source document and produces the {@link AgentModel}
 * plus every variable declaration found on the way.
 *
 * <p>
 * Declarations are candidates only: which of them end up in the model is
 * decided later by {@link VariableCollector}, from the references found in
 * text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentModelBuilder {

    private static final Pattern TAG_MARKER = Pattern.compile("#[A-Za-z0-9_]+#");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final String TOPIC_PLUGIN_TYPE = "TOPIC";
    private static final String DEFAULT_INVOCATION_KIND = "action";
    private static final String TARGET_SEPARATOR = "://";
    private static final String TRANSITION_TYPE = "transition";
    private static final String ESCALATE_TYPE = "escalate";
    private static final String SIMPLIFIED_DEFAULT_TYPE = "string";

    private final NameSanitizer nameSanitizer;
    private final TypeMapper typeMapper;
    private final OpaqueIdentifierDetector opaqueIdentifierDetector;

    public Draft build(SourceDocument document, ConversionRules rules) {
        SourceNode root = SourceNode.root(document.root());
        Map<String, Variable> declarations = new LinkedHashMap<>();
        declareExplicitVariables(root, rules, declarations);

        List<Topic> topics = switch (document.shape()) {
            case VENDOR_EXPORT -> vendorTopics(root, rules, declarations);
            case SIMPLIFIED_EXPORT -> simplifiedTopics(root, rules, declarations);
            case GENERIC_EXPORT -> List.of();
        };

        AgentModel model = AgentModel.builder()
                .sourceShape(document.shape())
                .identity(identity(root, rules))
                .persona(persona(root, rules))
                .messages(messages(root, rules))
                .locale(locale(root, rules))
                .connectionKind(root.has("voiceConfig") ? ConnectionKind.VOICE : ConnectionKind.MESSAGING)
                .adaptiveResponseAllowed(rules.getConnection().isAdaptiveResponseAllowed())
                .topics(topics)
                .build();
        log.debug("[ModelBuilder] Built {} topic(s), {} variable declaration(s) from {}", topics.size(),
                declarations.size(), document.shape());
        return new Draft(model, declarations);
    }

    // ==================== agent level ====================

    private AgentIdentity identity(SourceNode root, ConversionRules rules) {
        ConversionRules.AgentDefaults config = rules.getConfig();
        String name = root.text("name");
        String label = root.text("label");
        String description = cleanDescription(root.text("description"));
        String agentLabel = FirstPresent.orElse(config.getAgentLabel(), label, name);
        String id = FirstPresent.orElse(config.getDefaultAgentUserId(), root.text("id"));
        return AgentIdentity.builder()
                .name(name)
                .label(agentLabel)
                .description(FirstPresent.orElse(agentLabel, description))
                .descriptionProvided(description != null && !description.isEmpty())
                .developerName(nameSanitizer.developerName(FirstPresent.orElse("", label, name),
                        config.getDeveloperNameMaxLength(), config.getDeveloperNameFallback()))
                .defaultAgentUser(config.getDefaultAgentUser().replace("{id}", id))
                .build();
    }

    private Persona persona(SourceNode root, ConversionRules rules) {
        String role = root.text("plannerRole");
        String company = root.text("plannerCompany");
        String location = root.text("userLocation");
        String rawTone = root.text("plannerToneType");
        Tone tone = Tone.fromSource(rawTone);
        if (rawTone != null && !Tone.isRecognized(rawTone)) {
            log.debug("[ModelBuilder] Unrecognized tone '{}', using {}", rawTone, tone);
        }

        List<String> parts = new ArrayList<>();
        parts.add(FirstPresent.orElse(rules.getSystem().getInstructions(), role).trim());
        FirstPresent.of(company).ifPresent(value -> parts.add(value.trim()));
        FirstPresent.of(location).ifPresent(value -> parts.add(
                rules.getSystem().getUserLocationTemplate().replace("{location}", value.trim())));
        parts.add(rules.toneSentence(tone));

        return Persona.builder()
                .role(role)
                .company(company)
                .userLocation(location)
                .tone(tone)
                .instructions(String.join(" ", parts))
                .build();
    }

    private AgentMessages messages(SourceNode root, ConversionRules rules) {
        ConversionRules.SystemDefaults system = rules.getSystem();
        String welcome = FirstPresent.of(root.text("welcomeMessage"), root.text("welcomeMessageAlt"))
                .orElseGet(() -> system.getWelcomeTemplate().replace("{label}",
                        FirstPresent.orElse(system.getWelcomeLabelFallback(), root.text("label"), root.text("name"))));
        return AgentMessages.builder()
                .welcome(welcome)
                .error(FirstPresent.orElse(system.getErrorMessage(), root.text("errorMessage")))
                .build();
    }

    private LocaleSettings locale(SourceNode root, ConversionRules rules) {
        ConversionRules.LanguageDefaults language = rules.getLanguage();
        return LocaleSettings.builder()
                .defaultLocale(FirstPresent.orElse(language.getDefaultLocale(), root.text("locale")))
                .additionalLocales(root.texts("secondaryLocales").stream().filter(value -> !value.isBlank()).toList())
                .allAdditionalLocales(root.flag("allAdditionalLocales", language.isAllAdditionalLocales()))
                .build();
    }

    private void declareExplicitVariables(SourceNode root, ConversionRules rules, Map<String, Variable> declarations) {
        for (SourceNode node : root.objects("variables")) {
            String name = nameSanitizer.variableName(FirstPresent.orElse("", node.text("name"), node.text("id")));
            if (name.isEmpty()) {
                log.debug("[ModelBuilder] Skipping unnamed variable at {}", node.path());
                continue;
            }
            String type = node.has("type") ? typeMapper.map(descriptor(node), rules).type() : Variable.DEFAULT_TYPE;
            String source = node.text("source");
            declarations.putIfAbsent(name, Variable.builder()
                    .name(name)
                    .category(source != null && !source.isBlank() ? VariableCategory.LINKED : VariableCategory.MUTABLE)
                    .dataType(type)
                    .source(source)
                    .label(node.text("label"))
                    .description(FirstPresent.orElse("Variable " + name, node.text("description")))
                    .descriptionGenerated(FirstPresent.of(node.text("description")).isEmpty())
                    .build());
        }
    }

    // ==================== vendor export ====================

    private List<Topic> vendorTopics(SourceNode root, ConversionRules rules, Map<String, Variable> declarations) {
        List<Topic> topics = new ArrayList<>();
        Map<String, String> keyOwners = new LinkedHashMap<>();
        for (SourceNode plugin : root.objects("plugins")) {
            String pluginType = plugin.text("pluginType");
            if (pluginType != null && !TOPIC_PLUGIN_TYPE.equalsIgnoreCase(pluginType.trim())) {
                log.debug("[ModelBuilder] Skipping plugin of type {} at {}", pluginType, plugin.path());
                continue;
            }
            String sourceName = FirstPresent.orElse("", plugin.text("localDevName"), plugin.text("name"));
            String key = claimKey(keyOwners, nameSanitizer.topicKey(sourceName), sourceName, plugin.path());
            String label = FirstPresent.of(plugin.text("label"))
                    .orElseGet(() -> nameSanitizer.formatLabel(FirstPresent.orElse(key, plugin.text("name"))));

            List<String> definitions = new ArrayList<>();
            for (SourceNode definition : plugin.objects("instructionDefinitions")) {
                definitions.add(definition.text("description"));
            }

            Map<String, Action> actions = new LinkedHashMap<>();
            Map<String, String> actionOwners = new LinkedHashMap<>();
            for (SourceNode function : plugin.objects("functions")) {
                String functionName = FirstPresent.orElse("", function.text("localDevName"), function.text("name"));
                Action action = action(function, functionName, vendorTarget(function, functionName), rules,
                        declarations);
                claimKey(actionOwners, action.getName(), functionName, function.path());
                actions.put(action.getName(), action);
            }

            topics.add(topic(key, label, plugin.text("description"), plugin.text("scope"), definitions,
                    plugin.flag("canEscalate", false), actions, List.of(), rules));
        }
        return topics;
    }

    private InvocationTarget vendorTarget(SourceNode function, String functionName) {
        String kind = FirstPresent.orElse(DEFAULT_INVOCATION_KIND, function.text("invocationTargetType"));
        String name = FirstPresent.orElse(nameSanitizer.actionName(functionName), function.text("invocationTargetName"),
                function.text("invocationTargetId"), function.text("name"));
        return new InvocationTarget(kind, name);
    }

    // ==================== simplified export ====================

    private List<Topic> simplifiedTopics(SourceNode root, ConversionRules rules, Map<String, Variable> declarations) {
        List<Topic> topics = new ArrayList<>();
        Map<String, String> keyOwners = new LinkedHashMap<>();
        for (SourceNode node : root.objects("topics")) {
            String sourceName = FirstPresent.orElse("", node.text("name"), node.text("id"));
            String key = claimKey(keyOwners, nameSanitizer.topicKey(sourceName), sourceName, node.path());
            String label = FirstPresent.of(node.text("label"))
                    .orElseGet(() -> nameSanitizer.formatLabel(FirstPresent.orElse(key, node.text("name"))));

            List<String> definitions = node.has("instructions") ? textOrLines(node, "instructions")
                    : textOrLines(node, "reasoning");

            boolean canEscalate = node.flag("can_escalate", node.flag("canEscalate", false));
            Map<String, Action> actions = new LinkedHashMap<>();
            Map<String, String> actionOwners = new LinkedHashMap<>();
            List<ReasoningRef> transitions = new ArrayList<>();
            for (SourceNode actionNode : node.objects("actions")) {
                String type = actionNode.text("type");
                if (ESCALATE_TYPE.equalsIgnoreCase(type)) {
                    canEscalate = true;
                    continue;
                }
                if (TRANSITION_TYPE.equalsIgnoreCase(type) || actionNode.has("target")) {
                    String targetTopic = FirstPresent.orElse("", actionNode.text("target"),
                            actionNode.text("target_name"), actionNode.text("name"));
                    transitions.add(ReasoningRef.transition(nameSanitizer.topicKey(targetTopic)));
                    continue;
                }
                String actionName = FirstPresent.orElse("", actionNode.text("name"), actionNode.text("id"));
                Action action = action(actionNode, actionName, simplifiedTarget(actionNode, actionName, type), rules,
                        declarations);
                claimKey(actionOwners, action.getName(), actionName, actionNode.path());
                actions.put(action.getName(), action);
            }

            topics.add(topic(key, label, node.text("description"), node.text("scope"), definitions, canEscalate, actions,
                    transitions, rules));
        }
        return topics;
    }

    private InvocationTarget simplifiedTarget(SourceNode node, String actionName, String type) {
        String invocation = FirstPresent.orElse(nameSanitizer.actionName(actionName), node.text("invocation_target"),
                node.text("target_name"));
        int separator = invocation.indexOf(TARGET_SEPARATOR);
        if (separator > 0) {
            return new InvocationTarget(invocation.substring(0, separator),
                    invocation.substring(separator + TARGET_SEPARATOR.length()));
        }
        return new InvocationTarget(FirstPresent.orElse(DEFAULT_INVOCATION_KIND, type), invocation);
    }

    private List<String> textOrLines(SourceNode node, String field) {
        JsonNode raw = node.raw(field);
        if (raw == null) {
            return List.of();
        }
        return raw.isArray() ? node.texts(field) : List.of(node.text(field));
    }

    // ==================== shared ====================

    private Topic topic(String key, String label, String description, String scope, List<String> definitions,
            boolean canEscalate, Map<String, Action> actions, List<ReasoningRef> transitions, ConversionRules rules) {
        Topic.TopicBuilder builder = Topic.builder()
                .key(key)
                .label(label)
                .description(mergeDescription(description, scope, label, rules))
                .descriptionGenerated(FirstPresent.of(cleanDescription(description), cleanDescription(scope)).isEmpty())
                .instructions(instructionLines(scope, definitions, rules))
                .canEscalate(canEscalate)
                .actions(actions);
        Set<String> refNames = new HashSet<>();
        for (Action action : actions.values()) {
            refNames.add(action.getName());
            builder.reasoningRef(action.getName(), ReasoningRef.toAction(action));
        }
        for (ReasoningRef transition : transitions) {
            if (refNames.add(transition.getName())) {
                builder.reasoningRef(transition.getName(), transition);
            }
        }
        return builder.build();
    }

    private Action action(SourceNode node, String sourceName, InvocationTarget target, ConversionRules rules,
            Map<String, Variable> declarations) {
        String name = nameSanitizer.actionName(sourceName);
        String label = FirstPresent.of(node.text("label")).orElse(null);
        String source = node.text("source");
        Action.ActionBuilder builder = Action.builder()
                .name(name)
                .label(label)
                .description(cleanDescription(FirstPresent.orElse(name, node.text("description"), label, sourceName)))
                .descriptionGenerated(FirstPresent.of(cleanDescription(node.text("description"))).isEmpty())
                .requireConfirmation(flag(node, false, "requireUserConfirmation", "require_user_confirmation"))
                .showProgress(flag(node, false, "includeInProgressIndicator", "include_in_progress_indicator"))
                .progressMessage(FirstPresent.of(node.text("progressIndicatorMessage"),
                        node.text("progress_indicator_message")).orElse(null))
                .source(opaqueIdentifierDetector.isPublishableSource(source) ? source : null)
                .target(target.kind() + TARGET_SEPARATOR + target.name())
                .invocationKind(target.kind())
                .invocationTargetName(target.name());

        String actionLabel = FirstPresent.orElse(name, label);
        Schema inputs = schema(node, "inputType", "inputs");
        for (Map.Entry<String, SourceNode> entry : inputs.properties().entrySet()) {
            SourceNode property = entry.getValue();
            Boolean userInput = flag(property, "copilotAction:isUserInput", "is_user_input");
            if (Boolean.FALSE.equals(userInput)) {
                log.debug("[ModelBuilder] Excluding non-user input {}", property.path());
                continue;
            }
            boolean required = inputs.required().contains(entry.getKey());
            boolean userInputDefault = inputs.simplified() || required;
            ParamDef input = param(entry.getKey(), property, inputs, ParamDef.Role.INPUT, rules)
                    .required(required)
                    .userInput(userInput != null ? userInput : userInputDefault)
                    .build();
            builder.input(input.getName(), input);
            declare(declarations, input, VariableCategory.MUTABLE, null, "Variable for " + input.getName());
        }

        Schema outputs = schema(node, "outputType", "outputs");
        for (Map.Entry<String, SourceNode> entry : outputs.properties().entrySet()) {
            SourceNode property = entry.getValue();
            ParamDef output = param(entry.getKey(), property, outputs, ParamDef.Role.OUTPUT, rules)
                    .displayable(flag(property, false, "copilotAction:isDisplayable", "is_displayable"))
                    .usedByPlanner(flag(property, true, "copilotAction:isUsedByPlanner", "is_used_by_planner"))
                    .build();
            builder.output(output.getName(), output);
            declare(declarations, output, VariableCategory.LINKED,
                    Variable.ACTION_OUTPUT_SOURCE_PREFIX + name + "." + output.getName(), "Output from " + actionLabel);
        }
        return builder.build();
    }

    /**
     * Vendor schemas nest properties under {@code inputType.properties} with
     * a {@code required} list; simplified ones map names directly under
     * {@code inputs} and flag each required property. Simplified properties
     * without a type are strings and count as user input unless flagged.
     */
    private Schema schema(SourceNode node, String vendorField, String simplifiedField) {
        SourceNode vendor = node.object(vendorField);
        if (vendor != null) {
            return new Schema(vendor.properties("properties"), new HashSet<>(vendor.texts("required")), false);
        }
        Map<String, SourceNode> properties = node.properties(simplifiedField);
        Set<String> required = new HashSet<>(node.texts("required"));
        properties.forEach((name, property) -> {
            if (property.flag("required", false)) {
                required.add(name);
            }
        });
        return new Schema(properties, required, true);
    }

    private ParamDef.ParamDefBuilder param(String rawName, SourceNode property, Schema schema, ParamDef.Role role,
            ConversionRules rules) {
        String name = nameSanitizer.stripParamPrefix(rawName);
        String title = property.text("title");
        PropertyDescriptor descriptor = descriptor(property);
        if (schema.simplified() && FirstPresent.of(descriptor.type()).isEmpty()) {
            descriptor = new PropertyDescriptor(SIMPLIFIED_DEFAULT_TYPE, descriptor.items(), descriptor.complexTypeHint());
        }
        MappedType mapped = typeMapper.map(descriptor, rules);
        JsonNode constValue = property.has("const_value") ? property.raw("const_value") : property.raw("default");
        return ParamDef.builder()
                .name(name)
                .role(role)
                .type(mapped.type())
                .complexTypeName(mapped.complexTypeName())
                .constValue(constValue)
                .label(FirstPresent.orElse(name, property.text("label"), title))
                .description(FirstPresent.of(property.text("description"), title).orElse(null));
    }

    private PropertyDescriptor descriptor(SourceNode property) {
        SourceNode items = property.object("items");
        String hint = FirstPresent.of(property.text("lightning:type"), property.text("complex_data_type_name"),
                property.text("complex_type")).orElse(null);
        return new PropertyDescriptor(property.text("type"), items != null ? descriptor(items) : null, hint);
    }

    private void declare(Map<String, Variable> declarations, ParamDef param, VariableCategory category, String source,
            String fallbackDescription) {
        String name = nameSanitizer.variableName(param.getName());
        if (name.isEmpty() || declarations.containsKey(name)) {
            return;
        }
        declarations.put(name, Variable.builder()
                .name(name)
                .category(category)
                .dataType(param.getType())
                .source(source)
                .label(param.getLabel())
                .description(FirstPresent.orElse(fallbackDescription, param.getDescription()))
                .descriptionGenerated(FirstPresent.of(param.getDescription()).isEmpty())
                .build());
    }

    private String mergeDescription(String description, String scope, String label, ConversionRules rules) {
        List<String> parts = new ArrayList<>();
        FirstPresent.of(cleanDescription(description)).ifPresent(parts::add);
        FirstPresent.of(cleanDescription(scope)).ifPresent(parts::add);
        if (parts.isEmpty()) {
            return rules.getTopics().getDescriptionTemplate().replace("{label}", label);
        }
        return String.join(" ", parts);
    }

    private List<String> instructionLines(String scope, List<String> definitions, ConversionRules rules) {
        List<String> entries = new ArrayList<>();
        entries.add(scope);
        entries.addAll(definitions);
        List<String> lines = splitLines(entries);
        if (lines.isEmpty()) {
            lines.add(rules.getTopics().getFallbackInstruction());
        }
        return lines;
    }

    /**
     * One line per non-blank source line, stripped, with consecutive repeats
     * dropped.
     */
    static List<String> splitLines(List<String> entries) {
        List<String> lines = new ArrayList<>();
        for (String entry : entries) {
            if (entry == null) {
                continue;
            }
            for (String line : LINE_BREAK.split(entry)) {
                String stripped = line.strip();
                if (stripped.isEmpty()) {
                    continue;
                }
                if (lines.isEmpty() || !lines.get(lines.size() - 1).equals(stripped)) {
                    lines.add(stripped);
                }
            }
        }
        return lines;
    }

    static String cleanDescription(String text) {
        if (text == null) {
            return null;
        }
        String withoutTags = TAG_MARKER.matcher(text).replaceAll("");
        return WHITESPACE.matcher(withoutTags).replaceAll(" ").trim();
    }

    private String claimKey(Map<String, String> owners, String key, String sourceName, String path) {
        String owner = owners.putIfAbsent(key, sourceName);
        if (owner != null) {
            throw new TopicKeyCollisionException(path, key, owner, sourceName);
        }
        return key;
    }

    private static boolean flag(SourceNode node, boolean fallback, String... fields) {
        Boolean value = flag(node, fields);
        return value != null ? value : fallback;
    }

    private static Boolean flag(SourceNode node, String... fields) {
        for (String field : fields) {
            Boolean value = node.flag(field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private record InvocationTarget(String kind, String name) {
    }

    private record Schema(Map<String, SourceNode> properties, Set<String> required, boolean simplified) {
    }

    /**
     * Model as read from the source, before defaults are synthesized, and the
     * variable declarations found while reading it.
     */
    public record Draft(AgentModel model, Map<String, Variable> declarations) {
    }
}
