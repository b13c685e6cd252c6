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
import me.golemcore.agentscript.domain.model.Action;
import me.golemcore.agentscript.domain.model.AgentModel;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.ParamDef;
import me.golemcore.agentscript.domain.model.ReasoningRef;
import me.golemcore.agentscript.domain.model.Topic;
import me.golemcore.agentscript.domain.model.Variable;
import me.golemcore.agentscript.domain.model.VariableCategory;
import org.springframework.stereotype.Component;

/**
 * Renders a finished {@link AgentModel} as Agent Script text.
 *
 * <p>
 * Indentation is fixed per section rather than per nesting level: config
 * fields sit at two spaces, every other root section's fields at four;
 * message, variable and reasoning fields at eight; action bodies one level
 * below their entry and parameter bodies one level below theirs. Field order
 * inside each record is fixed here and never follows model insertion order.
 * Output ends with exactly one newline.
 */
@Component
public class AgentScriptSerializer {

    private static final int SECTION_FIELD = 4;
    private static final int CONFIG_FIELD = 2;
    private static final int NESTED_FIELD = 8;
    private static final int REASONING_ENTRY = 12;
    private static final int REASONING_CLAUSE = 16;
    private static final int ACTION_ENTRY = 8;
    private static final int ACTION_FIELD = 12;
    private static final int PARAM_ENTRY = 16;
    private static final int PARAM_FIELD = 20;

    public String serialize(AgentModel model, ConversionRules rules) {
        StringBuilder out = new StringBuilder();
        writeSystem(out, model);
        writeConfig(out, model);
        writeVariables(out, model);
        writeLanguage(out, model);
        writeConnection(out, model);
        for (Topic topic : model.getTopics()) {
            writeTopic(out, topic, rules.getOutputFormat());
        }
        return out.toString().stripTrailing() + "\n";
    }

    private void writeSystem(StringBuilder out, AgentModel model) {
        line(out, 0, "system:");
        line(out, SECTION_FIELD, "instructions: " + quote(model.getPersona().getInstructions()));
        line(out, SECTION_FIELD, "messages:");
        line(out, NESTED_FIELD, "welcome: " + quote(model.getMessages().getWelcome()));
        line(out, NESTED_FIELD, "error: " + quote(model.getMessages().getError()));
        out.append('\n');
    }

    private void writeConfig(StringBuilder out, AgentModel model) {
        line(out, 0, "config:");
        line(out, CONFIG_FIELD, "default_agent_user: " + quote(model.getIdentity().getDefaultAgentUser()));
        line(out, CONFIG_FIELD, "agent_label: " + quote(model.getIdentity().getLabel()));
        line(out, CONFIG_FIELD, "developer_name: " + quote(model.getIdentity().getDeveloperName()));
        line(out, CONFIG_FIELD, "description: " + quote(model.getIdentity().getDescription()));
        out.append('\n');
    }

    private void writeVariables(StringBuilder out, AgentModel model) {
        if (model.getVariables().isEmpty()) {
            return;
        }
        line(out, 0, "variables:");
        for (Variable variable : model.getVariables().values()) {
            line(out, SECTION_FIELD,
                    variable.getName() + ": " + variable.getCategory().getKeyword() + " " + variable.getDataType());
            if (variable.getCategory() == VariableCategory.LINKED && variable.getSource() != null) {
                line(out, NESTED_FIELD, "source: " + variable.getSource());
            }
            if (variable.getLabel() != null) {
                line(out, NESTED_FIELD, "label: " + quote(variable.getLabel()));
            }
            line(out, NESTED_FIELD, "description: " + quote(variable.getDescription()));
        }
        out.append('\n');
    }

    private void writeLanguage(StringBuilder out, AgentModel model) {
        line(out, 0, "language:");
        line(out, SECTION_FIELD, "default_locale: " + quote(model.getLocale().getDefaultLocale()));
        line(out, SECTION_FIELD, "additional_locales: " + quote(String.join(", ", model.getLocale().getAdditionalLocales())));
        line(out, SECTION_FIELD, "all_additional_locales: " + bool(model.getLocale().isAllAdditionalLocales()));
        out.append('\n');
    }

    private void writeConnection(StringBuilder out, AgentModel model) {
        line(out, 0, "connection " + model.getConnectionKind().getKeyword() + ":");
        line(out, SECTION_FIELD, "adaptive_response_allowed: " + bool(model.isAdaptiveResponseAllowed()));
        out.append('\n');
    }

    private void writeTopic(StringBuilder out, Topic topic, ConversionRules.OutputFormat format) {
        line(out, 0, (topic.isStart() ? "start_agent " : "topic ") + topic.getKey() + ":");
        line(out, SECTION_FIELD, "label: " + quote(topic.getLabel()));
        out.append('\n');
        line(out, SECTION_FIELD, "description: " + quote(topic.getDescription()));
        out.append('\n');

        line(out, SECTION_FIELD, "reasoning:");
        line(out, NESTED_FIELD, "instructions: " + format.getInstructionsIndicator());
        for (String instruction : topic.getInstructions()) {
            line(out, REASONING_ENTRY, format.getInstructionsLinePrefix() + " " + instruction);
        }
        if (!topic.getReasoningRefs().isEmpty()) {
            line(out, NESTED_FIELD, "actions:");
            for (ReasoningRef ref : topic.getReasoningRefs().values()) {
                line(out, REASONING_ENTRY, ref.getName() + ": " + ref.getTarget());
                for (String parameter : ref.getParameters()) {
                    line(out, REASONING_CLAUSE, "with " + parameter + " = ...");
                }
                if (ref.getDescription() != null) {
                    line(out, REASONING_CLAUSE, "description: " + quote(ref.getDescription()));
                }
            }
        }

        if (!topic.getActions().isEmpty()) {
            out.append('\n');
            line(out, SECTION_FIELD, "actions:");
            for (Action action : topic.getActions().values()) {
                writeAction(out, action);
            }
        }
        out.append('\n');
    }

    private void writeAction(StringBuilder out, Action action) {
        line(out, ACTION_ENTRY, action.getName() + ":");
        line(out, ACTION_FIELD, "description: " + quote(action.getDescription()));
        if (action.getLabel() != null) {
            line(out, ACTION_FIELD, "label: " + quote(action.getLabel()));
        }
        line(out, ACTION_FIELD, "require_user_confirmation: " + bool(action.isRequireConfirmation()));
        line(out, ACTION_FIELD, "include_in_progress_indicator: " + bool(action.isShowProgress()));
        if (action.getSource() != null) {
            line(out, ACTION_FIELD, "source: " + quote(action.getSource()));
        }
        line(out, ACTION_FIELD, "target: " + quote(action.getTarget()));
        if (action.getProgressMessage() != null) {
            line(out, ACTION_FIELD, "progress_indicator_message: " + quote(action.getProgressMessage()));
        }
        writeParams(out, "inputs:", action.getInputs().values());
        writeParams(out, "outputs:", action.getOutputs().values());
    }

    private void writeParams(StringBuilder out, String header, Iterable<ParamDef> params) {
        boolean first = true;
        for (ParamDef param : params) {
            if (first) {
                out.append('\n');
                line(out, ACTION_FIELD, header);
                first = false;
            }
            line(out, PARAM_ENTRY, quote(param.getName()) + ": " + param.getType());
            if (param.getDescription() != null) {
                line(out, PARAM_FIELD, "description: " + quote(param.getDescription()));
            }
            if (param.getLabel() != null) {
                line(out, PARAM_FIELD, "label: " + quote(param.getLabel()));
            }
            if (param.getRole() == ParamDef.Role.INPUT) {
                if (param.getConstValue() != null) {
                    line(out, PARAM_FIELD, "const_value: " + literal(param.getConstValue()));
                }
                line(out, PARAM_FIELD, "is_required: " + bool(param.isRequired()));
                line(out, PARAM_FIELD, "is_user_input: " + bool(param.isUserInput()));
            } else {
                line(out, PARAM_FIELD, "is_displayable: " + bool(param.isDisplayable()));
                line(out, PARAM_FIELD, "is_used_by_planner: " + bool(param.isUsedByPlanner()));
            }
            if (param.getComplexTypeName() != null) {
                line(out, PARAM_FIELD, "complex_data_type_name: " + quote(param.getComplexTypeName()));
            }
        }
    }

    private static void line(StringBuilder out, int depth, String text) {
        out.append(" ".repeat(depth)).append(text).append('\n');
    }

    static String bool(boolean value) {
        return value ? "True" : "False";
    }

    static String quote(String value) {
        if (value == null) {
            return "\"\"";
        }
        StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> quoted.append("\\\\");
                case '"' -> quoted.append("\\\"");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }

    private static String literal(JsonNode value) {
        if (value.isBoolean()) {
            return bool(value.booleanValue());
        }
        if (value.isNumber()) {
            return value.asText();
        }
        if (value.isTextual()) {
            return quote(value.textValue());
        }
        return quote(value.toString());
    }
}
