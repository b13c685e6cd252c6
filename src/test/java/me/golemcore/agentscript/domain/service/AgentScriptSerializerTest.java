package me.golemcore.agentscript.domain.service;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import me.golemcore.agentscript.domain.model.Action;
import me.golemcore.agentscript.domain.model.AgentIdentity;
import me.golemcore.agentscript.domain.model.AgentMessages;
import me.golemcore.agentscript.domain.model.AgentModel;
import me.golemcore.agentscript.domain.model.ConnectionKind;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.LocaleSettings;
import me.golemcore.agentscript.domain.model.ParamDef;
import me.golemcore.agentscript.domain.model.Persona;
import me.golemcore.agentscript.domain.model.ReasoningRef;
import me.golemcore.agentscript.domain.model.Topic;
import me.golemcore.agentscript.domain.model.Variable;
import me.golemcore.agentscript.domain.model.VariableCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentScriptSerializerTest {

    private AgentScriptSerializer serializer;
    private ConversionRules rules;

    @BeforeEach
    void setUp() {
        serializer = new AgentScriptSerializer();
        rules = ConversionRules.defaults();
    }

    private static AgentModel.AgentModelBuilder baseModel() {
        return AgentModel.builder()
                .identity(AgentIdentity.builder()
                        .label("Bot")
                        .developerName("BOT")
                        .defaultAgentUser("u@example.ext")
                        .description("A bot")
                        .build())
                .persona(Persona.builder().instructions("You are an AI Agent. Maintain a neutral and balanced tone.")
                        .build())
                .messages(AgentMessages.builder().welcome("Hi").error("Oops").build())
                .locale(LocaleSettings.builder().defaultLocale("en_US").build());
    }

    @Test
    void shouldRenderCompleteDocument() {
        Action getOrder = Action.builder()
                .name("Get_Order")
                .description("Gets")
                .target("apex://Lookup")
                .input("orderId", ParamDef.builder()
                        .name("orderId")
                        .role(ParamDef.Role.INPUT)
                        .type("string")
                        .required(true)
                        .userInput(true)
                        .complexTypeName("lightning__textType")
                        .build())
                .build();
        AgentModel model = baseModel()
                .variable("orderId", Variable.builder().name("orderId").category(VariableCategory.MUTABLE)
                        .dataType("string").description("The order").build())
                .topic(Topic.builder()
                        .key("topic_selector")
                        .label("Topic Selector")
                        .description("Routes")
                        .instruction("Pick one.")
                        .start(true)
                        .reasoningRef("go_to_orders", ReasoningRef.transition("orders"))
                        .build())
                .topic(Topic.builder()
                        .key("orders")
                        .label("Orders")
                        .description("Order help")
                        .instruction("Help \"quoted\".")
                        .action("Get_Order", getOrder)
                        .reasoningRef("Get_Order", ReasoningRef.toAction(getOrder))
                        .build())
                .build();

        String expected = """
                system:
                    instructions: "You are an AI Agent. Maintain a neutral and balanced tone."
                    messages:
                        welcome: "Hi"
                        error: "Oops"

                config:
                  default_agent_user: "u@example.ext"
                  agent_label: "Bot"
                  developer_name: "BOT"
                  description: "A bot"

                variables:
                    orderId: mutable string
                        description: "The order"

                language:
                    default_locale: "en_US"
                    additional_locales: ""
                    all_additional_locales: False

                connection messaging:
                    adaptive_response_allowed: True

                start_agent topic_selector:
                    label: "Topic Selector"

                    description: "Routes"

                    reasoning:
                        instructions: ->
                            | Pick one.
                        actions:
                            go_to_orders: @utils.transition to @topic.orders

                topic orders:
                    label: "Orders"

                    description: "Order help"

                    reasoning:
                        instructions: ->
                            | Help "quoted".
                        actions:
                            Get_Order: @actions.Get_Order
                                with orderId = ...

                    actions:
                        Get_Order:
                            description: "Gets"
                            require_user_confirmation: False
                            include_in_progress_indicator: False
                            target: "apex://Lookup"

                            inputs:
                                "orderId": string
                                    is_required: True
                                    is_user_input: True
                                    complex_data_type_name: "lightning__textType"
                """;

        assertEquals(expected, serializer.serialize(model, rules));
    }

    @Test
    void shouldOmitEmptyVariablesSection() {
        String output = serializer.serialize(baseModel().build(), rules);

        assertFalse(output.contains("variables:"));
        assertTrue(output.endsWith("adaptive_response_allowed: True\n"));
    }

    @Test
    void shouldRenderLinkedVariableSourceUnquoted() {
        AgentModel model = baseModel()
                .variable("caseId", Variable.builder().name("caseId").category(VariableCategory.LINKED)
                        .dataType("string").source("@MessagingSession.CaseId").label("Case").description("The case")
                        .build())
                .build();

        String output = serializer.serialize(model, rules);

        assertTrue(output.contains("    caseId: linked string\n"
                + "        source: @MessagingSession.CaseId\n"
                + "        label: \"Case\"\n"
                + "        description: \"The case\"\n"));
    }

    @Test
    void shouldRenderVoiceConnectionAndLocales() {
        AgentModel model = baseModel()
                .connectionKind(ConnectionKind.VOICE)
                .locale(LocaleSettings.builder().defaultLocale("en_US").additionalLocale("fr").additionalLocale("de")
                        .allAdditionalLocales(true).build())
                .build();

        String output = serializer.serialize(model, rules);

        assertTrue(output.contains("connection voice:\n"));
        assertTrue(output.contains("    additional_locales: \"fr, de\"\n"));
        assertTrue(output.contains("    all_additional_locales: True\n"));
    }

    @Test
    void shouldRenderOutputFlagsAndOptionalActionFields() {
        Action action = Action.builder()
                .name("Refund")
                .description("Refunds")
                .label("Refund Order")
                .requireConfirmation(true)
                .showProgress(true)
                .source("Refund_Order")
                .target("flow://Refund_Order")
                .progressMessage("Working")
                .input("amount", ParamDef.builder().name("amount").role(ParamDef.Role.INPUT).type("number")
                        .constValue(IntNode.valueOf(5)).build())
                .input("express", ParamDef.builder().name("express").role(ParamDef.Role.INPUT).type("boolean")
                        .constValue(BooleanNode.TRUE).build())
                .input("note", ParamDef.builder().name("note").role(ParamDef.Role.INPUT).type("string")
                        .constValue(TextNode.valueOf("a\"b")).build())
                .output("status", ParamDef.builder().name("status").role(ParamDef.Role.OUTPUT).type("string")
                        .label("Status").description("Result").displayable(true).build())
                .build();
        AgentModel model = baseModel()
                .topic(Topic.builder().key("refunds").label("Refunds").description("d").instruction("i")
                        .action("Refund", action).build())
                .build();

        String output = serializer.serialize(model, rules);

        assertTrue(output.contains("            label: \"Refund Order\"\n"
                + "            require_user_confirmation: True\n"
                + "            include_in_progress_indicator: True\n"
                + "            source: \"Refund_Order\"\n"
                + "            target: \"flow://Refund_Order\"\n"
                + "            progress_indicator_message: \"Working\"\n"));
        assertTrue(output.contains("                    const_value: 5\n"));
        assertTrue(output.contains("                    const_value: True\n"));
        assertTrue(output.contains("                    const_value: \"a\\\"b\"\n"));
        assertTrue(output.contains("            outputs:\n"
                + "                \"status\": string\n"
                + "                    description: \"Result\"\n"
                + "                    label: \"Status\"\n"
                + "                    is_displayable: True\n"
                + "                    is_used_by_planner: True\n"));
    }

    @Test
    void shouldEscapeQuotedStrings() {
        assertEquals("\"a\\\\b \\\"c\\\" \\n\\t\"", AgentScriptSerializer.quote("a\\b \"c\" \n\t"));
        assertEquals("\"\"", AgentScriptSerializer.quote(null));
    }

    @Test
    void shouldEndWithSingleNewline() {
        String output = serializer.serialize(baseModel().build(), rules);

        assertTrue(output.endsWith("\n"));
        assertFalse(output.endsWith("\n\n"));
    }
}
