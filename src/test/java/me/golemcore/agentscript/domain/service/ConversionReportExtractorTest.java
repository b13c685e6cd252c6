package me.golemcore.agentscript.domain.service;

import me.golemcore.agentscript.domain.model.Action;
import me.golemcore.agentscript.domain.model.AgentIdentity;
import me.golemcore.agentscript.domain.model.AgentModel;
import me.golemcore.agentscript.domain.model.ConversionReport;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.LocaleSettings;
import me.golemcore.agentscript.domain.model.Persona;
import me.golemcore.agentscript.domain.model.Tone;
import me.golemcore.agentscript.domain.model.Topic;
import me.golemcore.agentscript.domain.model.Variable;
import me.golemcore.agentscript.domain.model.VariableCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversionReportExtractorTest {

    private ConversionReportExtractor extractor;
    private ConversionRules rules;

    @BeforeEach
    void setUp() {
        extractor = new ConversionReportExtractor(new OpaqueIdentifierDetector());
        rules = ConversionRules.defaults();
    }

    private static AgentModel.AgentModelBuilder baseModel() {
        return AgentModel.builder()
                .identity(AgentIdentity.builder().name("Acme_Bot").label("Acme Bot").description("Acme Bot").build())
                .persona(Persona.builder().role("Helper").company("Acme").tone(Tone.FORMAL).build())
                .locale(LocaleSettings.builder().defaultLocale("en_US").additionalLocale("fr").build());
    }

    private static Action action(String name, String kind, String targetName, boolean descriptionGenerated) {
        return Action.builder()
                .name(name)
                .description(name)
                .descriptionGenerated(descriptionGenerated)
                .target(kind + "://" + targetName)
                .invocationKind(kind)
                .invocationTargetName(targetName)
                .build();
    }

    @Test
    void shouldFillAgentInfo() {
        ConversionReport report = extractor.extract(baseModel().build(), rules);

        ConversionReport.AgentInfo info = report.getAgentInfo();
        assertEquals("Acme Bot", info.getName());
        assertEquals("No description provided", info.getDescription());
        assertEquals("Helper", info.getPlannerRole());
        assertEquals("FORMAL", info.getTone());
        assertEquals("fr", info.getSecondaryLocales());
    }

    @Test
    void shouldListTopicActionsWithEscalation() {
        AgentModel model = baseModel()
                .topic(Topic.builder().key("orders").label("Orders").description("d").canEscalate(true)
                        .action("Lookup", action("Lookup", "apex", "OrderLookup", false)).build())
                .build();

        ConversionReport.TopicSummary summary = extractor.extract(model, rules).getTopics().get(0);

        assertEquals(2, summary.getActions().size());
        assertEquals("apex", summary.getActions().get(0).getActionType());
        ConversionReport.ActionSummary escalation = summary.getActions().get(1);
        assertEquals("escalate_to_human", escalation.getName());
        assertEquals("Escalate to Human", escalation.getLabel());
        assertEquals("escalation", escalation.getActionType());
    }

    @Test
    void shouldFlagFlowActionsPointingAtRecordIds() {
        AgentModel model = baseModel()
                .topic(Topic.builder().key("refunds").description("d")
                        .action("Refund", action("Refund", "flow", "172Kc000000PELdIAO", false))
                        .action("Named", action("Named", "flow", "Refund_Flow", false))
                        .action("Apex", action("Apex", "apex", "172Kc000000PELdIAO", false))
                        .build())
                .build();

        ConversionReport report = extractor.extract(model, rules);

        assertEquals(1, report.getFlaggedReferences().size());
        assertEquals("Refund", report.getFlaggedReferences().get(0).getActionName());
        assertTrue(report.getNotes().contains("  refunds.Refund -> flow://172Kc000000PELdIAO"));
        assertTrue(report.getNotes().stream().anyMatch(note -> note.startsWith("- MANUAL ACTION REQUIRED: 1 ")));
    }

    @Test
    void shouldWriteReviewNotesForSourceTopicsOnly() {
        AgentModel model = baseModel()
                .topic(Topic.builder().key("empty").description("Handles Empty requests").descriptionGenerated(true)
                        .build())
                .topic(Topic.builder().key("orders").description("d")
                        .action("Lookup", action("Lookup", "apex", "Lookup", true)).build())
                .topic(Topic.builder().key("off_topic").description("d").synthesized(true).build())
                .variable("orderId", Variable.builder().name("orderId").category(VariableCategory.MUTABLE)
                        .description("Variable for orderId").descriptionGenerated(true).build())
                .build();

        List<String> notes = extractor.extract(model, rules).getNotes();

        assertEquals(List.of(
                "- 1 topic(s) are missing descriptions: empty",
                "- 1 topic(s) have no actions: empty",
                "- 1 action(s) are missing descriptions: Lookup",
                "- 1 variable(s) are missing descriptions: orderId"), notes);
    }

    @Test
    void shouldReportRewrittenVariables() {
        AgentModel model = baseModel().rewrittenVariableName("Foo").build();

        ConversionReport report = extractor.extract(model, rules);

        assertTrue(report.getVariablesInInstructions().isHasVariables());
        assertEquals(List.of("Foo"), report.getVariablesInInstructions().getVariables());
        assertEquals("- (variables converted to @variables format)", report.getNotes().get(report.getNotes().size() - 1));
    }

    @Test
    void shouldLeaveAlertEmptyWithoutRewrites() {
        ConversionReport report = extractor.extract(baseModel().build(), rules);

        assertFalse(report.getVariablesInInstructions().isHasVariables());
        assertNull(report.getVariablesInInstructions().getAlertMessage());
        assertTrue(report.getNotes().isEmpty());
    }
}
