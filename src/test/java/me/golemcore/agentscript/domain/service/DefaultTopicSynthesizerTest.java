package me.golemcore.agentscript.domain.service;

import me.golemcore.agentscript.domain.model.AgentModel;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.ReasoningRef;
import me.golemcore.agentscript.domain.model.Topic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultTopicSynthesizerTest {

    private DefaultTopicSynthesizer synthesizer;
    private ConversionRules rules;

    @BeforeEach
    void setUp() {
        synthesizer = new DefaultTopicSynthesizer(new NameSanitizer());
        rules = ConversionRules.defaults();
    }

    private static Topic userTopic(String key, boolean canEscalate) {
        return Topic.builder()
                .key(key)
                .label(key)
                .description("About " + key)
                .instruction("Help with " + key + ".")
                .canEscalate(canEscalate)
                .build();
    }

    private static List<String> keys(AgentModel model) {
        return model.getTopics().stream().map(Topic::getKey).toList();
    }

    private static Topic topic(AgentModel model, String key) {
        return model.getTopics().stream().filter(topic -> topic.getKey().equals(key)).findFirst().orElseThrow();
    }

    private static Topic start(AgentModel model) {
        return model.getTopics().stream().filter(Topic::isStart).findFirst().orElseThrow();
    }

    @Test
    void shouldAddStartTopicAndFallbacksAroundUserTopics() {
        AgentModel model = synthesizer.synthesize(AgentModel.builder()
                .topic(userTopic("orders", false))
                .topic(userTopic("billing", false))
                .build(), rules);

        assertEquals(List.of("topic_selector", "orders", "billing", "escalation", "off_topic", "ambiguous_question"),
                keys(model));
        assertTrue(model.getTopics().get(0).isStart());
        assertEquals(1, model.getTopics().stream().filter(Topic::isStart).count());
    }

    @Test
    void shouldRouteStartTopicToEveryOtherTopic() {
        AgentModel model = synthesizer.synthesize(AgentModel.builder().topic(userTopic("orders", false)).build(), rules);

        Topic start = start(model);
        assertEquals(List.of("go_to_orders", "go_to_escalation", "go_to_off_topic", "go_to_ambiguous_question"),
                List.copyOf(start.getReasoningRefs().keySet()));
        assertEquals("@utils.transition to @topic.orders", start.getReasoningRefs().get("go_to_orders").getTarget());
        assertTrue(start.isSynthesized());
    }

    @Test
    void shouldSynthesizeMandatoryTopicsForEmptyModel() {
        AgentModel model = synthesizer.synthesize(AgentModel.builder().build(), rules);

        assertEquals(List.of("topic_selector", "escalation", "off_topic", "ambiguous_question"), keys(model));
        Topic escalation = topic(model, "escalation");
        ReasoningRef escalate = escalation.getReasoningRefs().get(ReasoningRef.ESCALATE_NAME);
        assertEquals(ReasoningRef.ESCALATE_TARGET, escalate.getTarget());
        assertEquals("Call this tool to escalate to a human agent.", escalate.getDescription());
    }

    @Test
    void shouldAppendSecurityRulesToRedirectingFallbacks() {
        AgentModel model = synthesizer.synthesize(AgentModel.builder().build(), rules);

        List<String> block = new ArrayList<>();
        block.add("Rules:");
        ConversionRules.DEFAULT_SECURITY_RULES.forEach(rule -> block.add("  " + rule));
        for (String key : List.of("off_topic", "ambiguous_question")) {
            List<String> instructions = topic(model, key).getInstructions();
            assertEquals(12, block.size());
            assertEquals(block, instructions.subList(instructions.size() - block.size(), instructions.size()), key);
        }
        assertFalse(topic(model, "escalation").getInstructions().contains("Rules:"));
        assertFalse(start(model).getInstructions().contains("Rules:"));
    }

    @Test
    void shouldLetUserTopicReplaceFallbackAndStillCarrySecurityRules() {
        AgentModel model = synthesizer.synthesize(AgentModel.builder().topic(userTopic("off_topic", false)).build(),
                rules);

        assertEquals(List.of("topic_selector", "off_topic", "escalation", "ambiguous_question"), keys(model));
        Topic offTopic = topic(model, "off_topic");
        assertFalse(offTopic.isSynthesized());
        assertEquals("Help with off_topic.", offTopic.getInstructions().get(0));
        assertEquals("Rules:", offTopic.getInstructions().get(1));
    }

    @Test
    void shouldNotDuplicateSecurityRules() {
        AgentModel once = synthesizer.synthesize(AgentModel.builder().build(), rules);
        AgentModel twice = synthesizer.synthesize(once, rules);

        assertEquals(topic(once, "off_topic").getInstructions(),
                topic(twice, "off_topic").getInstructions());
    }

    @Test
    void shouldUseUserSelectorAsStartTopic() {
        Topic selector = userTopic("topic_selector", false);

        AgentModel model = synthesizer.synthesize(AgentModel.builder().topic(selector).build(), rules);

        Topic start = start(model);
        assertEquals("About topic_selector", start.getDescription());
        assertTrue(start.getReasoningRefs().isEmpty());
        assertEquals(List.of("topic_selector", "escalation", "off_topic", "ambiguous_question"), keys(model));
    }

    @Test
    void shouldAddEscalationReferenceToEscalatingTopics() {
        AgentModel model = synthesizer.synthesize(AgentModel.builder()
                .topic(userTopic("orders", true))
                .topic(userTopic("billing", false))
                .build(), rules);

        assertTrue(topic(model, "orders").getReasoningRefs().containsKey("escalate_to_human"));
        assertFalse(topic(model, "billing").getReasoningRefs().containsKey("escalate_to_human"));
    }

    @Test
    void shouldHonorConfiguredSecurityRules() {
        rules.setSecurityRules(List.of("Only one rule."));

        AgentModel model = synthesizer.synthesize(AgentModel.builder().build(), rules);

        List<String> instructions = topic(model, "off_topic").getInstructions();
        assertEquals(List.of("Rules:", "  Only one rule."), instructions.subList(instructions.size() - 2,
                instructions.size()));
    }
}
