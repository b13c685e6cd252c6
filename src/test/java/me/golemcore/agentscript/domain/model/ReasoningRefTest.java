package me.golemcore.agentscript.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReasoningRefTest {

    @Test
    void shouldBuildTransition() {
        ReasoningRef ref = ReasoningRef.transition("orders");

        assertEquals("go_to_orders", ref.getName());
        assertEquals("@utils.transition to @topic.orders", ref.getTarget());
        assertTrue(ref.getParameters().isEmpty());
    }

    @Test
    void shouldCarryActionInputsAsParameters() {
        Action action = Action.builder()
                .name("Lookup")
                .input("orderId", ParamDef.builder().name("orderId").role(ParamDef.Role.INPUT).type("string").build())
                .build();

        ReasoningRef ref = ReasoningRef.toAction(action);

        assertEquals("@actions.Lookup", ref.getTarget());
        assertEquals(List.of("orderId"), ref.getParameters());
    }

    @Test
    void shouldRejectParametersOnNonActionReference() {
        assertThrows(IllegalArgumentException.class, () -> ReasoningRef.builder()
                .name("go_to_x")
                .kind(ReasoningRef.Kind.TRANSITION)
                .parameters(List.of("p"))
                .build());
    }
}
