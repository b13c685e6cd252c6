package me.golemcore.agentscript.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class VariableTest {

    @Test
    void shouldCoerceLinkedObjectToMutable() {
        Variable variable = Variable.builder().name("record").category(VariableCategory.LINKED).dataType("object")
                .source("Case.Record").build();

        assertEquals(VariableCategory.MUTABLE, variable.getCategory());
        assertNull(variable.getSource());
    }

    @Test
    void shouldDropActionOutputPlaceholderSource() {
        Variable variable = Variable.builder().name("status").category(VariableCategory.LINKED)
                .source("@action.Lookup.status").build();

        assertEquals(VariableCategory.LINKED, variable.getCategory());
        assertNull(variable.getSource());
    }

    @Test
    void shouldKeepLinkedSource() {
        Variable variable = Variable.builder().name("caseId").category(VariableCategory.LINKED)
                .source("@MessagingSession.CaseId").build();

        assertEquals("@MessagingSession.CaseId", variable.getSource());
        assertEquals("string", variable.getDataType());
    }

    @Test
    void shouldRejectInvalidName() {
        assertThrows(IllegalArgumentException.class, () -> Variable.builder().name("1abc").build());
        assertThrows(IllegalArgumentException.class, () -> Variable.builder().name("a-b").build());
    }
}
