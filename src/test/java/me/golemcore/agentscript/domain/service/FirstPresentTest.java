package me.golemcore.agentscript.domain.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FirstPresentTest {

    @Test
    void shouldReturnFirstNonBlankCandidate() {
        assertEquals(Optional.of("b"), FirstPresent.of(null, "  ", "b", "c"));
    }

    @Test
    void shouldReturnEmptyWhenAllCandidatesBlank() {
        assertEquals(Optional.empty(), FirstPresent.of(Arrays.asList(null, "")));
    }

    @Test
    void shouldUseFallback() {
        assertEquals("fallback", FirstPresent.orElse("fallback", null, " "));
        assertEquals("x", FirstPresent.orElse("fallback", "x"));
    }
}
