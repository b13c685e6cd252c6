package me.golemcore.agentscript.adapter.inbound.web.controller;

import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.infrastructure.config.ConversionRulesLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class RulesControllerTest {

    private ConversionRulesLoader rulesLoader;
    private RulesController controller;

    @BeforeEach
    void setUp() {
        rulesLoader = mock(ConversionRulesLoader.class);
        controller = new RulesController(rulesLoader);
    }

    @Test
    void shouldReturnCurrentRules() {
        ConversionRules rules = ConversionRules.defaults();
        when(rulesLoader.getRules()).thenReturn(rules);

        StepVerifier.create(controller.getRules())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertSame(rules, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void shouldReloadRules() {
        StepVerifier.create(controller.reloadRules())
                .assertNext(response -> assertEquals("reloaded", response.getBody().get("status")))
                .verifyComplete();

        verify(rulesLoader).reload();
    }
}
