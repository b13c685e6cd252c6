package me.golemcore.agentscript.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentscript.adapter.inbound.web.dto.ConversionRequest;
import me.golemcore.agentscript.adapter.inbound.web.dto.ConversionResponse;
import me.golemcore.agentscript.domain.model.ConversionReport;
import me.golemcore.agentscript.domain.model.ConversionResult;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.SourceShape;
import me.golemcore.agentscript.infrastructure.config.ConversionRulesLoader;
import me.golemcore.agentscript.infrastructure.config.ConverterProperties;
import me.golemcore.agentscript.port.inbound.ConversionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.server.ResponseStatusException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class ConversionControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConversionPort conversionPort;
    private ConversionRulesLoader rulesLoader;
    private ConverterProperties properties;
    private ConversionController controller;
    private ConversionRules rules;

    @BeforeEach
    void setUp() {
        conversionPort = mock(ConversionPort.class);
        rulesLoader = mock(ConversionRulesLoader.class);
        properties = new ConverterProperties();
        rules = ConversionRules.defaults();
        when(rulesLoader.getRules()).thenReturn(rules);
        controller = new ConversionController(conversionPort, rulesLoader, properties, objectMapper);
    }

    private static ConversionResult result() {
        return ConversionResult.builder()
                .output("system:\n")
                .sourceShape(SourceShape.GENERIC_EXPORT)
                .topicCount(4)
                .report(ConversionReport.builder().note("- a note").build())
                .build();
    }

    @Test
    void shouldConvertDocumentWithCurrentRules() throws Exception {
        JsonNode document = objectMapper.readTree("{\"name\":\"Bot\"}");
        when(conversionPort.convert(document, rules)).thenReturn(result());

        StepVerifier.create(controller.convert(new ConversionRequest(document, null)))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    ConversionResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("system:\n", body.getOutput());
                    assertEquals("GENERIC_EXPORT", body.getSourceShape());
                    assertEquals(4, body.getTopicCount());
                    assertEquals(1, body.getReport().getNotes().size());
                })
                .verifyComplete();
        verify(rulesLoader, never()).withOverrides(any());
    }

    @Test
    void shouldApplyRequestRuleOverrides() throws Exception {
        JsonNode document = objectMapper.readTree("{}");
        JsonNode overrides = objectMapper.readTree("{\"system\":{\"instructions\":\"x\"}}");
        ConversionRules overridden = ConversionRules.defaults();
        when(rulesLoader.withOverrides(overrides)).thenReturn(overridden);
        when(conversionPort.convert(document, overridden)).thenReturn(result());

        StepVerifier.create(controller.convert(new ConversionRequest(document, overrides)))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();
        verify(conversionPort).convert(document, overridden);
    }

    @Test
    void shouldDropNotesWhenDisabled() throws Exception {
        properties.getReport().setIncludeNotes(false);
        JsonNode document = objectMapper.readTree("{}");
        when(conversionPort.convert(document, rules)).thenReturn(result());

        StepVerifier.create(controller.convert(new ConversionRequest(document, null)))
                .assertNext(response -> assertTrue(response.getBody().getReport().getNotes().isEmpty()))
                .verifyComplete();
    }

    @Test
    void shouldRejectMissingDocument() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.convert(new ConversionRequest(null, null)));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void shouldParseYamlBody() {
        when(conversionPort.convert(any(JsonNode.class), any(ConversionRules.class))).thenReturn(result());

        StepVerifier.create(controller.convertToText("name: Bot\ntopics:\n  - name: Help\n", "application/x-yaml"))
                .assertNext(response -> {
                    assertEquals(MediaType.TEXT_PLAIN, response.getHeaders().getContentType());
                    assertEquals("system:\n", response.getBody());
                })
                .verifyComplete();

        ArgumentCaptor<JsonNode> captor = ArgumentCaptor.forClass(JsonNode.class);
        verify(conversionPort).convert(captor.capture(), any(ConversionRules.class));
        assertEquals("Help", captor.getValue().get("topics").get(0).get("name").asText());
    }

    @Test
    void shouldRejectUnreadableJsonBody() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.convertToText("{not json", MediaType.APPLICATION_JSON_VALUE));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }
}
