package me.golemcore.agentscript.adapter.inbound.web.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentscript.adapter.inbound.web.dto.ConversionRequest;
import me.golemcore.agentscript.adapter.inbound.web.dto.ConversionResponse;
import me.golemcore.agentscript.domain.model.ConversionResult;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.infrastructure.config.ConversionRulesLoader;
import me.golemcore.agentscript.infrastructure.config.ConverterProperties;
import me.golemcore.agentscript.port.inbound.ConversionPort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Conversion endpoints.
 */
@RestController
@RequestMapping("/api/conversions")
@Slf4j
public class ConversionController {

    private static final String YAML_SUBTYPE = "yaml";

    private final ConversionPort conversionPort;
    private final ConversionRulesLoader rulesLoader;
    private final ConverterProperties properties;
    private final ObjectMapper objectMapper;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConversionController(ConversionPort conversionPort, ConversionRulesLoader rulesLoader,
            ConverterProperties properties, ObjectMapper objectMapper) {
        this.conversionPort = conversionPort;
        this.rulesLoader = rulesLoader;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ConversionResponse>> convert(@RequestBody ConversionRequest request) {
        if (request.getDocument() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "document is required");
        }
        ConversionRules rules = request.getRules() != null ? rulesLoader.withOverrides(request.getRules())
                : rulesLoader.getRules();
        ConversionResult result = conversionPort.convert(request.getDocument(), rules);
        return Mono.just(ResponseEntity.ok(toResponse(result)));
    }

    /**
     * Converts a raw JSON or YAML document and returns only the Agent Script
     * text.
     */
    @PostMapping(value = "/agent-script", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> convertToText(@RequestBody String body,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType) {
        JsonNode document = parse(body, contentType);
        ConversionResult result = conversionPort.convert(document, rulesLoader.getRules());
        return Mono.just(ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(result.getOutput()));
    }

    private JsonNode parse(String body, String contentType) {
        boolean yaml = contentType != null && contentType.toLowerCase(Locale.ROOT).contains(YAML_SUBTYPE);
        try {
            return (yaml ? yamlMapper : objectMapper).readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("[API] Unreadable {} document: {}", yaml ? "YAML" : "JSON", e.getOriginalMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Unreadable document: " + e.getOriginalMessage());
        }
    }

    private ConversionResponse toResponse(ConversionResult result) {
        return ConversionResponse.builder()
                .output(result.getOutput())
                .sourceShape(result.getSourceShape().name())
                .variablesRewritten(result.isVariablesRewritten())
                .topicCount(result.getTopicCount())
                .actionCount(result.getActionCount())
                .alertMessage(result.getAlertMessage())
                .statusSuffix(result.getStatusSuffix())
                .report(properties.getReport().isIncludeNotes() ? result.getReport()
                        : result.getReport().toBuilder().clearNotes().build())
                .build();
    }
}
