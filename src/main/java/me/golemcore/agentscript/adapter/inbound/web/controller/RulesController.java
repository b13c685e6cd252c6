package me.golemcore.agentscript.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.infrastructure.config.ConversionRulesLoader;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Rule configuration endpoints.
 */
@RestController
@RequestMapping("/api/rules")
@RequiredArgsConstructor
public class RulesController {

    private final ConversionRulesLoader rulesLoader;

    @GetMapping
    public Mono<ResponseEntity<ConversionRules>> getRules() {
        return Mono.just(ResponseEntity.ok(rulesLoader.getRules()));
    }

    @PostMapping("/reload")
    public Mono<ResponseEntity<Map<String, String>>> reloadRules() {
        rulesLoader.reload();
        return Mono.just(ResponseEntity.ok(Map.of("status", "reloaded")));
    }
}
