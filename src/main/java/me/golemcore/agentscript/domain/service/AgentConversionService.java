package me.golemcore.agentscript.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentscript.domain.model.AgentModel;
import me.golemcore.agentscript.domain.model.ConversionReport;
import me.golemcore.agentscript.domain.model.ConversionResult;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.SourceDocument;
import me.golemcore.agentscript.port.inbound.ConversionPort;
import org.springframework.stereotype.Service;

/**
 * Runs the conversion pipeline: classify, build, synthesize defaults,
 * resolve variable references, then serialize and extract the report from
 * the same finished model.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentConversionService implements ConversionPort {

    private final SourceShapeClassifier classifier;
    private final AgentModelBuilder modelBuilder;
    private final DefaultTopicSynthesizer synthesizer;
    private final VariableCollector variableCollector;
    private final AgentScriptSerializer serializer;
    private final ConversionReportExtractor reportExtractor;

    @Override
    public ConversionResult convert(JsonNode document, ConversionRules rules) {
        ConversionRules effective = rules != null ? rules : ConversionRules.defaults();
        SourceDocument source = classifier.classify(document);

        AgentModelBuilder.Draft draft = modelBuilder.build(source, effective);
        AgentModel synthesized = synthesizer.synthesize(draft.model(), effective);
        AgentModel model = variableCollector.collect(synthesized, draft.declarations(), effective);

        String output = serializer.serialize(model, effective);
        ConversionReport report = reportExtractor.extract(model, effective);

        boolean rewritten = model.isVariablesRewritten();
        log.info("[Convert] {} converted: {} topics, {} actions, {} variables{}", source.shape(),
                model.getTopics().size(), model.getActionCount(), model.getVariables().size(),
                rewritten ? ", legacy variable references rewritten" : "");
        return ConversionResult.builder()
                .output(output)
                .sourceShape(source.shape())
                .variablesRewritten(rewritten)
                .topicCount(model.getTopics().size())
                .actionCount(model.getActionCount())
                .alertMessage(rewritten ? effective.getVariableConversion().getAlertMessage() : null)
                .statusSuffix(rewritten ? effective.getVariableConversion().getStatusSuffix() : null)
                .report(report)
                .build();
    }
}
