package me.golemcore.agentscript.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

/**
 * Converter configuration, bound from application.properties under the
 * {@code converter.*} prefix.
 *
 * <ul>
 * <li>{@link RulesProperties} - where the rule document lives</li>
 * <li>{@link WebProperties} - HTTP request limits</li>
 * <li>{@link ReportProperties} - report content</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "converter")
@Data
public class ConverterProperties {

    private RulesProperties rules = new RulesProperties();
    private WebProperties web = new WebProperties();
    private ReportProperties report = new ReportProperties();

    @Data
    public static class RulesProperties {
        private String location = "classpath:conversion-rules.json";
        private boolean failOnMissing = false;
    }

    @Data
    public static class WebProperties {
        private DataSize maxDocumentSize = DataSize.ofMegabytes(5);
    }

    @Data
    public static class ReportProperties {
        private boolean includeNotes = true;
    }
}
