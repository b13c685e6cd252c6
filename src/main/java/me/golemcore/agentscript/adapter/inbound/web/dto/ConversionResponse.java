package me.golemcore.agentscript.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.agentscript.domain.model.ConversionReport;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionResponse {
    private String output;
    private String sourceShape;
    private boolean variablesRewritten;
    private int topicCount;
    private int actionCount;
    private String alertMessage;
    private String statusSuffix;
    private ConversionReport report;
}
