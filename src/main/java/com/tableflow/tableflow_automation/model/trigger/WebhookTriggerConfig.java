package com.tableflow.tableflow_automation.model.trigger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookTriggerConfig {

    private String urlPath;
    // none | api_key | bearer_token | signature
    private String authType = "none";
    private String authToken;
    private String apiKeyHeader = "X-API-Key";
    private String signatureSecret;
    private String signatureHeader = "X-Signature";
    private List<String> allowedMethods = new ArrayList<>(List.of("POST"));
    // target key -> dotted source path, e.g. "customer": "data.user.name"
    private Map<String, String> payloadMapping = new LinkedHashMap<>();
    private ValidationRules validationRules;

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ValidationRules {
        private List<String> requiredFields = new ArrayList<>();
    }
}
