package com.vidnyan.dre.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.dre.application.port.out.ContextPackageStore;
import com.vidnyan.dre.config.DynamicRequestProperties;
import com.vidnyan.dre.domain.request.AgentRequest;
import com.vidnyan.dre.domain.request.ContextPackage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the bounded context package handed to a helper agent.
 *
 * Tokens are estimated from the serialized size (four characters per token). When the
 * package is over budget the largest context entries are dropped first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextPackageBuilder {

    static final int CHARS_PER_TOKEN = 4;

    private final DynamicRequestProperties properties;
    private final ContextPackageStore packageStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ContextPackage build(AgentRequest request) {
        int budget = properties.getMaxTokensPerPackage();

        Map<String, Object> requirements = new LinkedHashMap<>(request.getContextRequirements());
        Map<String, Object> gapContext = new LinkedHashMap<>(request.getGapContext());
        Map<String, Object> content = assemble(request, requirements, gapContext);
        int tokens = estimateTokens(content);

        while (tokens > budget && !requirements.isEmpty()) {
            String largest = largestEntry(requirements);
            requirements.remove(largest);
            log.debug("[ContextPackageBuilder] Dropped '{}' from package for {} ({} tokens over budget {})",
                    largest, request.getRequestId(), tokens, budget);
            content = assemble(request, requirements, gapContext);
            tokens = estimateTokens(content);
        }
        if (tokens > budget && !gapContext.isEmpty()) {
            gapContext.clear();
            content = assemble(request, requirements, gapContext);
            tokens = estimateTokens(content);
        }
        if (tokens > budget) {
            log.warn("[ContextPackageBuilder] Package for {} still needs {} tokens, budget is {}",
                    request.getRequestId(), tokens, budget);
        }

        ContextPackage contextPackage = new ContextPackage(
                UUID.randomUUID().toString(),
                content,
                budget,
                tokens,
                request.getRequestId(),
                clock.instant());
        packageStore.save(contextPackage);

        log.info("[ContextPackageBuilder] Package {} for request {}: ~{} tokens, {} context fields",
                contextPackage.packageId(), request.getRequestId(), tokens, requirements.size());
        return contextPackage;
    }

    private Map<String, Object> assemble(AgentRequest request,
                                         Map<String, Object> requirements,
                                         Map<String, Object> gapContext) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("request_id", request.getRequestId());
        details.put("requesting_agent", request.getRequestingAgent());
        details.put("workflow_id", request.getWorkflowId());
        details.put("request_type", request.getRequestType().wireName());
        details.put("urgency", request.getUrgency().wireName());
        details.put("description", request.getDescription());
        details.put("specific_expertise_needed", request.getSpecificExpertiseNeeded());
        details.put("spawn_depth", request.getSpawnDepth());
        if (request.getGapId() != null) {
            details.put("gap_id", request.getGapId());
            details.put("gap_context", new LinkedHashMap<>(gapContext));
        }

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("format", "structured_analysis");
        expected.put("required_fields", List.of("analysis", "findings", "recommendations", "confidence_metrics"));

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("request_details", details);
        content.put("context_requirements", new LinkedHashMap<>(requirements));
        content.put("expected_output", expected);
        return content;
    }

    int estimateTokens(Object value) {
        return (serializedLength(value) + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    private String largestEntry(Map<String, Object> entries) {
        return entries.entrySet().stream()
                .max(Comparator.comparingInt((Map.Entry<String, Object> e) -> serializedLength(e.getValue()))
                        .thenComparing(Map.Entry::getKey))
                .map(Map.Entry::getKey)
                .orElseThrow();
    }

    private int serializedLength(Object value) {
        try {
            return objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsString(value).length();
        } catch (JsonProcessingException e) {
            log.warn("[ContextPackageBuilder] Could not serialize context value, using its string form: {}",
                    e.getMessage());
            return String.valueOf(value).length();
        }
    }
}
