package com.vidnyan.dre.config;

import com.vidnyan.dre.domain.gap.Severity;
import com.vidnyan.dre.domain.integration.IntegrationStrategy;
import com.vidnyan.dre.domain.request.RequestType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the dynamic request engine.
 * Can be configured via application.yml or environment variables (DRE_*).
 */
@Data
@Component
@ConfigurationProperties(prefix = "dre")
public class DynamicRequestProperties {

    /**
     * Request lifecycles processed at once; the rest wait in FIFO order.
     */
    private int maxConcurrentRequests = 50;

    private int defaultTimeoutMinutes = 30;

    private int maxTokensPerPackage = 4000;

    private IntegrationStrategy defaultIntegrationStrategy = IntegrationStrategy.MERGE;

    /**
     * Confidence assumed for a requester's own context when settling merge conflicts.
     */
    private double confidenceThreshold = 0.7;

    private int maxSpawnDepth = 3;

    /**
     * Detected gaps at or above this severity get a request created automatically.
     */
    private Severity autoRequestMinSeverity = Severity.HIGH;

    /**
     * Capabilities assumed for a request type when no expertise was named.
     */
    private Map<RequestType, List<String>> requestTypeCapabilities = new EnumMap<>(RequestType.class);

    private Selection selection = new Selection();

    private Helper helper = new Helper();

    @PostConstruct
    public void init() {
        if (requestTypeCapabilities.isEmpty()) {
            requestTypeCapabilities.put(RequestType.RESEARCH, List.of("codebase-research"));
            requestTypeCapabilities.put(RequestType.VALIDATION, List.of("validation", "security-audit"));
            requestTypeCapabilities.put(RequestType.ANALYSIS, List.of("analysis", "performance-profiling"));
            requestTypeCapabilities.put(RequestType.EXPERTISE, List.of("domain-expertise"));
            requestTypeCapabilities.put(RequestType.SUPPLEMENTAL_CONTEXT,
                    List.of("codebase-research", "architecture-analysis"));
            requestTypeCapabilities.put(RequestType.DEPENDENCY_ANALYSIS, List.of("dependency-analysis"));
            requestTypeCapabilities.put(RequestType.SECURITY_AUDIT, List.of("security-audit"));
            requestTypeCapabilities.put(RequestType.PERFORMANCE_ASSESSMENT, List.of("performance-profiling"));
        }
    }

    public List<String> capabilitiesFor(RequestType requestType) {
        return requestTypeCapabilities.getOrDefault(requestType, List.of());
    }

    /**
     * Weights of the helper selection score.
     */
    @Data
    public static class Selection {
        private double capabilityWeight = 0.3;
        private double availabilityWeight = 0.3;
        private double performanceWeight = 0.4;
    }

    @Data
    public static class Helper {
        /**
         * How long the simulated helper takes to answer.
         */
        private Duration simulatedDelay = Duration.ofSeconds(2);
    }
}
