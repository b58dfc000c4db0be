package com.example.styleverify.config;

import com.example.styleverify.model.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the style verification engine.
 */
@ConfigurationProperties(prefix = "styleverify")
public record StyleVerifyProperties(
        Extractor extractor,
        Comparison comparison,
        SeverityPolicy severity,
        Mongo mongo
) {

    public StyleVerifyProperties {
        if (extractor == null) extractor = new Extractor(null, null, null, null);
        if (comparison == null) comparison = new Comparison(0);
        if (severity == null) severity = new SeverityPolicy(null, null, null, null, null, null);
        if (mongo == null) mongo = new Mongo(null);
    }

    /** Defaults used when no configuration is bound (tests, embedded use). */
    public static StyleVerifyProperties defaults() {
        return new StyleVerifyProperties(null, null, null, null);
    }

    /**
     * Configuration of the document extraction collaborator.
     *
     * @param mode           {@code json} (document bytes are a JSON export of contexts) or {@code remote}
     * @param baseUrl        base URL of the remote extraction service (e.g. http://localhost:5001)
     * @param connectTimeout connect timeout for the remote service
     * @param readTimeout    read timeout for the remote service
     */
    public record Extractor(String mode, String baseUrl, Duration connectTimeout, Duration readTimeout) {
        public Extractor {
            if (mode == null || mode.isBlank()) mode = "json";
            if (connectTimeout == null) connectTimeout = Duration.ofSeconds(30);
            if (readTimeout == null) readTimeout = Duration.ofMinutes(2);
        }
    }

    /**
     * Configuration of the pair comparison worker pool.
     *
     * @param parallelism number of worker threads; 0 or less means one per available processor
     */
    public record Comparison(int parallelism) {
        public int effectiveParallelism() {
            return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        }
    }

    /**
     * Severity policy applied by the mismatch aggregator.
     *
     * @param structural               missing / unexpected contexts
     * @param signature                font, color, alignment and other style property differences
     * @param directFormat             direct formatting pattern differences
     * @param tabStop                  tab stop differences
     * @param escalated                severity used for escalated direct-format and tab-stop mismatches
     * @param escalationRolePrefixes   structural roles (prefix, case-insensitive) that trigger escalation
     */
    public record SeverityPolicy(
            Severity structural,
            Severity signature,
            Severity directFormat,
            Severity tabStop,
            Severity escalated,
            List<String> escalationRolePrefixes
    ) {
        public SeverityPolicy {
            if (structural == null) structural = Severity.MEDIUM;
            if (signature == null) signature = Severity.HIGH;
            if (directFormat == null) directFormat = Severity.MEDIUM;
            if (tabStop == null) tabStop = Severity.MEDIUM;
            if (escalated == null) escalated = Severity.HIGH;
            escalationRolePrefixes = escalationRolePrefixes == null
                    ? List.of("Heading")
                    : List.copyOf(escalationRolePrefixes);
        }
    }

    /**
     * @param uri MongoDB connection string, including the database name
     */
    public record Mongo(String uri) {
        public Mongo {
            if (uri == null || uri.isBlank()) uri = "mongodb://localhost:27017/style_verify";
        }
    }
}
