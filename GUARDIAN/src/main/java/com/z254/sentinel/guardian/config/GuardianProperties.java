package com.z254.sentinel.guardian.config;

import com.z254.sentinel.guardian.domain.model.ExecutionContext;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the GUARDIAN service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Recursion guard and verification thresholds</li>
 *     <li>Ticket store, deduplication and grouping</li>
 *     <li>Pattern correlation and predictive alerting</li>
 *     <li>Root-cause learning and enhancement approval</li>
 *     <li>Scheduling, telemetry and collaborator clients</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "guardian")
public class GuardianProperties {

    /** Root of the workspace being monitored */
    @NotBlank
    private String workingDirectory = ".";

    /** Whether GUARDIAN runs inside the framework itself or inside an end-user project */
    @NotNull
    private ExecutionContext executionContext = ExecutionContext.PROJECT;

    private final Recursion recursion = new Recursion();
    private final Verification verification = new Verification();
    private final Tickets tickets = new Tickets();
    private final Correlation correlation = new Correlation();
    private final Enhancement enhancement = new Enhancement();
    private final Learning learning = new Learning();
    private final Schedule schedule = new Schedule();
    private final Commands commands = new Commands();
    private final Remediation remediation = new Remediation();
    private final Context context = new Context();
    private final Framework framework = new Framework();
    private final HistoricalLearnings historicalLearnings = new HistoricalLearnings();
    private final Telemetry telemetry = new Telemetry();
    private final Snapshots snapshots = new Snapshots();

    /**
     * Recursion guard limits.
     */
    @Data
    public static class Recursion {
        /** Maximum concurrently active verification sessions */
        @Positive
        private int maxConcurrentSessions = 3;
    }

    /**
     * Verification pipeline configuration.
     */
    @Data
    public static class Verification {
        @Min(0) @Max(100)
        private int frameworkAutoApplyThreshold = 90;

        @Min(0) @Max(100)
        private int projectAutoApplyThreshold = 90;

        /** Context-layer fixes touch user-visible conventions */
        @Min(0) @Max(100)
        private int contextAutoApplyThreshold = 95;

        /** Per-issue verifier timeout; a timed-out verifier fails closed */
        private Duration verifierTimeout = Duration.ofSeconds(30);

        /** Issues verified concurrently within one run */
        @Positive
        private int parallelism = 4;

        /** Window for git history evidence */
        private Duration gitHistoryWindow = Duration.ofDays(7);
    }

    /**
     * Ticket store, deduplication and grouping.
     */
    @Data
    public static class Tickets {
        /** Ticket directory, relative to the working directory */
        @NotBlank
        private String directory = "todos";

        /** Archive sub-directory for tickets past retention */
        @NotBlank
        private String archiveDirectory = "archive";

        private boolean groupingEnabled = true;

        @NotNull
        private GroupingStrategy groupingStrategy = GroupingStrategy.AGENT;

        @Positive
        private int maxGroupSize = 10;

        /** Duplicates older than this are refreshed instead of suppressed */
        private Duration stalenessWindow = Duration.ofHours(24);

        /** Tickets older than this are archived by the cleanup cycle */
        private Duration retention = Duration.ofHours(72);

        @Positive
        private int fingerprintLength = 100;
    }

    /**
     * Pattern correlation and predictive alerting.
     */
    @Data
    public static class Correlation {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double minCoefficient = 0.7;

        /** Slopes within +/- epsilon are considered stable */
        private double slopeEpsilon = 0.1;

        /** Critical value for 0-100 health/score metrics */
        private double breachThreshold = 70.0;

        /** Breach ETAs beyond this horizon do not raise an alert */
        private double alertHorizonHours = 24.0;

        @Min(2)
        private int minSnapshots = 3;
    }

    /**
     * Enhancement detection and approval.
     */
    @Data
    public static class Enhancement {
        /** Learn from recurring issues and propose enhancements */
        private boolean enabled = true;

        @Min(0) @Max(100)
        private int minConfidence = 80;

        @Positive
        private int minOccurrences = 3;

        @Min(0) @Max(100)
        private int tier1Threshold = 95;

        @Min(0) @Max(100)
        private int tier2Threshold = 80;

        @NotNull
        private ApprovalMode approvalMode = ApprovalMode.MANUAL;
    }

    /**
     * Root-cause learning over snapshot history.
     */
    @Data
    public static class Learning {
        private Duration recurrenceWindow = Duration.ofHours(24);

        @Positive
        private int minOccurrences = 3;

        @Positive
        private int maxSecondaryCauses = 3;

        /** Components the platform itself owns */
        private List<String> knownComponents = new ArrayList<>(List.of(
                "framework", "agents", "rag", "build", "tests", "hooks", "guardian", "mcp", "dependencies"));
    }

    /**
     * Scheduling of background cycles.
     */
    @Data
    public static class Schedule {
        private Duration healthCheckInterval = Duration.ofMinutes(30);
        private Duration cleanupInterval = Duration.ofMinutes(30);

        /** Delay before the first cycle after startup */
        private Duration initialDelay = Duration.ofMinutes(1);
        private boolean cleanupEnabled = true;

        /** Snapshots retained for correlation and learning */
        @Positive
        private int historySize = 100;
    }

    /**
     * Commands run against the monitored workspace.
     */
    @Data
    public static class Commands {
        private List<String> build = new ArrayList<>(List.of("npm", "run", "build"));
        private List<String> clean = new ArrayList<>(List.of("npm", "run", "clean"));
        private List<String> typecheck = new ArrayList<>(List.of("npx", "tsc", "--noEmit"));
        private List<String> test = new ArrayList<>(List.of("npm", "test"));
        private List<String> install = new ArrayList<>(List.of("npm", "install"));
        private List<String> auditFix = new ArrayList<>(List.of("npm", "audit", "fix"));
        private Duration timeout = Duration.ofMinutes(5);
    }

    /**
     * Auto-remediation procedures.
     */
    @Data
    public static class Remediation {
        private String projectConfigFile = ".guardian-project.json";
        private String ragStorageDirectory = ".guardian/rag";
        private Duration reconnectDelay = Duration.ofSeconds(2);
        private List<String> defaultAgents = new ArrayList<>(List.of(
                "maria-qa", "james-frontend", "marcus-backend"));
    }

    /**
     * Preference sources for context-layer verification.
     */
    @Data
    public static class Context {
        /** Preference directories in priority order (user, team, project) */
        private List<String> preferenceDirectories = new ArrayList<>(List.of(
                ".guardian/user", ".guardian/team", ".guardian/project"));

        /** Git author name to agent */
        private Map<String, String> authorAgents = new HashMap<>();

        private String defaultAgent = "Alex-BA";
    }

    /**
     * Framework layout checked by the framework verifier.
     */
    @Data
    public static class Framework {
        private String agentsDirectory = ".claude/agents";
        private String settingsFile = ".claude/settings.json";
        private String mcpConfigFile = ".mcp.json";
        private String ragSourceFile = "src/rag/vector-memory-store.ts";
        private String ragCompiledFile = "dist/rag/vector-memory-store.js";
        private List<String> requiredAgentSections = new ArrayList<>(List.of("Role", "Tools", "Activation"));
    }

    /**
     * Historical-learnings collaborator.
     */
    @Data
    public static class HistoricalLearnings {
        private boolean enabled = false;
        private String url = "http://localhost:8090";
        private Duration timeout = Duration.ofSeconds(2);

        @Positive
        private int searchLimit = 5;

        private Duration cacheTtl = Duration.ofMinutes(10);
    }

    /**
     * Telemetry output.
     */
    @Data
    public static class Telemetry {
        private String directory = ".guardian/telemetry";
        private String eventLogFile = "events.jsonl";
        private String metricsFile = "metrics.json";

        /** Smoothing factor for moving averages */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double movingAverageAlpha = 0.2;
    }

    /**
     * Health snapshot source.
     */
    @Data
    public static class Snapshots {
        /** Latest snapshot written by the external health checker */
        private String path = ".guardian/health-snapshot.json";
    }

    /**
     * Partitioning key for combined tickets.
     */
    public enum GroupingStrategy {
        AGENT,
        PRIORITY,
        LAYER
    }

    /**
     * Handling of Tier 2 enhancement suggestions.
     */
    public enum ApprovalMode {
        /** Treat Tier 2 like Tier 1 */
        AUTO,
        /** Ask the configured prompter */
        INTERACTIVE,
        /** File every Tier 2 suggestion as a ticket */
        MANUAL
    }
}
