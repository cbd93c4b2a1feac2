package io.fullerstack.performance.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One timestamped observation of the monitored process.
 *
 * <p>Samples are produced by an external collector and accepted as-is. Any metric group may be
 * absent; metrics in an absent group resolve to {@code 0} through {@link #value(String)}.
 *
 * <h3>Metric paths:</h3>
 * <ul>
 *   <li>{@code system.cpu}, {@code system.memory}, {@code system.disk}, {@code system.network}</li>
 *   <li>{@code application.responseTime}, {@code application.throughput},
 *       {@code application.errorRate}, {@code application.activeConnections}</li>
 *   <li>{@code agents.total}, {@code agents.active}, {@code agents.averageHealth}</li>
 * </ul>
 *
 * @param timestamp   observation time
 * @param system      host readings, may be null
 * @param application application readings, may be null
 * @param agents      agent pool readings, may be null
 */
public record MetricSample(
    Instant timestamp,
    SystemMetrics system,
    ApplicationMetrics application,
    AgentMetrics agents
) {
    public static final String SYSTEM_CPU = "system.cpu";
    public static final String SYSTEM_MEMORY = "system.memory";
    public static final String SYSTEM_DISK = "system.disk";
    public static final String SYSTEM_NETWORK = "system.network";
    public static final String APPLICATION_RESPONSE_TIME = "application.responseTime";
    public static final String APPLICATION_THROUGHPUT = "application.throughput";
    public static final String APPLICATION_ERROR_RATE = "application.errorRate";
    public static final String APPLICATION_ACTIVE_CONNECTIONS = "application.activeConnections";
    public static final String AGENTS_TOTAL = "agents.total";
    public static final String AGENTS_ACTIVE = "agents.active";
    public static final String AGENTS_AVERAGE_HEALTH = "agents.averageHealth";

    /** Paths captured as the before/after snapshot of an optimization. */
    public static final List<String> SNAPSHOT_PATHS = List.of(
        SYSTEM_CPU,
        SYSTEM_MEMORY,
        APPLICATION_RESPONSE_TIME,
        APPLICATION_THROUGHPUT,
        APPLICATION_ERROR_RATE
    );

    public MetricSample {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }

    /**
     * Resolves a dotted metric path.
     *
     * @param path metric path such as {@code system.cpu}
     * @return metric value, or 0 for an unknown path or absent group
     */
    public double value(String path) {
        if (path == null) {
            return 0.0;
        }
        return switch (path) {
            case SYSTEM_CPU -> system == null ? 0.0 : system.cpu();
            case SYSTEM_MEMORY -> system == null ? 0.0 : system.memory();
            case SYSTEM_DISK -> system == null ? 0.0 : system.disk();
            case SYSTEM_NETWORK -> system == null ? 0.0 : system.network();
            case APPLICATION_RESPONSE_TIME -> application == null ? 0.0 : application.responseTime();
            case APPLICATION_THROUGHPUT -> application == null ? 0.0 : application.throughput();
            case APPLICATION_ERROR_RATE -> application == null ? 0.0 : application.errorRate();
            case APPLICATION_ACTIVE_CONNECTIONS -> application == null ? 0.0 : application.activeConnections();
            case AGENTS_TOTAL -> agents == null ? 0.0 : agents.total();
            case AGENTS_ACTIVE -> agents == null ? 0.0 : agents.active();
            case AGENTS_AVERAGE_HEALTH -> agents == null ? 0.0 : agents.averageHealth();
            default -> 0.0;
        };
    }
}
