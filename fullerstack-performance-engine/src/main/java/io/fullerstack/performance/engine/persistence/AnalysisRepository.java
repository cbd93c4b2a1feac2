package io.fullerstack.performance.engine.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.fullerstack.performance.engine.report.OptimizationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON files under the report directory.
 *
 * <h3>Files:</h3>
 * <ul>
 *   <li>{@code performance-baseline.json} - benchmark name to baseline score, read back on startup</li>
 *   <li>{@code performance-analysis.json} - analysis history, optimization history and baseline</li>
 *   <li>{@code optimization-report-<epochMillis>.json} - one per generated report</li>
 * </ul>
 *
 * <p>I/O failures surface as {@link UncheckedIOException}.
 */
public class AnalysisRepository {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisRepository.class);

    public static final String BASELINE_FILE = "performance-baseline.json";
    public static final String HISTORY_FILE = "performance-analysis.json";
    public static final String REPORT_PREFIX = "optimization-report-";

    private static final TypeReference<Map<String, Double>> BASELINE_TYPE = new TypeReference<>() {
    };

    private final Path directory;
    private final ObjectMapper objectMapper;

    public AnalysisRepository(Path directory) {
        this(directory, defaultObjectMapper());
    }

    public AnalysisRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    /**
     * ISO-8601 timestamps, indented output.
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    public Path saveBaseline(Map<String, Double> baseline) {
        Path file = write(BASELINE_FILE, baseline);
        logger.info("Performance baseline saved: {} entries", baseline.size());
        return file;
    }

    /**
     * @return the stored baseline, or empty if none has been saved yet
     */
    public Optional<Map<String, Double>> loadBaseline() {
        Path file = directory.resolve(BASELINE_FILE);
        if (!Files.exists(file)) {
            logger.debug("No performance baseline at {}", file);
            return Optional.empty();
        }
        try {
            Map<String, Double> baseline = objectMapper.readValue(file.toFile(), BASELINE_TYPE);
            logger.info("Performance baseline loaded: {} entries", baseline.size());
            return Optional.of(Map.copyOf(baseline));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public Path saveHistory(PersistedHistory history) {
        Path file = write(HISTORY_FILE, history);
        logger.info("Analysis results saved: {} analyses, {} optimizations",
            history.analysisHistory().size(), history.optimizationHistory().size());
        return file;
    }

    public Path saveReport(OptimizationReport report) {
        Path file = write(REPORT_PREFIX + report.timestamp().toEpochMilli() + ".json", report);
        logger.info("Optimization report written to {}", file);
        return file;
    }

    private Path write(String fileName, Object value) {
        Path file = directory.resolve(fileName);
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(file.toFile(), value);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
