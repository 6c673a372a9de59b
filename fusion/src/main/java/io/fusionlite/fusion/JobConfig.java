// file: fusion/src/main/java/io/fusionlite/fusion/JobConfig.java
package io.fusionlite.fusion;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fusionlite.core.PixelType;
import io.fusionlite.core.UnsupportedTypeException;
import io.fusionlite.core.image.Rectangle;
import io.fusionlite.fusion.dto.JsonJobConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings of one parallel fusion job, usually loaded from JSON:
 * <pre>
 * {
 *   "type": "uint16",
 *   "threads": 4,
 *   "predictionArea": {"x": 0, "y": 0, "width": 0, "height": 0}
 * }
 * </pre>
 *  - type:           pixel type used to pick the fusor specialization.
 *  - threads:        worker count > 0 (optional, defaults to the processor count).
 *  - predictionArea: optional; all-zero or missing means the full image.
 */
public record JobConfig(PixelType type, int threads, Rectangle predictionArea) {

    public JobConfig {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(predictionArea, "predictionArea");
        if (type == PixelType.INVALID) throw new IllegalArgumentException("type must be a valid pixel type");
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
        if (predictionArea.width() < 0 || predictionArea.height() < 0) {
            throw new IllegalArgumentException("predictionArea must not have negative size");
        }
    }

    /**
     * Read and validate a job file.
     *
     * @throws RuntimeException wrapping the cause if the file cannot be read or
     *         parsed, or names an unknown pixel type
     * @throws IllegalArgumentException if a value is out of range, e.g. threads not positive
     */
    public static JobConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonJobConfig cfg = mapper.readValue(path.toFile(), JsonJobConfig.class);

            Rectangle area = cfg.predictionArea == null
                    ? Rectangle.NONE
                    : new Rectangle(cfg.predictionArea.x, cfg.predictionArea.y,
                                    cfg.predictionArea.width, cfg.predictionArea.height);
            int threads = cfg.threads == null ? Runtime.getRuntime().availableProcessors() : cfg.threads;

            return new JobConfig(PixelType.parse(cfg.type), threads, area);
        } catch (IOException | UnsupportedTypeException e) {
            throw new RuntimeException("Failed to load JobConfig from " + path, e);
        }
    }

    /** Copy threads and prediction area into {@code options}. */
    public <O extends Options> ParallelizerOptions<O> applyTo(ParallelizerOptions<O> options) {
        options.setNumberOfThreads(threads);
        options.setPredictionArea(predictionArea);
        return options;
    }
}
