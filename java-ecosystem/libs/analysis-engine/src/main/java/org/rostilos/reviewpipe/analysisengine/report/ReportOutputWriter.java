package org.rostilos.reviewpipe.analysisengine.report;

import org.rostilos.reviewpipe.core.model.report.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders and persists one artifact per configured format. Artifacts are independent:
 * a failing renderer or write only costs that artifact.
 */
public class ReportOutputWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportOutputWriter.class);

    private static final String FILE_PREFIX = "code-review-";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);

    private final Map<String, ReportRenderer> renderers = new LinkedHashMap<>();
    private final Clock clock;

    public ReportOutputWriter(List<ReportRenderer> renderers) {
        this(renderers, Clock.systemUTC());
    }

    public ReportOutputWriter(List<ReportRenderer> renderers, Clock clock) {
        for (ReportRenderer renderer : renderers) {
            this.renderers.put(renderer.getFormat().toLowerCase(Locale.ROOT), renderer);
        }
        this.clock = clock;
    }

    /**
     * @return successfully written artifacts, in format order
     */
    public List<ReportOutput> write(Report report, List<String> formats, Path directory) {
        List<ReportOutput> outputs = new ArrayList<>();
        if (formats == null || formats.isEmpty()) {
            return outputs;
        }

        try {
            Files.createDirectories(directory);
        } catch (IOException | RuntimeException e) {
            log.error("Cannot create output directory {}: {}", directory, e.getMessage(), e);
            return outputs;
        }

        String timestamp = TIMESTAMP_FORMAT.format(clock.instant());
        for (String format : formats) {
            ReportRenderer renderer = format == null ? null : renderers.get(format.trim().toLowerCase(Locale.ROOT));
            if (renderer == null) {
                log.warn("Unknown output format '{}', skipping", format);
                continue;
            }

            Path path = directory.resolve(FILE_PREFIX + timestamp + renderer.getFileExtension());
            try {
                Files.writeString(path, renderer.render(report), StandardCharsets.UTF_8);
                outputs.add(new ReportOutput(renderer.getFormat(), path));
                log.info("{} report written to {}", renderer.getFormat(), path);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to write {} report to {}: {}", renderer.getFormat(), path, e.getMessage(), e);
            }
        }
        return outputs;
    }
}
