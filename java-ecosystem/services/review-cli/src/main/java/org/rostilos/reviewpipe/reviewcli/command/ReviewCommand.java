package org.rostilos.reviewpipe.reviewcli.command;

import org.rostilos.reviewpipe.analysisengine.config.ReviewPipeProperties;
import org.rostilos.reviewpipe.analysisengine.exception.DiffUnreadableException;
import org.rostilos.reviewpipe.analysisengine.parser.DiffSource;
import org.rostilos.reviewpipe.analysisengine.parser.UnifiedDiffParser;
import org.rostilos.reviewpipe.analysisengine.pipeline.PipelineConfig;
import org.rostilos.reviewpipe.analysisengine.pipeline.PipelineExecutor;
import org.rostilos.reviewpipe.analysisengine.pipeline.PipelineOutcome;
import org.rostilos.reviewpipe.analysisengine.report.ReportOutput;
import org.rostilos.reviewpipe.analysisengine.stage.StageDefinition;
import org.rostilos.reviewpipe.core.model.diff.ParsedDiff;
import org.rostilos.reviewpipe.core.model.finding.StageResult;
import org.rostilos.reviewpipe.core.model.report.Report;
import org.rostilos.reviewpipe.core.model.report.ReportSummary;
import org.rostilos.reviewpipe.vcsclient.git.LocalGitDiffProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@code review}: parse a diff, run the stages and write the report artifacts.
 */
@Component
public class ReviewCommand {
    private static final Logger log = LoggerFactory.getLogger(ReviewCommand.class);

    static final String DEFAULT_COMMIT = "HEAD";

    private final UnifiedDiffParser diffParser;
    private final PipelineExecutor pipelineExecutor;
    private final ReviewPipeProperties properties;
    private final PrintStream out;

    public ReviewCommand(
            UnifiedDiffParser diffParser,
            PipelineExecutor pipelineExecutor,
            ReviewPipeProperties properties,
            PrintStream out
    ) {
        this.diffParser = diffParser;
        this.pipelineExecutor = pipelineExecutor;
        this.properties = properties;
        this.out = out;
    }

    public int run(ApplicationArguments args) {
        DiffSource source = resolveSource(args);
        UnifiedDiffParser parser = resolveParser(args);

        out.println("Reading diff from " + source.describe());
        ParsedDiff diff;
        try {
            diff = parser.parse(source);
        } catch (DiffUnreadableException e) {
            log.error("Cannot read diff: {}", e.getMessage(), e);
            out.println("Error: " + e.getMessage());
            return ExitStatus.FAILURE;
        }

        if (diff.isEmpty()) {
            out.println("Warning: no supported files changed (" + String.join(", ", parser.getSupportedExtensions())
                    + "), nothing to review");
            return ExitStatus.OK;
        }
        out.println(diff.getSummary());

        PipelineOutcome outcome = pipelineExecutor.execute(diff, buildConfig(args));
        if (!outcome.success()) {
            out.println("Error: " + outcome.error());
            return ExitStatus.FAILURE;
        }

        printSummary(outcome);
        return ExitStatus.OK;
    }

    PipelineConfig buildConfig(ApplicationArguments args) {
        Set<String> skipped = optionList(args, "skip-stage").stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<StageDefinition> stages = properties.toStageDefinitions().stream()
                .map(d -> skipped.contains(d.name().toLowerCase(Locale.ROOT))
                        ? new StageDefinition(d.name(), false, d.focus())
                        : d)
                .toList();

        List<String> formats = optionList(args, "format");
        if (formats.isEmpty()) {
            formats = properties.getOutput().getFormats();
        }
        String directory = singleOption(args, "output");
        Path outputDirectory = Path.of(directory != null ? directory : properties.getOutput().getDirectory());

        return new PipelineConfig(stages, formats, outputDirectory);
    }

    private DiffSource resolveSource(ApplicationArguments args) {
        String file = singleOption(args, "file");
        String commit = singleOption(args, "commit");
        String from = singleOption(args, "from");
        String to = singleOption(args, "to");

        if ((from == null) != (to == null)) {
            throw new CliUsageException("--from and --to must be given together");
        }
        int selected = (file != null ? 1 : 0) + (commit != null ? 1 : 0) + (from != null ? 1 : 0);
        if (selected > 1) {
            throw new CliUsageException("Use only one of --file, --commit or --from/--to");
        }

        if (file != null) {
            return DiffSource.ofFile(Path.of(file));
        }
        if (from != null) {
            return DiffSource.ofRange(from, to);
        }
        return DiffSource.ofCommit(commit != null ? commit : DEFAULT_COMMIT);
    }

    private UnifiedDiffParser resolveParser(ApplicationArguments args) {
        String repo = singleOption(args, "repo");
        if (repo == null) {
            return diffParser;
        }
        return new UnifiedDiffParser(diffParser.getSupportedExtensions(), new LocalGitDiffProvider(Path.of(repo)));
    }

    private void printSummary(PipelineOutcome outcome) {
        Report report = outcome.report();
        ReportSummary summary = report.getSummary();

        out.println();
        out.println("Review complete");
        out.println("  Total findings: " + summary.totalFindings());
        out.println("  Critical: " + summary.critical() + "  High: " + summary.high()
                + "  Medium: " + summary.medium() + "  Low: " + summary.low());
        summary.byStage().forEach((stage, count) -> {
            String failed = report.findStageResult(stage).filter(StageResult::isFailed).isPresent() ? " (failed)" : "";
            out.println("  " + stage + ": " + count + failed);
        });
        report.findTokenUsage().ifPresent(usage -> out.println("  Tokens used: " + usage.total()));

        for (ReportOutput output : outcome.outputs()) {
            out.println("  Report (" + output.format() + "): " + output.path());
        }
        out.println(String.format(Locale.ROOT, "  Execution time: %.2fs", report.getElapsed().toMillis() / 1000.0));
    }

    static String singleOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        if (value == null || value.isBlank()) {
            throw new CliUsageException("--" + name + " requires a value");
        }
        return value;
    }

    static List<String> optionList(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .flatMap(v -> Arrays.stream(v.split(",")))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
    }
}
