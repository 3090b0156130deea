package org.rostilos.reviewpipe.reviewcli.command;

import org.rostilos.reviewpipe.analysisengine.extract.ExtractedFinding;
import org.rostilos.reviewpipe.analysisengine.extract.ExtractedFindingsFormatter;
import org.rostilos.reviewpipe.analysisengine.extract.ReportMarkdownExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * {@code extract <report.md>}: print or write the findings ticked in a rendered report.
 */
@Component
public class ExtractCommand {
    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    private final ReportMarkdownExtractor extractor;
    private final ExtractedFindingsFormatter formatter;
    private final PrintStream out;

    public ExtractCommand(ReportMarkdownExtractor extractor, ExtractedFindingsFormatter formatter, PrintStream out) {
        this.extractor = extractor;
        this.formatter = formatter;
        this.out = out;
    }

    /**
     * @param reportFile path given after the command name
     */
    public int run(String reportFile, ApplicationArguments args) {
        Path reportPath = Path.of(reportFile);
        List<ExtractedFinding> findings;
        try {
            findings = extractor.extract(reportPath);
        } catch (NoSuchFileException e) {
            out.println("Error: report file not found: " + reportPath);
            return ExitStatus.FAILURE;
        } catch (IOException e) {
            log.error("Cannot read report {}: {}", reportPath, e.getMessage(), e);
            out.println("Error: cannot read report " + reportPath + ": " + e.getMessage());
            return ExitStatus.FAILURE;
        }

        String rendered = args.containsOption("json")
                ? formatter.toJson(findings)
                : formatter.toMarkdown(findings);

        String output = ReviewCommand.singleOption(args, "output");
        if (output == null) {
            out.println(rendered);
            return ExitStatus.OK;
        }

        Path outputPath = Path.of(output);
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, rendered, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot write {}: {}", outputPath, e.getMessage(), e);
            out.println("Error: cannot write " + outputPath + ": " + e.getMessage());
            return ExitStatus.FAILURE;
        }
        out.println("Extracted " + findings.size() + " finding(s) to " + outputPath);
        return ExitStatus.OK;
    }
}
