package org.rostilos.reviewpipe.reviewcli.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Dispatches the first non-option argument to a command and keeps its exit status.
 */
@Component
public class ReviewCliRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(ReviewCliRunner.class);

    static final String USAGE = """
            Usage:
              review [--commit=<ref>] [--from=<ref> --to=<ref>] [--file=<diff>] [--repo=<dir>]
                     [--format=markdown,json] [--output=<dir>] [--skip-stage=<name>,...]
              extract <report.md> [--json] [--output=<file>]
            """;

    private final ReviewCommand reviewCommand;
    private final ExtractCommand extractCommand;
    private final PrintStream out;

    private int exitCode = ExitStatus.OK;

    public ReviewCliRunner(ReviewCommand reviewCommand, ExtractCommand extractCommand, PrintStream out) {
        this.reviewCommand = reviewCommand;
        this.extractCommand = extractCommand;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        try {
            if (positional.isEmpty()) {
                throw new CliUsageException("No command given");
            }
            String command = positional.get(0);
            exitCode = switch (command) {
                case "review" -> reviewCommand.run(args);
                case "extract" -> {
                    if (positional.size() < 2) {
                        throw new CliUsageException("extract requires the path of a report");
                    }
                    yield extractCommand.run(positional.get(1), args);
                }
                default -> throw new CliUsageException("Unknown command: " + command);
            };
        } catch (CliUsageException e) {
            log.debug("Usage error: {}", e.getMessage());
            out.println("Error: " + e.getMessage());
            out.print(USAGE);
            exitCode = ExitStatus.USAGE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
