package com.docsort.cli;

import com.docsort.filing.BatchProcessor;
import com.docsort.filing.BatchReport;
import com.docsort.filing.BatchReport.FileResult;
import com.docsort.filing.FilenameNormalizer;
import com.docsort.filing.FilingService;
import com.docsort.model.ClassificationOutcome;
import com.docsort.pipeline.DocumentPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;

/**
 * Command line entry point. Classifies a folder of scans and files each one
 * under its category, or classifies a single document in place.
 */
public final class DocsortCli {

    private static final Logger log = LoggerFactory.getLogger(DocsortCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private DocsortCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (options.help()) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }

        if (options.file() != null) {
            if (!Files.isRegularFile(options.file())) {
                err.println("'" + options.file() + "' file not found.");
                return EXIT_FAILURE;
            }
        } else if (!Files.isDirectory(options.input())) {
            err.println("'" + options.input() + "' folder not found.");
            return EXIT_FAILURE;
        }

        try (DocumentPipeline pipeline = DocumentPipeline.create(options.toSettings())) {
            return execute(options, pipeline, out);
        } catch (IOException | RuntimeException e) {
            log.error("Run failed", e);
            err.println("ERROR: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /** Run against an already wired pipeline. */
    static int execute(CliOptions options, DocumentPipeline pipeline, PrintStream out) throws IOException {
        if (options.file() != null) {
            ClassificationOutcome outcome = pipeline.process(options.file());
            FileResult result = new FileResult(
                    FilenameNormalizer.normalize(options.file().getFileName().toString()),
                    outcome.category(),
                    outcome.hasIdentifier() ? outcome.identifier().digits() : null,
                    null);
            OutputFormatter.print(result, options.format(), out);
            return EXIT_OK;
        }

        BatchProcessor processor = new BatchProcessor(pipeline, new FilingService(options.output()));
        BatchReport report = processor.process(options.input());
        OutputFormatter.print(report, options.format(), out);
        if (options.report() != null) {
            OutputFormatter.saveToFile(OutputFormatter.toJson(report), options.report());
            log.info("Report written to {}", options.report().toAbsolutePath());
        }
        return EXIT_OK;
    }
}
