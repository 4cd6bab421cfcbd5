package com.docsort.cli;

import com.docsort.cli.OutputFormatter.Mode;
import com.docsort.pipeline.PipelineSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Parsed command line.
 *
 * @param input    folder of scans to classify
 * @param output   upload root receiving the category folders
 * @param file     single document to classify without moving it, or null
 * @param tessdata Tesseract data directory, or null for the engine default
 * @param language Tesseract language code
 * @param dpi      PDF render resolution, or null for the default
 * @param timeout  per-call recognition limit, or null for the default
 * @param keywords custom keyword table, or null for the bundled one
 * @param format   output mode
 * @param report   file receiving the JSON report, or null
 * @param help     print usage and exit
 */
public record CliOptions(
        Path input,
        Path output,
        Path file,
        String tessdata,
        String language,
        Integer dpi,
        Duration timeout,
        Path keywords,
        Mode format,
        Path report,
        boolean help
) {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: docsort [options]",
            "",
            "  --input <dir>       folder of scans to classify (default: Documents)",
            "  --output <dir>      folder receiving the category folders (default: uploads)",
            "  --file <path>       classify a single document without moving it",
            "  --tessdata <dir>    Tesseract language data directory",
            "  --lang <code>       recognition language (default: tur)",
            "  --dpi <n>           PDF render resolution (default: 300)",
            "  --timeout <sec>     limit for one recognition call (default: 60)",
            "  --keywords <json>   custom keyword table",
            "  --format <mode>     summary | json | text (default: summary)",
            "  --report <file>     also write the JSON report to a file",
            "  --help              show this message");

    /**
     * Parse arguments.
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or a malformed number
     */
    public static CliOptions parse(String... args) {
        Path input = Path.of("Documents");
        Path output = Path.of("uploads");
        Path file = null;
        String tessdata = null;
        String language = "tur";
        Integer dpi = null;
        Duration timeout = null;
        Path keywords = null;
        Mode format = Mode.SUMMARY;
        Path report = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "--help", "-h" -> help = true;
                case "--input"    -> input = Path.of(value(args, ++i, flag));
                case "--output"   -> output = Path.of(value(args, ++i, flag));
                case "--file"     -> file = Path.of(value(args, ++i, flag));
                case "--tessdata" -> tessdata = value(args, ++i, flag);
                case "--lang"     -> language = value(args, ++i, flag);
                case "--dpi"      -> dpi = positiveInt(value(args, ++i, flag), flag);
                case "--timeout"  -> timeout = Duration.ofSeconds(positiveInt(value(args, ++i, flag), flag));
                case "--keywords" -> keywords = Path.of(value(args, ++i, flag));
                case "--format"   -> format = mode(value(args, ++i, flag));
                case "--report"   -> report = Path.of(value(args, ++i, flag));
                default -> throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }
        return new CliOptions(input, output, file, tessdata, language, dpi, timeout, keywords, format, report, help);
    }

    /** Pipeline settings with every option that was not given left at its default. */
    public PipelineSettings toSettings() {
        PipelineSettings.Builder builder = PipelineSettings.builder()
                .tessdataPath(tessdata)
                .language(language)
                .keywordTable(keywords);
        if (dpi != null) builder.renderDpi(dpi);
        if (timeout != null) builder.recognitionTimeout(timeout);
        return builder.build();
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[i];
    }

    private static int positiveInt(String raw, String flag) {
        int n;
        try {
            n = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number for " + flag + ": " + raw, e);
        }
        if (n <= 0) throw new IllegalArgumentException(flag + " must be positive: " + raw);
        return n;
    }

    private static Mode mode(String raw) {
        try {
            return Mode.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown format: " + raw + " (expected summary, json or text)", e);
        }
    }
}
