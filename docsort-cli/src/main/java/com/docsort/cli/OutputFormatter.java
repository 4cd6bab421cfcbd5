package com.docsort.cli;

import com.docsort.filing.BatchReport;
import com.docsort.filing.BatchReport.FileResult;
import com.docsort.model.Category;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Formats classification results for CLI output.
 * Supports three modes: raw JSON, plain lines, and human-readable summary.
 */
public final class OutputFormatter {

    private OutputFormatter() {}

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public enum Mode { JSON, TEXT, SUMMARY }

    // ---------------------------------------------------------------
    // Single document
    // ---------------------------------------------------------------

    public static void print(FileResult result, Mode mode, PrintStream out) {
        switch (mode) {
            case JSON    -> out.println(GSON.toJson(result));
            case TEXT    -> out.println(line(result.category(), result.identifier()));
            case SUMMARY -> {
                out.println("─".repeat(60));
                out.println("  Document Classification");
                out.println("─".repeat(60));
                out.printf("  File:       %s%n", result.fileName());
                out.printf("  Category:   %s%n", result.category());
                out.printf("  Identifier: %s%n", result.identifier() == null ? "-" : result.identifier());
                out.println("─".repeat(60));
            }
        }
    }

    // ---------------------------------------------------------------
    // Batch report
    // ---------------------------------------------------------------

    public static void print(BatchReport report, Mode mode, PrintStream out) {
        switch (mode) {
            case JSON    -> out.println(toJson(report));
            case TEXT    -> {
                for (FileResult r : report.results()) {
                    out.println(r.fileName() + " " + line(r.category(), r.identifier()));
                }
            }
            case SUMMARY -> {
                out.println("─".repeat(60));
                out.println("  Classification Report");
                out.println("─".repeat(60));
                out.printf("  Files:      %,d%n", report.total());
                out.printf("  Classified: %,d%n", report.classifiedCount());
                out.println();
                for (Map.Entry<Category, Integer> e : report.counts().entrySet()) {
                    out.printf("  %-34s %5d%n", e.getKey(), e.getValue());
                }
                out.println("─".repeat(60));
                for (FileResult r : report.results()) {
                    out.printf("  %s → %s", r.fileName(), r.category());
                    if (r.identifier() != null) out.printf(" (%s)", r.identifier());
                    out.println();
                }
            }
        }
    }

    /** Pretty-printed report: totals, per-category counts and per-file results. */
    public static String toJson(BatchReport report) {
        JsonObject counts = new JsonObject();
        report.counts().forEach((category, n) -> counts.addProperty(category.folderName(), n));

        JsonObject root = new JsonObject();
        root.addProperty("total", report.total());
        root.addProperty("classified", report.classifiedCount());
        root.add("counts", counts);
        root.add("results", GSON.toJsonTree(report.results()));
        return GSON.toJson(root);
    }

    // ---------------------------------------------------------------
    // Save text to file
    // ---------------------------------------------------------------

    public static void saveToFile(String text, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, text);
    }

    private static String line(Category category, String identifier) {
        return identifier == null ? category.folderName() : category.folderName() + " " + identifier;
    }
}
