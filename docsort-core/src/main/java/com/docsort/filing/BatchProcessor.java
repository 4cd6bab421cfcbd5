package com.docsort.filing;

import com.docsort.model.Category;
import com.docsort.model.ClassificationOutcome;
import com.docsort.pipeline.DocumentPipeline;
import com.docsort.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classifies every file under an input folder and files it by category.
 *
 * <p>Documents are processed one after another. A failure on one document
 * sends it to the error folder and the batch carries on.</p>
 */
public class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final DocumentPipeline pipeline;
    private final FilingService filing;

    public BatchProcessor(DocumentPipeline pipeline, FilingService filing) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.filing = Objects.requireNonNull(filing, "filing");
    }

    /**
     * @throws IllegalArgumentException if the input folder does not exist
     * @throws IOException              if the folder cannot be listed or the
     *                                  category folders cannot be created
     */
    public BatchReport process(Path inputDir) throws IOException {
        if (!Files.isDirectory(inputDir)) {
            throw new IllegalArgumentException("'%s' folder not found.".formatted(inputDir));
        }
        filing.setupDirectories();

        List<Path> files = FileUtils.listFiles(inputDir);
        int total = files.size();
        log.info("Processing {} files in {}", total, inputDir);

        List<BatchReport.FileResult> results = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            results.add(processOne(files.get(i), i + 1, total));
        }

        BatchReport report = new BatchReport(results);
        log.info("Process completed: {} of {} files classified", report.classifiedCount(), total);
        return report;
    }

    private BatchReport.FileResult processOne(Path file, int idx, int total) {
        String fileName = FilenameNormalizer.normalize(file.getFileName().toString());
        try {
            ClassificationOutcome outcome = pipeline.process(file);
            Path stored = filing.file(file, outcome);
            String identifier = outcome.hasIdentifier() ? outcome.identifier().digits() : null;
            if (identifier != null) {
                log.info("[{}/{}] {} → {} (NEW NAME: {})", idx, total, fileName, outcome.category(), stored.getFileName());
            } else {
                log.info("[{}/{}] {} → {}", idx, total, fileName, outcome.category());
            }
            return new BatchReport.FileResult(fileName, outcome.category(), identifier, stored.toString());
        } catch (IOException | RuntimeException e) {
            log.error("[{}/{}] {} → {}: {}", idx, total, fileName, Category.PROCESSING_ERROR, e.getMessage(), e);
            return new BatchReport.FileResult(fileName, Category.PROCESSING_ERROR, null, moveToErrors(file));
        }
    }

    private String moveToErrors(Path file) {
        if (!Files.exists(file)) return null;
        try {
            return filing.fileAsError(file).toString();
        } catch (IOException e) {
            log.error("Could not move {} to the error folder", file, e);
            return null;
        }
    }
}
