package com.docsort.pipeline;

import com.docsort.classify.DocumentClassifier;
import com.docsort.classify.KeywordTable;
import com.docsort.image.DocumentImageSource;
import com.docsort.image.ImageAcquisitionException;
import com.docsort.image.ImageSource;
import com.docsort.model.ClassificationOutcome;
import com.docsort.model.ImageVariant;
import com.docsort.recognition.TesseractRecognitionEngine;
import com.docsort.recognition.TimeLimitedRecognitionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads a document and runs the retry ladder over its first page.
 *
 * <p>A document that cannot be loaded becomes a processing error without any
 * recognition attempt. Problems producing a variant from a loaded page are
 * not expected and propagate to the caller.</p>
 */
public class DocumentPipeline implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(DocumentPipeline.class);

    private final ImageSource imageSource;
    private final RecognitionRetryOrchestrator orchestrator;
    private final Closeable resources;

    public DocumentPipeline(ImageSource imageSource, RecognitionRetryOrchestrator orchestrator) {
        this(imageSource, orchestrator, null);
    }

    private DocumentPipeline(ImageSource imageSource, RecognitionRetryOrchestrator orchestrator, Closeable resources) {
        this.imageSource = Objects.requireNonNull(imageSource, "imageSource");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.resources = resources;
    }

    /**
     * Wire the production stack: PDFBox/ImageIO loading, Tesseract behind a
     * timeout, and the bundled or configured keyword table.
     *
     * @throws IOException if a configured keyword table cannot be read
     */
    public static DocumentPipeline create(PipelineSettings settings) throws IOException {
        KeywordTable table = settings.keywordTable() == null
                ? KeywordTable.loadDefault()
                : KeywordTable.load(settings.keywordTable());

        DocumentImageSource imageSource = new DocumentImageSource(settings.renderDpi());
        TimeLimitedRecognitionEngine engine = new TimeLimitedRecognitionEngine(
                new TesseractRecognitionEngine(settings.tessdataPath(), settings.language(),
                        settings.pageSegMode(), settings.engineMode()),
                settings.recognitionTimeout());

        RecognitionRetryOrchestrator orchestrator = new RecognitionRetryOrchestrator(
                imageSource, engine, new DocumentClassifier(table),
                AttemptPlan.standardLadder(settings.upscaleFactor()));

        log.info("Document pipeline ready: language={}, dpi={}, timeout={}s, {} keyword categories",
                settings.language(), settings.renderDpi(), settings.recognitionTimeout().toSeconds(), table.size());
        return new DocumentPipeline(imageSource, orchestrator, engine);
    }

    /**
     * Classify one document and extract its identifier.
     *
     * @return the outcome; {@code PROCESSING_ERROR} if the file cannot be loaded
     */
    public ClassificationOutcome process(Path file) {
        ImageVariant page;
        try {
            page = imageSource.load(file);
        } catch (ImageAcquisitionException e) {
            log.error("Error processing document {}: {}", file, e.getMessage(), e);
            return ClassificationOutcome.processingError();
        }
        return orchestrator.run(page);
    }

    @Override
    public void close() throws IOException {
        if (resources != null) resources.close();
    }
}
