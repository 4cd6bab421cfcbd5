package com.docsort.pipeline;

import com.docsort.classify.DocumentClassifier;
import com.docsort.classify.KeywordTable;
import com.docsort.identity.IdentifierExtractor;
import com.docsort.image.ImageSource;
import com.docsort.model.Category;
import com.docsort.model.ClassificationOutcome;
import com.docsort.model.ImageVariant;
import com.docsort.recognition.RecognitionEngine;
import com.docsort.recognition.RecognitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives recognition attempts over a page until one classifies.
 *
 * <p>Attempts follow the {@link AttemptPlan} list in order and stop at the
 * first category other than {@link Category#UNCLASSIFIED}. An engine failure
 * or timeout on one attempt counts as empty text and the ladder moves on. When
 * every attempt comes back unclassified, the identifier is still extracted
 * from the last non-blank text seen.</p>
 *
 * <p>Holds no per-document state; one instance can serve concurrent callers
 * if its engine and image source can.</p>
 */
public class RecognitionRetryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RecognitionRetryOrchestrator.class);

    private final ImageSource imageSource;
    private final RecognitionEngine engine;
    private final DocumentClassifier classifier;
    private final List<AttemptPlan> plan;

    public RecognitionRetryOrchestrator(ImageSource imageSource, RecognitionEngine engine,
                                        DocumentClassifier classifier, List<AttemptPlan> plan) {
        this.imageSource = Objects.requireNonNull(imageSource, "imageSource");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.plan = List.copyOf(plan);
        if (this.plan.isEmpty()) {
            throw new IllegalArgumentException("Attempt plan must not be empty");
        }
    }

    public RecognitionRetryOrchestrator(ImageSource imageSource, RecognitionEngine engine,
                                        DocumentClassifier classifier) {
        this(imageSource, engine, classifier, AttemptPlan.standardLadder());
    }

    /**
     * Classify a loaded page.
     *
     * @param original the page as loaded, upright and at native scale
     * @return the outcome; never {@link Category#PROCESSING_ERROR}
     */
    public ClassificationOutcome run(ImageVariant original) {
        Objects.requireNonNull(original, "original");
        String lastText = "";

        for (int i = 0; i < plan.size(); i++) {
            AttemptPlan attempt = plan.get(i);
            ImageVariant variant = attempt.produce(imageSource, original);
            String text = recognize(variant, attempt);
            if (!text.isBlank()) lastText = text;

            Optional<KeywordTable.Match> match = classifier.firstMatch(text);
            if (match.isPresent()) {
                KeywordTable.Match m = match.get();
                log.debug("Attempt {}/{} ({}) matched '{}' -> {}",
                        i + 1, plan.size(), attempt.describe(), m.keyword(), m.category());
                if (attempt instanceof AttemptPlan.Upscale) {
                    log.info("Classified with upscaled image");
                }
                return ClassificationOutcome.of(m.category(), IdentifierExtractor.extract(text));
            }
            log.debug("Attempt {}/{} ({}) unclassified, {} chars recognized",
                    i + 1, plan.size(), attempt.describe(), text.length());
        }

        log.info("No keyword matched after {} attempts", plan.size());
        return ClassificationOutcome.of(Category.UNCLASSIFIED, IdentifierExtractor.extract(lastText));
    }

    /** Recognized text, lower-cased, or "" when the engine fails. */
    private String recognize(ImageVariant variant, AttemptPlan attempt) {
        try {
            String text = engine.recognize(variant);
            return text == null ? "" : text.toLowerCase(Locale.ROOT);
        } catch (RecognitionException e) {
            log.warn("Recognition failed on {}: {}", attempt.describe(), e.getMessage());
            return "";
        } catch (RuntimeException e) {
            log.warn("Recognition engine error on {}", attempt.describe(), e);
            return "";
        }
    }
}
