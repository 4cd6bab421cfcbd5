package com.docsort.pipeline;

import com.docsort.image.DocumentImageSource;
import com.docsort.recognition.TesseractRecognitionEngine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for the production document pipeline.
 *
 * @param tessdataPath       directory holding Tesseract language data, or null
 * @param language           Tesseract language code
 * @param pageSegMode        Tesseract page segmentation mode
 * @param engineMode         Tesseract OCR engine mode
 * @param renderDpi          resolution for rendering PDF pages
 * @param upscaleFactor      enlargement used for the final attempt
 * @param recognitionTimeout upper bound for one recognition call
 * @param keywordTable       custom keyword table file, or null for the bundled one
 */
public record PipelineSettings(
        String tessdataPath,
        String language,
        int pageSegMode,
        int engineMode,
        int renderDpi,
        double upscaleFactor,
        Duration recognitionTimeout,
        Path keywordTable
) {

    public PipelineSettings {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(recognitionTimeout, "recognitionTimeout");
        if (language.isBlank()) throw new IllegalArgumentException("language must not be blank");
        if (renderDpi <= 0) throw new IllegalArgumentException("renderDpi must be positive: " + renderDpi);
        if (!(upscaleFactor > 0)) throw new IllegalArgumentException("upscaleFactor must be positive: " + upscaleFactor);
        if (recognitionTimeout.isNegative() || recognitionTimeout.isZero()) {
            throw new IllegalArgumentException("recognitionTimeout must be positive: " + recognitionTimeout);
        }
    }

    public static PipelineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String tessdataPath;
        private String language = TesseractRecognitionEngine.DEFAULT_LANGUAGE;
        private int pageSegMode = TesseractRecognitionEngine.DEFAULT_PAGE_SEG_MODE;
        private int engineMode = TesseractRecognitionEngine.DEFAULT_ENGINE_MODE;
        private int renderDpi = DocumentImageSource.DEFAULT_RENDER_DPI;
        private double upscaleFactor = AttemptPlan.DEFAULT_UPSCALE_FACTOR;
        private Duration recognitionTimeout = Duration.ofSeconds(60);
        private Path keywordTable;

        private Builder() {}

        public Builder tessdataPath(String tessdataPath) { this.tessdataPath = tessdataPath; return this; }
        public Builder language(String language) { this.language = language; return this; }
        public Builder pageSegMode(int pageSegMode) { this.pageSegMode = pageSegMode; return this; }
        public Builder engineMode(int engineMode) { this.engineMode = engineMode; return this; }
        public Builder renderDpi(int renderDpi) { this.renderDpi = renderDpi; return this; }
        public Builder upscaleFactor(double upscaleFactor) { this.upscaleFactor = upscaleFactor; return this; }
        public Builder recognitionTimeout(Duration timeout) { this.recognitionTimeout = timeout; return this; }
        public Builder keywordTable(Path keywordTable) { this.keywordTable = keywordTable; return this; }

        public PipelineSettings build() {
            return new PipelineSettings(tessdataPath, language, pageSegMode, engineMode,
                    renderDpi, upscaleFactor, recognitionTimeout, keywordTable);
        }
    }
}
