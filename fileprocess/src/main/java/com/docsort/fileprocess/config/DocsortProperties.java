package com.docsort.fileprocess.config;

import com.docsort.pipeline.PipelineSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "docsort")
public class DocsortProperties {

    /**
     * Root folder receiving one sub-folder per category.
     */
    private String uploadDir = "uploads";

    /**
     * Folder where uploads are staged before classification.
     */
    private String inboxDir = "Documents";

    /**
     * Enlargement applied for the last recognition attempt.
     */
    private double upscaleFactor = 2.0;

    /**
     * Optional keyword table file. If empty, the bundled table is used.
     */
    private String keywordTable = "";

    private Ocr ocr = new Ocr();

    private Pdf pdf = new Pdf();

    public String getUploadDir() {
        return uploadDir;
    }

    public void setUploadDir(String uploadDir) {
        this.uploadDir = uploadDir;
    }

    public String getInboxDir() {
        return inboxDir;
    }

    public void setInboxDir(String inboxDir) {
        this.inboxDir = inboxDir;
    }

    public double getUpscaleFactor() {
        return upscaleFactor;
    }

    public void setUpscaleFactor(double upscaleFactor) {
        this.upscaleFactor = upscaleFactor;
    }

    public String getKeywordTable() {
        return keywordTable;
    }

    public void setKeywordTable(String keywordTable) {
        this.keywordTable = keywordTable;
    }

    public Ocr getOcr() {
        return ocr;
    }

    public void setOcr(Ocr ocr) {
        this.ocr = ocr;
    }

    public Pdf getPdf() {
        return pdf;
    }

    public void setPdf(Pdf pdf) {
        this.pdf = pdf;
    }

    public PipelineSettings toSettings() {
        return PipelineSettings.builder()
                .tessdataPath(ocr.getTessdataPath().isBlank() ? null : ocr.getTessdataPath())
                .language(ocr.getLanguage())
                .pageSegMode(ocr.getPageSegMode())
                .engineMode(ocr.getEngineMode())
                .recognitionTimeout(ocr.getTimeout())
                .renderDpi(pdf.getRenderDpi())
                .upscaleFactor(upscaleFactor)
                .keywordTable(keywordTable.isBlank() ? null : Path.of(keywordTable))
                .build();
    }

    public static class Ocr {

        /**
         * Tesseract language(s), e.g. "tur" or "tur+eng".
         */
        private String language = "tur";

        /**
         * Optional path that contains the Tesseract language data.
         * If empty, Tess4J relies on the OS installation and TESSDATA_PREFIX.
         */
        private String tessdataPath = "";

        /**
         * Page segmentation mode. 6 assumes a single uniform block of text.
         */
        private int pageSegMode = 6;

        /**
         * OCR engine mode. 3 lets Tesseract pick the best available engine.
         */
        private int engineMode = 3;

        /**
         * Upper bound for a single recognition call.
         */
        private Duration timeout = Duration.ofSeconds(60);

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getTessdataPath() {
            return tessdataPath;
        }

        public void setTessdataPath(String tessdataPath) {
            this.tessdataPath = tessdataPath;
        }

        public int getPageSegMode() {
            return pageSegMode;
        }

        public void setPageSegMode(int pageSegMode) {
            this.pageSegMode = pageSegMode;
        }

        public int getEngineMode() {
            return engineMode;
        }

        public void setEngineMode(int engineMode) {
            this.engineMode = engineMode;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Pdf {

        /**
         * Render DPI for the first page of a PDF.
         */
        private int renderDpi = 300;

        public int getRenderDpi() {
            return renderDpi;
        }

        public void setRenderDpi(int renderDpi) {
            this.renderDpi = renderDpi;
        }
    }
}
