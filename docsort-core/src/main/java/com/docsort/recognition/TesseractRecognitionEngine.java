package com.docsort.recognition;

import com.docsort.model.ImageVariant;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

/**
 * Tesseract through Tess4J.
 *
 * <p>A {@link Tesseract} object is not safe for concurrent use, so each call
 * configures its own. Tess4J initialises and releases the native handle per
 * {@code doOCR} call anyway.</p>
 */
public class TesseractRecognitionEngine implements RecognitionEngine {

    public static final String DEFAULT_LANGUAGE = "tur";
    /** --psm 6: assume a single uniform block of text. */
    public static final int DEFAULT_PAGE_SEG_MODE = 6;
    /** --oem 3: whichever engine the installed data supports. */
    public static final int DEFAULT_ENGINE_MODE = 3;

    private final String datapath;
    private final String language;
    private final int pageSegMode;
    private final int engineMode;

    /**
     * @param datapath    directory containing the .traineddata files, or null
     *                    to rely on the system installation
     * @param language    Tesseract language code, e.g. "tur"
     * @param pageSegMode page segmentation mode (6 = single uniform block)
     * @param engineMode  OCR engine mode (3 = default)
     */
    public TesseractRecognitionEngine(String datapath, String language, int pageSegMode, int engineMode) {
        this.datapath = datapath;
        this.language = language;
        this.pageSegMode = pageSegMode;
        this.engineMode = engineMode;
    }

    public TesseractRecognitionEngine(String datapath) {
        this(datapath, DEFAULT_LANGUAGE, DEFAULT_PAGE_SEG_MODE, DEFAULT_ENGINE_MODE);
    }

    @Override
    public String recognize(ImageVariant variant) throws RecognitionException {
        Tesseract tesseract = newTesseract();
        try {
            String text = tesseract.doOCR(variant.image());
            return text == null ? "" : text;
        } catch (TesseractException e) {
            throw new RecognitionException("Tesseract failed on " + variant.describe(), e);
        }
    }

    Tesseract newTesseract() {
        Tesseract tesseract = new Tesseract();
        if (datapath != null && !datapath.isBlank()) {
            tesseract.setDatapath(datapath);
        }
        tesseract.setLanguage(language);
        tesseract.setPageSegMode(pageSegMode);
        tesseract.setOcrEngineMode(engineMode);
        return tesseract;
    }
}
