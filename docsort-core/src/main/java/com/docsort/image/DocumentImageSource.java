package com.docsort.image;

import com.docsort.model.ImageVariant;
import com.docsort.model.Orientation;
import com.docsort.util.FileUtils;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the first page of a PDF or an image file as a raster.
 *
 * <p>PDF pages are rendered with PDFBox at the configured dpi; everything
 * else goes through {@link ImageIO}. Only the first page of a PDF is used.</p>
 */
public class DocumentImageSource implements ImageSource {

    private static final Logger log = LoggerFactory.getLogger(DocumentImageSource.class);

    public static final int DEFAULT_RENDER_DPI = 300;

    private final int renderDpi;

    public DocumentImageSource() {
        this(DEFAULT_RENDER_DPI);
    }

    public DocumentImageSource(int renderDpi) {
        if (renderDpi <= 0) {
            throw new IllegalArgumentException("renderDpi must be positive: " + renderDpi);
        }
        this.renderDpi = renderDpi;
    }

    @Override
    public ImageVariant load(Path file) throws ImageAcquisitionException {
        if (!Files.isRegularFile(file)) {
            throw new ImageAcquisitionException(file, "Not a readable file: " + file);
        }
        BufferedImage image = FileUtils.detectType(file) == FileUtils.FileType.PDF
                ? renderFirstPage(file)
                : readImage(file);
        log.debug("Loaded {} ({}x{})", file.getFileName(), image.getWidth(), image.getHeight());
        return ImageVariant.original(image);
    }

    @Override
    public ImageVariant rotate(ImageVariant variant, Orientation orientation) {
        return new ImageVariant(ImageTransforms.rotate(variant.image(), orientation), orientation, variant.scale());
    }

    @Override
    public ImageVariant upscale(ImageVariant variant, double factor) {
        return new ImageVariant(ImageTransforms.upscale(variant.image(), factor),
                variant.orientation(), ImageVariant.Scale.UPSCALED);
    }

    private BufferedImage renderFirstPage(Path file) throws ImageAcquisitionException {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            if (document.getNumberOfPages() == 0) {
                throw new ImageAcquisitionException(file, "PDF has no pages: " + file.getFileName());
            }
            return new PDFRenderer(document).renderImageWithDPI(0, renderDpi, ImageType.RGB);
        } catch (IOException e) {
            throw new ImageAcquisitionException(file, "Could not render PDF " + file.getFileName(), e);
        }
    }

    private BufferedImage readImage(Path file) throws ImageAcquisitionException {
        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException e) {
            throw new ImageAcquisitionException(file, "Could not read image " + file.getFileName(), e);
        }
        if (image == null) {
            throw new ImageAcquisitionException(file, "Could not load image from: " + file);
        }
        return image;
    }
}
