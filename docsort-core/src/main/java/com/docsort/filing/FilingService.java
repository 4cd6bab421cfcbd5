package com.docsort.filing;

import com.docsort.model.Category;
import com.docsort.model.ClassificationOutcome;
import com.docsort.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Moves processed documents into per-category folders under an upload root.
 *
 * <p>A document with an identifier is renamed {@code {identifier}_{ddMMyyyy}.{ext}};
 * otherwise it keeps its (NFKC-normalised) name. Name collisions get a
 * {@code (n)} suffix before the extension.</p>
 */
public class FilingService {

    private static final Logger log = LoggerFactory.getLogger(FilingService.class);

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("ddMMyyyy");

    private final Path uploadRoot;
    private final Clock clock;

    public FilingService(Path uploadRoot, Clock clock) {
        this.uploadRoot = Objects.requireNonNull(uploadRoot, "uploadRoot");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public FilingService(Path uploadRoot) {
        this(uploadRoot, Clock.systemDefaultZone());
    }

    /**
     * Create one folder per category, sentinels included.
     *
     * @throws IOException if a folder cannot be created
     */
    public void setupDirectories() throws IOException {
        for (Category category : Category.values()) {
            Files.createDirectories(folderFor(category));
        }
        log.debug("Category folders ready under {}", uploadRoot.toAbsolutePath());
    }

    public Path folderFor(Category category) {
        return uploadRoot.resolve(category.folderName());
    }

    /**
     * {@code {identifier}_{ddMMyyyy}.{ext}}, or {@code {identifier}_{ddMMyyyy}(n).{ext}}
     * with the smallest n that is free in {@code folder}.
     */
    public String uniqueFilename(String identifier, Path folder, String ext) {
        String base = identifier + "_" + LocalDate.now(clock).format(DATE);
        return firstFreeName(folder, base, ext);
    }

    /**
     * Move a processed document into its category folder.
     *
     * @return the final path
     * @throws IOException if the move fails
     */
    public Path file(Path source, ClassificationOutcome outcome) throws IOException {
        Path folder = folderFor(outcome.category());
        Files.createDirectories(folder);

        String name;
        if (outcome.hasIdentifier()) {
            String ext = FileUtils.splitName(source.getFileName().toString())[1];
            name = uniqueFilename(outcome.identifier().digits(), folder, ext);
        } else {
            String[] parts = FileUtils.splitName(FilenameNormalizer.normalize(source.getFileName().toString()));
            name = firstFreeName(folder, parts[0], parts[1]);
        }
        return move(source, folder.resolve(name));
    }

    /**
     * Move a document that could not be processed into the error folder.
     *
     * @throws IOException if the move fails
     */
    public Path fileAsError(Path source) throws IOException {
        return file(source, ClassificationOutcome.processingError());
    }

    private Path move(Path source, Path target) throws IOException {
        Path moved = Files.move(source, target);
        log.debug("Moved {} -> {}", source, moved);
        return moved;
    }

    private static String firstFreeName(Path folder, String base, String ext) {
        String suffix = ext.isEmpty() ? "" : "." + ext;
        String name = base + suffix;
        int counter = 1;
        while (Files.exists(folder.resolve(name))) {
            name = base + "(" + counter + ")" + suffix;
            counter++;
        }
        return name;
    }
}
