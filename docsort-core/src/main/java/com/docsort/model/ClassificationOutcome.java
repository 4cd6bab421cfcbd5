package com.docsort.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of processing one document.
 *
 * @param category   the decided category, possibly a sentinel
 * @param identifier the validated identifier found in the text, or null
 */
public record ClassificationOutcome(Category category, NationalIdentifier identifier) {

    public ClassificationOutcome {
        Objects.requireNonNull(category, "category");
    }

    public static ClassificationOutcome processingError() {
        return new ClassificationOutcome(Category.PROCESSING_ERROR, null);
    }

    public static ClassificationOutcome of(Category category, Optional<NationalIdentifier> identifier) {
        return new ClassificationOutcome(category, identifier.orElse(null));
    }

    public boolean hasIdentifier() { return identifier != null; }
}
