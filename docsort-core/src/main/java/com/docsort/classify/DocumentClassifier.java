package com.docsort.classify;

import com.docsort.model.Category;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Keyword-priority classifier: the highest-priority category with any keyword
 * occurring in the text wins. There is no scoring; match counts and keyword
 * length play no part.
 *
 * <p>Stateless apart from the immutable table, so one instance can serve any
 * number of threads.</p>
 */
public final class DocumentClassifier {

    private final KeywordTable table;

    public DocumentClassifier(KeywordTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    /** Classifier over the bundled keyword table. */
    public static DocumentClassifier withDefaultTable() {
        return new DocumentClassifier(KeywordTable.loadDefault());
    }

    /**
     * @return the winning category, or {@link Category#UNCLASSIFIED} when no
     *         keyword occurs (including for empty or null text)
     */
    public Category classify(String text) {
        return firstMatch(text).map(KeywordTable.Match::category).orElse(Category.UNCLASSIFIED);
    }

    /** The deciding category and keyword, for logging and audit. */
    public Optional<KeywordTable.Match> firstMatch(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        return table.firstMatch(text.toLowerCase(Locale.ROOT));
    }

    public List<String> keywordsFor(Category category) {
        return table.keywordsFor(category);
    }

    public KeywordTable table() {
        return table;
    }
}
