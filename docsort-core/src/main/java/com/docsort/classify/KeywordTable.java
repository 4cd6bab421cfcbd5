package com.docsort.classify;

import com.docsort.model.Category;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered list of trigger phrases per category.
 *
 * <p>Position in the list is classification priority: the first entry with a
 * matching keyword wins, whatever later entries would have matched. The table
 * is immutable once built.</p>
 *
 * <p>The JSON form is an array of {@code {"category": ..., "keywords": [...]}}
 * objects, where {@code category} is the folder name of a {@link Category}.</p>
 */
public final class KeywordTable {

    /** Classpath location of the default table. */
    public static final String DEFAULT_RESOURCE = "/keyword-table.json";

    private static final Gson GSON = new Gson();

    /**
     * One row of the table.
     *
     * @param category the category selected when any keyword matches
     * @param keywords lower-case phrases, in configured order
     */
    public record Entry(Category category, List<String> keywords) {
        public Entry {
            Objects.requireNonNull(category, "category");
            keywords = List.copyOf(keywords);
        }
    }

    /**
     * The entry that decided a classification and the keyword that triggered it.
     */
    public record Match(Category category, String keyword, int priority) {}

    private final List<Entry> entries;

    private KeywordTable(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * Build a table from entries in priority order. Keywords are trimmed,
     * lower-cased and de-duplicated within their entry.
     *
     * @throws IllegalArgumentException for a sentinel or repeated category,
     *                                  a category without keywords, or a blank keyword
     */
    public static KeywordTable of(List<Entry> entries) {
        Objects.requireNonNull(entries, "entries");
        Set<Category> seen = EnumSet.noneOf(Category.class);
        List<Entry> normalized = new ArrayList<>(entries.size());

        for (Entry entry : entries) {
            Objects.requireNonNull(entry, "entry");
            Category category = entry.category();
            if (category.isSentinel()) {
                throw new IllegalArgumentException("Sentinel category cannot have keywords: " + category);
            }
            if (!seen.add(category)) {
                throw new IllegalArgumentException("Category listed twice in keyword table: " + category);
            }
            if (entry.keywords().isEmpty()) {
                throw new IllegalArgumentException("No keywords for category " + category);
            }
            Set<String> keywords = new LinkedHashSet<>();
            for (String keyword : entry.keywords()) {
                if (keyword.isBlank()) {
                    throw new IllegalArgumentException("Blank keyword for category " + category);
                }
                keywords.add(keyword.strip().toLowerCase(Locale.ROOT));
            }
            normalized.add(new Entry(category, new ArrayList<>(keywords)));
        }
        return new KeywordTable(normalized);
    }

    // ---------------------------------------------------------------
    // Loading
    // ---------------------------------------------------------------

    /** Load the table bundled with the library. */
    public static KeywordTable loadDefault() {
        try (InputStream in = KeywordTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Keyword table resource not found: " + DEFAULT_RESOURCE);
            }
            return load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Load a table from a JSON file.
     *
     * @throws IOException if the file cannot be read
     */
    public static KeywordTable load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    /**
     * Parse a table from JSON.
     *
     * @throws IllegalArgumentException if the JSON is malformed or names an
     *                                  unknown category
     */
    public static KeywordTable load(Reader reader) {
        List<RawEntry> raw;
        try {
            raw = GSON.fromJson(reader, new TypeToken<List<RawEntry>>() {}.getType());
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed keyword table: " + e.getMessage(), e);
        }
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("Keyword table is empty");
        }
        List<Entry> entries = new ArrayList<>(raw.size());
        for (RawEntry r : raw) {
            if (r == null || r.category == null) {
                throw new IllegalArgumentException("Keyword table entry without a category");
            }
            if (r.keywords == null || r.keywords.contains(null)) {
                throw new IllegalArgumentException("Missing keyword for category " + r.category);
            }
            entries.add(new Entry(Category.fromFolderName(r.category), r.keywords));
        }
        return of(entries);
    }

    /** JSON shape of one entry, before validation. */
    private static final class RawEntry {
        String category;
        List<String> keywords;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /** Entries in priority order, highest first. */
    public List<Entry> entries() {
        return entries;
    }

    /** Categories in priority order, highest first. */
    public List<Category> priorityOrder() {
        List<Category> order = new ArrayList<>(entries.size());
        for (Entry e : entries) order.add(e.category());
        return List.copyOf(order);
    }

    public List<String> keywordsFor(Category category) {
        for (Entry e : entries) {
            if (e.category() == category) return e.keywords();
        }
        return List.of();
    }

    /**
     * First entry, in priority order, with a keyword occurring in the text.
     * The text must already be lower-case.
     */
    Optional<Match> firstMatch(String lowerText) {
        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            for (String keyword : entry.keywords()) {
                if (lowerText.contains(keyword)) {
                    return Optional.of(new Match(entry.category(), keyword, i));
                }
            }
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }
}
