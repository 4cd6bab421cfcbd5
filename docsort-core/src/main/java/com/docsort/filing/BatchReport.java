package com.docsort.filing;

import com.docsort.model.Category;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of processing a folder of documents.
 *
 * @param results one entry per file, in processing order
 */
public record BatchReport(List<FileResult> results) {

    /**
     * What happened to one file.
     *
     * @param fileName   original (normalised) file name
     * @param category   category it was filed under
     * @param identifier identifier used for the new name, or null
     * @param storedAs   final location, or null if the file could not be moved
     */
    public record FileResult(String fileName, Category category, String identifier, String storedAs) {}

    public BatchReport {
        results = List.copyOf(results);
    }

    /** Files per category, every category present, in declaration order. */
    public Map<Category, Integer> counts() {
        Map<Category, Integer> counts = new EnumMap<>(Category.class);
        for (Category c : Category.values()) counts.put(c, 0);
        for (FileResult r : results) counts.merge(r.category(), 1, Integer::sum);
        return counts;
    }

    public int total() {
        return results.size();
    }

    public int classifiedCount() {
        int n = 0;
        for (FileResult r : results) {
            if (!r.category().isSentinel()) n++;
        }
        return n;
    }
}
