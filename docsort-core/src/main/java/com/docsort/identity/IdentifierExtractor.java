package com.docsort.identity;

import com.docsort.model.IdentifierKind;
import com.docsort.model.NationalIdentifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a validated national identifier in recognized text.
 *
 * <p>Candidates are maximal runs of ASCII digits. Personal identifiers take
 * precedence: every 11-digit run is checked before any 10-digit run.</p>
 */
public final class IdentifierExtractor {

    private IdentifierExtractor() {}

    private static final Pattern DIGIT_RUN = Pattern.compile("[0-9]+");

    /**
     * @return the first valid personal identifier, else the first valid tax
     *         identifier, else empty
     */
    public static Optional<NationalIdentifier> extract(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();

        List<String> runs = digitRuns(text);

        for (String run : runs) {
            if (run.length() == IdentifierKind.PERSONAL.length() && IdentifierValidators.isValidPersonalId(run)) {
                return Optional.of(NationalIdentifier.personal(run));
            }
        }
        for (String run : runs) {
            if (run.length() == IdentifierKind.TAX.length() && IdentifierValidators.isValidTaxId(run)) {
                return Optional.of(NationalIdentifier.tax(run));
            }
        }
        return Optional.empty();
    }

    /** Maximal digit runs in order of appearance. */
    static List<String> digitRuns(String text) {
        List<String> runs = new ArrayList<>();
        Matcher m = DIGIT_RUN.matcher(text);
        while (m.find()) runs.add(m.group());
        return runs;
    }
}
