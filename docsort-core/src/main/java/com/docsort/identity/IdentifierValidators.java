package com.docsort.identity;

import com.docsort.model.IdentifierKind;
import com.docsort.model.NationalIdentifier;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checksum validation for Turkish national identifiers.
 *
 * <p>All methods are total: a {@code null}, a wrong length or a non-digit
 * character simply yields "invalid". Only ASCII digits are accepted.</p>
 */
public final class IdentifierValidators {

    private IdentifierValidators() {}

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-_.]+");

    // ---------------------------------------------------------------
    // Personal identifier (T.C. kimlik no)
    // ---------------------------------------------------------------

    /**
     * Validate an 11-digit citizen number.
     *
     * <ul>
     *   <li>first digit is not zero</li>
     *   <li>{@code (d1 + ... + d10) mod 10 == d11}</li>
     *   <li>{@code ((d1+d3+d5+d7+d9) * 7 - (d2+d4+d6+d8)) mod 10 == d10}</li>
     * </ul>
     */
    public static boolean isValidPersonalId(String candidate) {
        int[] d = digits(candidate, IdentifierKind.PERSONAL.length());
        if (d == null || d[0] == 0) return false;

        int firstTen = 0;
        for (int i = 0; i < 10; i++) firstTen += d[i];
        if (firstTen % 10 != d[10]) return false;

        int odd = d[0] + d[2] + d[4] + d[6] + d[8];
        int even = d[1] + d[3] + d[5] + d[7];
        return Math.floorMod(odd * 7 - even, 10) == d[9];
    }

    // ---------------------------------------------------------------
    // Tax identifier (VKN)
    // ---------------------------------------------------------------

    /**
     * Validate a 10-digit tax number with the revenue administration's
     * algorithm. Each of the first nine digits is shifted by its position,
     * weighted by a power of two and reduced mod 9; a non-zero shifted digit
     * whose weighted residue is 0 counts as 9.
     */
    public static boolean isValidTaxId(String candidate) {
        int[] d = digits(candidate, IdentifierKind.TAX.length());
        if (d == null) return false;

        int sum = 0;
        for (int i = 0; i < 9; i++) {
            int v = (d[i] + 9 - i) % 10;
            int contribution = (v * (1 << (9 - i))) % 9;
            if (v != 0 && contribution == 0) contribution = 9;
            sum += contribution;
        }
        int check = (10 - (sum % 10)) % 10;
        return check == d[9];
    }

    // ---------------------------------------------------------------
    // Canonicalization
    // ---------------------------------------------------------------

    /**
     * Strip whitespace and the separators {@code - _ .} that commonly appear
     * in printed identifiers.
     */
    public static String normalize(String raw) {
        if (raw == null) return "";
        return SEPARATORS.matcher(raw).replaceAll("");
    }

    /**
     * Canonicalize and validate a candidate of either length.
     *
     * @return the identifier, or empty if it does not pass its checksum
     */
    public static Optional<NationalIdentifier> validate(String raw) {
        String canonical = normalize(raw);
        if (isValidPersonalId(canonical)) return Optional.of(NationalIdentifier.personal(canonical));
        if (isValidTaxId(canonical))      return Optional.of(NationalIdentifier.tax(canonical));
        return Optional.empty();
    }

    /** Digits of an exact-length ASCII digit string, or null if it is not one. */
    private static int[] digits(String candidate, int length) {
        if (candidate == null || candidate.length() != length) return null;
        int[] d = new int[length];
        for (int i = 0; i < length; i++) {
            char c = candidate.charAt(i);
            if (c < '0' || c > '9') return null;
            d[i] = c - '0';
        }
        return d;
    }
}
