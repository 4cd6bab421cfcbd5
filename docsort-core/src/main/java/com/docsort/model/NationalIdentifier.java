package com.docsort.model;

import com.docsort.identity.IdentifierValidators;

import java.util.Locale;
import java.util.Objects;

/**
 * A personal or tax identifier that has passed its checksum.
 *
 * <p>The canonical constructor rejects anything that does not validate, so
 * holding an instance is proof of validity.</p>
 *
 * @param kind   which format the digits follow
 * @param digits the canonical digit string
 */
public record NationalIdentifier(IdentifierKind kind, String digits) {

    public NationalIdentifier {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(digits, "digits");
        boolean valid = switch (kind) {
            case PERSONAL -> IdentifierValidators.isValidPersonalId(digits);
            case TAX      -> IdentifierValidators.isValidTaxId(digits);
        };
        if (!valid) {
            throw new IllegalArgumentException("Not a valid %s identifier: %s".formatted(
                    kind.name().toLowerCase(Locale.ROOT), digits));
        }
    }

    public static NationalIdentifier personal(String digits) {
        return new NationalIdentifier(IdentifierKind.PERSONAL, digits);
    }

    public static NationalIdentifier tax(String digits) {
        return new NationalIdentifier(IdentifierKind.TAX, digits);
    }

    @Override
    public String toString() {
        return digits;
    }
}
