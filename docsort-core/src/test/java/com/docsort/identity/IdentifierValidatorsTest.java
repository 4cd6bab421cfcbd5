package com.docsort.identity;

import com.docsort.model.IdentifierKind;
import com.docsort.model.NationalIdentifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierValidatorsTest {

    // ── personal identifier ─────────────────────────────────────

    @ParameterizedTest
    @ValueSource(strings = {"10000000146", "12345678950", "98765432150", "55555555550", "11111111110"})
    void personalId_acceptsValidNumbers(String id) {
        assertTrue(IdentifierValidators.isValidPersonalId(id));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "10000000147",   // last digit off
            "10000000156",   // tenth digit off
            "02345678950",   // leading zero
            "1000000014",    // too short
            "100000001460",  // too long
            "1000000014a",   // letter
            "1000000014 ",   // trailing space
            "١٠٠٠٠٠٠٠١٤٦",   // Arabic-Indic digits are not ASCII digits
    })
    void personalId_rejectsInvalidNumbers(String id) {
        assertFalse(IdentifierValidators.isValidPersonalId(id));
    }

    @ParameterizedTest
    @NullAndEmptySource
    void personalId_rejectsNullAndEmpty(String id) {
        assertFalse(IdentifierValidators.isValidPersonalId(id));
    }

    @Test
    void personalId_negativeIntermediateUsesNonNegativeResidue() {
        // odd sum 1, even sum 36: 1*7 - 36 = -29, residue 1
        String id = "1909090901" + "0";
        int sum = 1 + 9 * 4 + 1;
        String withCheck = id.substring(0, 10) + (sum % 10);
        assertTrue(IdentifierValidators.isValidPersonalId(withCheck));
    }

    @Test
    void personalId_acceptsExactlyTheStringsSatisfyingBothEquations() {
        Random random = new Random(20240611L);
        for (int n = 0; n < 20_000; n++) {
            StringBuilder sb = new StringBuilder(11);
            sb.append(1 + random.nextInt(9));
            for (int i = 1; i < 11; i++) sb.append(random.nextInt(10));
            String candidate = sb.toString();
            assertEquals(referencePersonal(candidate), IdentifierValidators.isValidPersonalId(candidate), candidate);
        }
    }

    @Test
    void personalId_everySingleDigitMutationOfAValidIdIsRejected() {
        Random random = new Random(7L);
        for (int n = 0; n < 500; n++) {
            String valid = generatePersonal(random);
            assertTrue(IdentifierValidators.isValidPersonalId(valid), valid);

            for (int pos = 0; pos < 11; pos++) {
                for (char c = '0'; c <= '9'; c++) {
                    if (c == valid.charAt(pos)) continue;
                    String mutated = valid.substring(0, pos) + c + valid.substring(pos + 1);
                    assertFalse(IdentifierValidators.isValidPersonalId(mutated), mutated);
                }
            }
        }
    }

    // ── tax identifier ──────────────────────────────────────────

    @ParameterizedTest
    @ValueSource(strings = {"1234567890", "4840847211", "0123456789", "9876543217", "1111111114", "0000000001"})
    void taxId_acceptsValidNumbers(String id) {
        assertTrue(IdentifierValidators.isValidTaxId(id));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1234567891", "1234567880", "4840847212", "123456789", "12345678901", "12345-7890", "abcdefghij"})
    void taxId_rejectsInvalidNumbers(String id) {
        assertFalse(IdentifierValidators.isValidTaxId(id));
    }

    @ParameterizedTest
    @NullAndEmptySource
    void taxId_rejectsNullAndEmpty(String id) {
        assertFalse(IdentifierValidators.isValidTaxId(id));
    }

    @Test
    void taxId_shiftedDigitOfZeroContributesZero() {
        // In 1234567890 every shifted digit (d + 9 - i) mod 10 is 0.
        // Counting those as 9 would give check digit 9 instead of 0.
        assertTrue(IdentifierValidators.isValidTaxId("1234567890"));
        assertFalse(IdentifierValidators.isValidTaxId("1234567899"));
    }

    @Test
    void taxId_shiftedDigitOfNineContributesNine() {
        // 0000000001: first shifted digit is 9, 9 * 512 mod 9 == 0, counted as 9
        assertTrue(IdentifierValidators.isValidTaxId("0000000001"));
    }

    // ── canonicalization ────────────────────────────────────────

    @Test
    void normalize_stripsSpacesAndSeparators() {
        assertEquals("10000000146", IdentifierValidators.normalize(" 100 000-001.46 "));
        assertEquals("1234567890", IdentifierValidators.normalize("123_456_7890"));
        assertEquals("", IdentifierValidators.normalize(null));
    }

    @Test
    void validate_returnsKindForEitherLength() {
        Optional<NationalIdentifier> personal = IdentifierValidators.validate("100 000 001 46");
        Optional<NationalIdentifier> tax = IdentifierValidators.validate("123-456-7890");

        assertEquals(IdentifierKind.PERSONAL, personal.orElseThrow().kind());
        assertEquals("10000000146", personal.orElseThrow().digits());
        assertEquals(IdentifierKind.TAX, tax.orElseThrow().kind());
        assertTrue(IdentifierValidators.validate("12345").isEmpty());
        assertTrue(IdentifierValidators.validate("10000000147").isEmpty());
    }

    @Test
    void nationalIdentifier_cannotHoldAnInvalidNumber() {
        assertThrows(IllegalArgumentException.class, () -> NationalIdentifier.personal("10000000147"));
        assertThrows(IllegalArgumentException.class, () -> NationalIdentifier.tax("1234567891"));
        assertThrows(IllegalArgumentException.class, () -> NationalIdentifier.tax("10000000146"));
        assertEquals("10000000146", NationalIdentifier.personal("10000000146").toString());
    }

    // ── helpers ─────────────────────────────────────────────────

    private static boolean referencePersonal(String s) {
        int[] d = s.chars().map(c -> c - '0').toArray();
        if (d[0] == 0) return false;
        int sum10 = 0;
        for (int i = 0; i < 10; i++) sum10 += d[i];
        int odd = d[0] + d[2] + d[4] + d[6] + d[8];
        int even = d[1] + d[3] + d[5] + d[7];
        int tenth = ((odd * 7 - even) % 10 + 10) % 10;
        return sum10 % 10 == d[10] && tenth == d[9];
    }

    private static String generatePersonal(Random random) {
        int[] d = new int[11];
        d[0] = 1 + random.nextInt(9);
        for (int i = 1; i < 9; i++) d[i] = random.nextInt(10);
        int odd = d[0] + d[2] + d[4] + d[6] + d[8];
        int even = d[1] + d[3] + d[5] + d[7];
        d[9] = Math.floorMod(odd * 7 - even, 10);
        int sum = 0;
        for (int i = 0; i < 10; i++) sum += d[i];
        d[10] = sum % 10;
        StringBuilder sb = new StringBuilder();
        for (int v : d) sb.append(v);
        return sb.toString();
    }
}
