package com.docsort.identity;

import com.docsort.model.IdentifierKind;
import com.docsort.model.NationalIdentifier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierExtractorTest {

    @Test
    void extractsPersonalIdFromIdCardText() {
        Optional<NationalIdentifier> id = IdentifierExtractor.extract("t.c. kimlik no: 10000000146");

        assertTrue(id.isPresent());
        assertEquals("10000000146", id.get().digits());
        assertEquals(IdentifierKind.PERSONAL, id.get().kind());
    }

    @Test
    void personalIdWinsOverTaxIdRegardlessOfPosition() {
        assertEquals("10000000146", IdentifierExtractor.extract("tc: 10000000146 vkn: 1234567890").orElseThrow().digits());
        assertEquals("10000000146", IdentifierExtractor.extract("vkn: 1234567890 tc: 10000000146").orElseThrow().digits());
    }

    @Test
    void fallsBackToTaxIdWhenNoPersonalIdValidates() {
        Optional<NationalIdentifier> id = IdentifierExtractor.extract("tc: 10000000147 vergi no 1234567890");

        assertEquals(IdentifierKind.TAX, id.orElseThrow().kind());
        assertEquals("1234567890", id.orElseThrow().digits());
    }

    @Test
    void firstValidCandidateInTextOrderIsReturned() {
        String text = "eski: 10000000147 yeni: 12345678950 diğer: 10000000146";

        assertEquals("12345678950", IdentifierExtractor.extract(text).orElseThrow().digits());
    }

    @Test
    void digitRunsEmbeddedInLongerNumbersAreNotCandidates() {
        // the valid id sits inside a 13-digit run
        assertTrue(IdentifierExtractor.extract("iban 0010000000146 9").isEmpty());
        assertTrue(IdentifierExtractor.extract("ref 41234567890").isEmpty());
    }

    @Test
    void lettersDoNotJoinDigitRuns() {
        assertEquals("10000000146", IdentifierExtractor.extract("no:10000000146tr").orElseThrow().digits());
    }

    @Test
    void returnsEmptyWhenNothingValidates() {
        assertTrue(IdentifierExtractor.extract("fatura no: 2023001 ettn: 12345").isEmpty());
        assertTrue(IdentifierExtractor.extract("").isEmpty());
        assertTrue(IdentifierExtractor.extract(null).isEmpty());
    }

    @Test
    void digitRuns_areMaximalAndOrdered() {
        assertEquals(List.of("12", "345", "6"), IdentifierExtractor.digitRuns("a12-345 b6"));
    }
}
