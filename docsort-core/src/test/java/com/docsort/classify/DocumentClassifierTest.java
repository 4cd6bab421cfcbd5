package com.docsort.classify;

import com.docsort.model.Category;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentClassifierTest {

    private static DocumentClassifier classifier;

    @BeforeAll
    static void loadTable() {
        classifier = DocumentClassifier.withDefaultTable();
    }

    @Test
    void invoiceText_isClassifiedAsInvoice() {
        assertEquals(Category.INVOICES, classifier.classify("e-fatura ettn: 12345 fatura no: 2023001"));
    }

    @Test
    void invoiceText_reportsFirstConfiguredKeyword() {
        KeywordTable.Match match = classifier.firstMatch("e-fatura ettn: 12345 fatura no: 2023001").orElseThrow();

        assertEquals(Category.INVOICES, match.category());
        assertEquals("e-fatura", match.keyword());
    }

    @Test
    void idCardText_isClassifiedAsId() {
        assertEquals(Category.IDS, classifier.classify("t.c. kimlik no: 10000000146"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "türkiye ticaret sicili gazetesi faaliyet belgesi nace kodu | TRADE_REGISTRY_GAZETTE",
            "dijital abf taahhütnamesi                               | DIGITAL_ABF_COMMITMENT",
            "kişisel verilerin korunması kanunu                      | KVKK_EXPLICIT_CONSENT",
            "vekaletname                                             | POWER_OF_ATTORNEY",
            "imza beyannamesi                                        | SIGNATURE_DECLARATION",
            "abf formu                                               | ABF",
            "bu çek karşılığında keşideci                            | CHEQUE",
            "senet vade tarihi                                       | PROMISSORY_NOTE",
            "yerleşim yeri belgesi                                   | RESIDENCE_CERTIFICATE",
            "sürücü belgesi driving licence                          | DRIVER_LICENSE",
            "vergi levhası vergi kimlik no 1234567890                | TAX_PLATE",
            "ödeme emri                                              | OFFSET_AND_PAYMENT_ORDER",
            "işlenmemiş iade                                         | UNPROCESSED_RETURN_PAYMENT_ORDER",
            "bağımsız denetim                                        | INDEPENDENT_AUDIT_CERTIFICATE",
    })
    void typicalPhrases_mapToTheirCategory(String text, Category expected) {
        assertEquals(expected, classifier.classify(text));
    }

    @Test
    void earlierCategoryWins_evenWithFewerMatches() {
        String text = "fatura fatura fatura fatura mal hizmet toplam tutarı t.c. kimlik no";

        assertEquals(Category.IDS, classifier.classify(text));
    }

    @Test
    void earlierCategoryWins_evenWithShorterKeyword() {
        // "uyruğu" (ids) beats the longer "nüfus kayıt örneği" (population_register)
        assertEquals(Category.IDS, classifier.classify("nüfus kayıt örneği aile sıra no cilt no uyruğu"));
        // "faktoring hizmet sözleşmesi" sits above every contracts keyword
        assertEquals(Category.FACTORING_AGREEMENT,
                classifier.classify("faktoring hizmet sözleşmesi işbu sözleşme taraflar arasında akdedilmiştir"));
    }

    @Test
    void priorityFollowsTableOrderNotMatchCount() {
        DocumentClassifier custom = new DocumentClassifier(KeywordTable.of(List.of(
                new KeywordTable.Entry(Category.CHEQUE, List.of("çek")),
                new KeywordTable.Entry(Category.INVOICES, List.of("fatura", "irsaliye", "ettn")))));

        assertEquals(Category.CHEQUE, custom.classify("fatura irsaliye ettn çek"));
    }

    @Test
    void classification_isCaseInsensitive() {
        assertEquals(Category.INVOICES, classifier.classify("E-FATURA NO 1"));
        assertEquals(Category.DRIVER_LICENSE, classifier.classify("DRIVING LICENCE"));
    }

    @Test
    void noKeyword_isUnclassified() {
        assertEquals(Category.UNCLASSIFIED, classifier.classify("genel kurul toplantı tutanağı"));
        assertEquals(Category.UNCLASSIFIED, classifier.classify("lorem ipsum dolor sit amet, 42"));
    }

    @Test
    void emptyAndNull_areUnclassified() {
        assertEquals(Category.UNCLASSIFIED, classifier.classify(""));
        assertEquals(Category.UNCLASSIFIED, classifier.classify(null));
        assertTrue(classifier.firstMatch("").isEmpty());
    }

    @Test
    void classification_isDeterministic() {
        String text = "vergi levhası gelir idaresi faaliyet kodu";
        Category first = classifier.classify(text);
        for (int i = 0; i < 100; i++) {
            assertEquals(first, classifier.classify(text));
        }
    }

    @Test
    void keywordsFor_unknownCategoryIsEmpty() {
        assertTrue(classifier.keywordsFor(Category.CHEQUE_CUSTOMER_SCREENING).isEmpty());
        assertTrue(classifier.keywordsFor(Category.INVOICES).contains("e-fatura"));
    }
}
