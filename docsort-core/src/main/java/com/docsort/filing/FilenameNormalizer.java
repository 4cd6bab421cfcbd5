package com.docsort.filing;

import java.text.Normalizer;

/**
 * Unicode normalisation for file names. Scans arriving from macOS often carry
 * decomposed Turkish letters (e.g. "ş" as "s" + combining cedilla) that compare
 * unequal to the composed form used elsewhere.
 */
public final class FilenameNormalizer {

    private FilenameNormalizer() {}

    /** NFKC form of the name. */
    public static String normalize(String fileName) {
        return Normalizer.normalize(fileName, Normalizer.Form.NFKC);
    }
}
