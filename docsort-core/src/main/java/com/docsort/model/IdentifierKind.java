package com.docsort.model;

import com.google.gson.annotations.SerializedName;

/** The two national identifier formats and their fixed lengths. */
public enum IdentifierKind {

    /** 11-digit citizen number (T.C. kimlik no). */
    @SerializedName("personal") PERSONAL(11),

    /** 10-digit organisational tax number (VKN). */
    @SerializedName("tax") TAX(10);

    private final int length;

    IdentifierKind(int length) {
        this.length = length;
    }

    public int length() {
        return length;
    }
}
