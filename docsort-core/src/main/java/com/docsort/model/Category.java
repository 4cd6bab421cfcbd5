package com.docsort.model;

import com.google.gson.annotations.SerializedName;

/**
 * Closed set of document types a page can be filed under.
 *
 * <p>Each member carries the name of the folder its documents are filed into;
 * the same name is used in JSON. Declaration order here is the folder layout
 * order only. Classification priority comes from the keyword table.</p>
 */
public enum Category {

    @SerializedName("invoices") INVOICES("invoices"),
    @SerializedName("ids") IDS("ids"),
    @SerializedName("cheque") CHEQUE("cheque"),
    @SerializedName("signature_declaration") SIGNATURE_DECLARATION("signature_declaration"),
    @SerializedName("residence_certificate") RESIDENCE_CERTIFICATE("residence_certificate"),
    @SerializedName("trade_registry_gazette") TRADE_REGISTRY_GAZETTE("trade_registry_gazette"),
    @SerializedName("driver_license") DRIVER_LICENSE("driver_license"),
    @SerializedName("population_register") POPULATION_REGISTER("population_register"),
    @SerializedName("tax_plate") TAX_PLATE("tax_plate"),
    @SerializedName("contracts") CONTRACTS("contracts"),
    @SerializedName("kvkk_explicit_consent") KVKK_EXPLICIT_CONSENT("kvkk_explicit_consent"),
    @SerializedName("digital_abf_commitment") DIGITAL_ABF_COMMITMENT("digital_abf_commitment"),
    @SerializedName("power_of_attorney") POWER_OF_ATTORNEY("power_of_attorney"),
    @SerializedName("abf") ABF("abf"),
    @SerializedName("cheque_customer_screening") CHEQUE_CUSTOMER_SCREENING("cheque_customer_screening"),
    @SerializedName("promissory_note") PROMISSORY_NOTE("promissory_note"),
    @SerializedName("offset_and_payment_order") OFFSET_AND_PAYMENT_ORDER("offset_and_payment_order"),
    @SerializedName("unprocessed_return_payment_order") UNPROCESSED_RETURN_PAYMENT_ORDER("unprocessed_return_payment_order"),
    @SerializedName("factoring_agreement") FACTORING_AGREEMENT("factoring_agreement"),
    @SerializedName("activity_certificate") ACTIVITY_CERTIFICATE("activity_certificate"),
    @SerializedName("independent_audit_certificate") INDEPENDENT_AUDIT_CERTIFICATE("independent_audit_certificate"),

    /** No keyword matched on any attempt. */
    @SerializedName("others") UNCLASSIFIED("others"),

    /** The document could not be loaded at all. */
    @SerializedName("error_files") PROCESSING_ERROR("error_files");

    private final String folderName;

    Category(String folderName) {
        this.folderName = folderName;
    }

    public String folderName() {
        return folderName;
    }

    /** True for the two catch-all members that no keyword can select. */
    public boolean isSentinel() {
        return this == UNCLASSIFIED || this == PROCESSING_ERROR;
    }

    /**
     * Look up a member by its folder name.
     *
     * @throws IllegalArgumentException if no member uses that folder
     */
    public static Category fromFolderName(String folderName) {
        for (Category c : values()) {
            if (c.folderName.equals(folderName)) return c;
        }
        throw new IllegalArgumentException("Unknown category folder: " + folderName);
    }

    @Override
    public String toString() {
        return folderName;
    }
}
