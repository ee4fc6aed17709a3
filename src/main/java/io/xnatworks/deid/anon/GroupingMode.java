/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.anon;

import java.util.Locale;

/**
 * Output directory layout.
 */
public enum GroupingMode {
    /** One sub-folder per synthetic study id. */
    STUDY,
    /** One sub-folder per synthetic patient identifier. */
    PATIENT,
    /** Flat output directory. */
    NONE;

    /**
     * Parse a grouping name. Accepts the full names and the single-letter forms
     * s, m (patient, from "MRN") and n.
     */
    public static GroupingMode parse(String value) {
        if (value == null || value.isBlank()) {
            return STUDY;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "s":
            case "study":
                return STUDY;
            case "m":
            case "p":
            case "patient":
                return PATIENT;
            case "n":
            case "none":
            case "flat":
                return NONE;
            default:
                throw new IllegalArgumentException("Unknown grouping mode: " + value
                        + " (expected study, patient or none)");
        }
    }
}
