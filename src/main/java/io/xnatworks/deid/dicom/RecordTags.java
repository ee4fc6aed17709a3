/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.dicom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Attribute values of one record, keyed by DICOM keyword (e.g. "PatientID").
 * Multi-valued attributes use the DICOM backslash delimiter.
 */
public final class RecordTags {
    private final Map<String, String> values;

    public RecordTags(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RecordTags of(String... keywordValuePairs) {
        if (keywordValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Expected keyword/value pairs");
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keywordValuePairs.length; i += 2) {
            map.put(keywordValuePairs[i], keywordValuePairs[i + 1]);
        }
        return new RecordTags(map);
    }

    /**
     * Value of an attribute, empty if the record does not carry it.
     */
    public Optional<String> get(String keyword) {
        return Optional.ofNullable(values.get(keyword));
    }

    /**
     * Trimmed value, empty if absent or blank.
     */
    public Optional<String> getNonBlank(String keyword) {
        String value = values.get(keyword);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    public boolean contains(String keyword) {
        return values.containsKey(keyword);
    }

    public Set<String> keywords() {
        return values.keySet();
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "RecordTags" + values.keySet();
    }
}
