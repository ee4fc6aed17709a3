/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.anon;

import io.xnatworks.deid.broker.IdentityBundle;
import io.xnatworks.deid.dicom.RecordTags;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies an {@link AttributePolicy} to a record. Has no side effects; missing
 * source attributes become blanks rather than failures.
 */
public class FieldTransformer {

    private final AttributePolicy policy;

    public FieldTransformer() {
        this(AttributePolicy.secondaryCapture());
    }

    public FieldTransformer(AttributePolicy policy) {
        this.policy = policy;
    }

    public TransformedRecord transform(Path source, RecordTags tags, IdentityBundle identity) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, AttributeRule> entry : policy.getRules().entrySet()) {
            String sourceValue = tags.get(entry.getKey()).orElse(null);
            out.put(entry.getKey(), entry.getValue().apply(sourceValue, identity));
        }
        return new TransformedRecord(source, out, identity);
    }
}
