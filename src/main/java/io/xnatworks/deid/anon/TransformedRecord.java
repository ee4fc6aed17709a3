/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.anon;

import io.xnatworks.deid.broker.IdentityBundle;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

/**
 * Output of the transformer for one input file. Owned by the worker handling
 * that file.
 */
public class TransformedRecord {
    private final Path source;
    private final Map<String, String> attributes;
    private final IdentityBundle identity;

    public TransformedRecord(Path source, Map<String, String> attributes, IdentityBundle identity) {
        this.source = source;
        this.attributes = Collections.unmodifiableMap(attributes);
        this.identity = identity;
    }

    public Path getSource() { return source; }

    public Map<String, String> getAttributes() { return attributes; }

    public IdentityBundle getIdentity() { return identity; }

    public String get(String keyword) {
        return attributes.getOrDefault(keyword, "");
    }
}
