/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.anon;

import io.xnatworks.deid.broker.IdentityBundle;

import java.util.function.Function;

/**
 * What happens to one retained attribute.
 */
public final class AttributeRule {

    public enum Action {
        /** Copy the source value, blank when absent. */
        COPY,
        /** Replace with a fixed value. */
        CONSTANT,
        /** Replace with a value from the resolved identity. */
        IDENTITY,
        /** Keep the attribute but empty it. */
        REDACT
    }

    private final Action action;
    private final String constant;
    private final Function<IdentityBundle, String> identityValue;

    private AttributeRule(Action action, String constant, Function<IdentityBundle, String> identityValue) {
        this.action = action;
        this.constant = constant;
        this.identityValue = identityValue;
    }

    public static AttributeRule copy() {
        return new AttributeRule(Action.COPY, null, null);
    }

    public static AttributeRule constant(String value) {
        return new AttributeRule(Action.CONSTANT, value, null);
    }

    public static AttributeRule identity(Function<IdentityBundle, String> value) {
        return new AttributeRule(Action.IDENTITY, null, value);
    }

    public static AttributeRule redact() {
        return new AttributeRule(Action.REDACT, null, null);
    }

    public Action getAction() {
        return action;
    }

    String apply(String sourceValue, IdentityBundle identity) {
        switch (action) {
            case COPY:
                return sourceValue != null ? sourceValue : "";
            case CONSTANT:
                return constant;
            case IDENTITY:
                String value = identityValue.apply(identity);
                return value != null ? value : "";
            case REDACT:
            default:
                return "";
        }
    }
}
