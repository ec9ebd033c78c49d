package com.authmap.core.model;

import java.util.Locale;

/** Key normalization shared by the store and its lookups. */
public final class MappingKeys {

    private MappingKeys() {}

    /** Case-folds an ARN for use as a map key; {@code null} stays {@code null}. */
    public static String normalize(String arn) {
        return arn == null ? null : arn.toLowerCase(Locale.ROOT);
    }
}
