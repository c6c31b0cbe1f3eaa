package com.phoenix.core.incident;

import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Incident identifier generation.
 */
public final class IncidentIds {

    /** Prefix of every generated identifier. */
    public static final String PREFIX = "INC-";

    private static final int TOKEN_LENGTH = 8;

    private IncidentIds() {
        // utility class, not instantiable
    }

    /**
     * @return supplier of ids of the form {@code INC-1a2b3c4d}, drawn from random UUIDs
     */
    public static Supplier<String> randomUuid() {
        return () -> PREFIX + UUID.randomUUID().toString()
                .replace("-", "")
                .substring(0, TOKEN_LENGTH)
                .toLowerCase(Locale.ROOT);
    }
}
