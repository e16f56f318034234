package com.careu.reasoning.model;

import java.util.regex.Pattern;

/**
 * Canonical identifiers are lowercase hyphenated tokens, e.g. {@code stiff-neck}.
 * Callers normalise free text before it reaches the engine.
 */
public final class Identifiers {

    private static final Pattern CANONICAL = Pattern.compile("[a-z0-9]+(?:-[a-z0-9]+)*");

    public static boolean isCanonical(String id) {
        return id != null && CANONICAL.matcher(id).matches();
    }

    private Identifiers() {}
}
