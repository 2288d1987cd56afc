package com.delphine.script.types;

import java.util.Locale;

/** Identifiers are case-insensitive; every registry keys on the normalized form. */
public final class Names {

    private Names() {}

    public static String normalize(String name) {
        return name == null ? null : name.toLowerCase(Locale.ROOT);
    }

    public static boolean same(String a, String b) {
        return a != null && a.equalsIgnoreCase(b);
    }
}
