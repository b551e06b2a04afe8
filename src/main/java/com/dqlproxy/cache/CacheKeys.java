package com.dqlproxy.cache;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Derives cache fingerprints from a response kind and the request parameters that
 * affect the response.
 *
 * Parameters are joined in order with '|' and hashed with SHA-256. Separators inside
 * parameters are escaped, so ("a|b", "c") and ("a", "b|c") get different keys. An absent
 * parameter hashes like the empty string.
 */
public final class CacheKeys {

    public static final String RAW = "raw";
    public static final String TABLE = "table";
    public static final String TIMESERIES = "ts";

    private static final char SEPARATOR = '|';
    private static final char ESCAPE = '\\';

    private CacheKeys() {
        // Utility class, no instantiation
    }

    public static String derive(String kind, String... params) {
        StringBuilder joined = new StringBuilder();
        appendEscaped(joined, kind);
        for (String param : params) {
            joined.append(SEPARATOR);
            appendEscaped(joined, param);
        }
        return DigestUtils.sha256Hex(joined.toString());
    }

    private static void appendEscaped(StringBuilder out, String value) {
        if (value == null) {
            return;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == SEPARATOR || c == ESCAPE) {
                out.append(ESCAPE);
            }
            out.append(c);
        }
    }
}
