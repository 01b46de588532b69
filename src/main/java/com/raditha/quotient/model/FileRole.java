package com.raditha.quotient.model;

import java.util.Locale;

/**
 * Role of a file inside the repository, used to scale its aggregation weight.
 */
public enum FileRole {
    DEFAULT,
    TEST,
    GENERATED,
    VENDOR;

    /**
     * Detect the role from a repository-relative path.
     */
    public static FileRole detect(String path) {
        String lower = path.replace('\\', '/').toLowerCase(Locale.ROOT);
        if (lower.contains("/generated/") || lower.startsWith("generated/")
                || lower.startsWith("target/") || lower.contains("/target/")
                || lower.startsWith("build/") || lower.contains("/build/")) {
            return GENERATED;
        }
        if (lower.contains("vendor/") || lower.contains("third_party/")) {
            return VENDOR;
        }
        if (lower.contains("src/test/") || lower.endsWith("test.java") || lower.endsWith("tests.java")) {
            return TEST;
        }
        return DEFAULT;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
