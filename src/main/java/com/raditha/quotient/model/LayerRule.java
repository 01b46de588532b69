package com.raditha.quotient.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A named layer of the declared architecture.
 *
 * @param name    Layer name
 * @param modules Membership patterns over dotted module identifiers; '*' matches one
 *                segment, '**' any number of segments
 * @param allow   Layers this layer may depend on
 * @param forbid  Layers this layer must not depend on
 */
public record LayerRule(
        @JsonProperty("name") String name,
        @JsonProperty("modules") List<String> modules,
        @JsonProperty("allow") List<String> allow,
        @JsonProperty("forbid") List<String> forbid) {

    public LayerRule {
        modules = modules == null ? List.of() : List.copyOf(modules);
        allow = allow == null ? List.of() : List.copyOf(allow);
        forbid = forbid == null ? List.of() : List.copyOf(forbid);
    }

    /**
     * Length of the most specific pattern matching the module, or -1 when none does.
     */
    public int matchSpecificity(String moduleId) {
        int best = -1;
        for (String pattern : modules) {
            if (matchesPattern(moduleId, pattern)) {
                best = Math.max(best, pattern.replace("*", "").length());
            }
        }
        return best;
    }

    public boolean contains(String moduleId) {
        return matchSpecificity(moduleId) >= 0;
    }

    public boolean allows(String layer) {
        return allow.contains(layer);
    }

    public boolean forbids(String layer) {
        return forbid.contains(layer);
    }

    /**
     * Simple glob pattern matching over dotted names.
     * Supports ** and * wildcards; "a.b.**" also matches "a.b" itself.
     */
    static boolean matchesPattern(String moduleId, String pattern) {
        if (pattern.endsWith(".**") && moduleId.equals(pattern.substring(0, pattern.length() - 3))) {
            return true;
        }
        String regex = pattern
                .replace(".", "\\.")
                .replace("**", "\u0000")
                .replace("*", "[^.]*")
                .replace("\u0000", ".*");
        return Pattern.matches(regex, moduleId);
    }
}
