package com.raditha.quotient.model;

/**
 * One token of a file's canonical token stream.
 * Preserves structure (node kind, operator, primitive type) while replacing
 * identifiers with their {@link IdentifierRole} and literals with their kind.
 *
 * @param kind   Node kind tag
 * @param role   Identifier role, {@link IdentifierRole#NONE} when the node names nothing
 * @param detail Structural detail such as "&&", "int" or "static"; empty when none
 * @param text   Original source text, for humans only
 * @param span   Back-reference into the source file, for reporting only
 */
public record NormalizedToken(
        NodeKind kind,
        IdentifierRole role,
        String detail,
        String text,
        SourceSpan span) {

    public NormalizedToken {
        if (role == null) {
            role = IdentifierRole.NONE;
        }
        if (detail == null) {
            detail = "";
        }
    }

    /**
     * The hashing key. Text and span never participate.
     */
    public String key() {
        if (role == IdentifierRole.NONE) {
            return detail.isEmpty() ? kind.name() : kind.name() + "(" + detail + ")";
        }
        return detail.isEmpty()
                ? kind.name() + "[" + role.name() + "]"
                : kind.name() + "[" + role.name() + "](" + detail + ")";
    }

    /**
     * Check if this token matches another token once names and spans are ignored.
     */
    public boolean semanticallyMatches(NormalizedToken other) {
        if (other == null) {
            return false;
        }
        return kind == other.kind && role == other.role && detail.equals(other.detail);
    }
}
