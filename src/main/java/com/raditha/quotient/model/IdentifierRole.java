package com.raditha.quotient.model;

/**
 * Syntactic role a user identifier plays at the place it appears.
 * Identifiers are hashed by role only, so renaming never changes a token's key.
 */
public enum IdentifierRole {
    /** Local variable, or a simple name that is not otherwise classified */
    VAR,

    /** Method name, declared or invoked */
    FUNC,

    /** Parameter of the enclosing method, constructor, lambda or catch clause */
    PARAM,

    /** Field declaration or field access */
    FIELD,

    /** Declared or referenced class, interface, enum or record type */
    TYPE,

    /** Statement label */
    LABEL,

    /** The token is not an identifier */
    NONE
}
