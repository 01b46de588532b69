package com.raditha.quotient.model;

/**
 * Closed set of AST node kinds that survive normalization.
 * The mapping from JavaParser nodes lives in
 * {@link com.raditha.quotient.normalization.TokenNormalizer}.
 */
public enum NodeKind {
    // declarations
    CLASS_DECL,
    ENUM_DECL,
    RECORD_DECL,
    ANNOTATION_DECL,
    ENUM_CONSTANT,
    FIELD_DECL,
    METHOD_DECL,
    CONSTRUCTOR_DECL,
    INITIALIZER,
    PARAMETER,
    VARIABLE,

    // statements
    BLOCK,
    EXPRESSION_STMT,
    IF,
    FOR,
    FOREACH,
    WHILE,
    DO,
    SWITCH,
    SWITCH_ENTRY,
    TRY,
    CATCH,
    RETURN,
    THROW,
    BREAK,
    CONTINUE,
    YIELD,
    SYNCHRONIZED,
    LABELED,
    ASSERT,
    LOCAL_TYPE,
    EXPLICIT_CONSTRUCTOR_CALL,
    EMPTY,

    // expressions
    NAME,
    FIELD_ACCESS,
    METHOD_CALL,
    OBJECT_CREATION,
    ASSIGN,
    BINARY,
    UNARY,
    CONDITIONAL,
    LAMBDA,
    METHOD_REFERENCE,
    CAST,
    INSTANCE_OF,
    ARRAY_ACCESS,
    ARRAY_CREATION,
    ARRAY_INITIALIZER,
    THIS,
    SUPER,
    CLASS_LITERAL,
    ENCLOSED,
    VARIABLE_DECL_EXPR,
    STRING_LIT,
    TEXT_BLOCK_LIT,
    CHAR_LIT,
    INT_LIT,
    LONG_LIT,
    DOUBLE_LIT,
    BOOLEAN_LIT,
    NULL_LIT,

    // types and modifiers
    TYPE,
    MODIFIER,
    ANNOTATION,

    /** Any other node that still carries structure */
    OTHER
}
