package com.raditha.quotient.normalization;

import com.github.javaparser.ast.body.CallableDeclaration;
import com.raditha.quotient.model.SourceSpan;

/**
 * A method or constructor with a body, as handed to the complexity scorer.
 * The declaration is treated as read-only.
 *
 * @param name        Simple name
 * @param arity       Number of declared parameters
 * @param span        Lines of the declaration
 * @param declaration The declaration node
 */
public record FunctionUnit(String name, int arity, SourceSpan span, CallableDeclaration<?> declaration) {

    /**
     * Display name such as "save/2".
     */
    public String signature() {
        return name + "/" + arity;
    }
}
