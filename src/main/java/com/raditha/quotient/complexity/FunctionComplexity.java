package com.raditha.quotient.complexity;

import com.raditha.quotient.model.SourceSpan;

/**
 * Cognitive complexity of one method or constructor.
 *
 * @param name  Simple name
 * @param arity Parameter count
 * @param span  Declaration lines
 * @param score Cognitive complexity
 */
public record FunctionComplexity(String name, int arity, SourceSpan span, int score) {
}
