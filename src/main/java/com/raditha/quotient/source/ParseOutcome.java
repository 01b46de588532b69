package com.raditha.quotient.source;

import com.github.javaparser.ast.CompilationUnit;

import java.util.Optional;

/**
 * Result of parsing one file: either a compilation unit or the reason it failed.
 *
 * @param file          The parsed file
 * @param unit          Compilation unit, null when parsing failed
 * @param failure       Failure message, null when parsing succeeded
 * @param failureLine   Line of the first problem, 0 when unknown
 */
public record ParseOutcome(SourceFile file, CompilationUnit unit, String failure, int failureLine) {

    public static ParseOutcome parsed(SourceFile file, CompilationUnit unit) {
        return new ParseOutcome(file, unit, null, 0);
    }

    public static ParseOutcome failed(SourceFile file, String failure, int failureLine) {
        return new ParseOutcome(file, null, failure, failureLine);
    }

    public boolean isParsed() {
        return unit != null;
    }

    public Optional<CompilationUnit> compilationUnit() {
        return Optional.ofNullable(unit);
    }
}
