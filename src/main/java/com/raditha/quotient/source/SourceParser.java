package com.raditha.quotient.source;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses Java sources with JavaParser. Comments are not attributed, so they never
 * reach the normalizer. Safe to call from several threads.
 */
public class SourceParser {

    private static final Logger logger = LoggerFactory.getLogger(SourceParser.class);

    private final ParserConfiguration configuration;

    public SourceParser() {
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false);
    }

    /**
     * Parse one file. Never throws for malformed sources.
     */
    public ParseOutcome parse(SourceFile file) {
        JavaParser parser = new JavaParser(configuration);
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(file.content());
        } catch (RuntimeException e) {
            logger.warn("Parser crashed on {}: {}", file.path(), e.getMessage());
            return ParseOutcome.failed(file, "parser error: " + e.getMessage(), 0);
        }

        if (result.isSuccessful() && result.getResult().isPresent()) {
            return ParseOutcome.parsed(file, result.getResult().get());
        }

        Problem first = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
        String message = first == null ? "unknown parse error" : first.getMessage();
        int line = first == null ? 0 : first.getLocation()
                .flatMap(l -> l.getBegin().getRange())
                .map(r -> r.begin.line)
                .orElse(0);
        logger.warn("Failed to parse {} at line {}: {}", file.path(), line, message);
        return ParseOutcome.failed(file, message, line);
    }
}
