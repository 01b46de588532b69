package com.raditha.quotient.normalization;

import com.raditha.quotient.model.FileRole;
import com.raditha.quotient.model.NormalizedToken;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything the analyzers need from one successfully parsed file.
 *
 * @param path           Repository-relative path
 * @param role           File role
 * @param lines          Physical line count
 * @param moduleId       Fully qualified primary type name
 * @param packageName    Declared package, empty for the default package
 * @param tokens         Canonical token stream in pre-order
 * @param imports        Import declarations in source order
 * @param referencedTypes Simple type names referenced in the file, sorted, with the line of first use
 * @param functions      Methods and constructors with bodies, in source order
 */
public record NormalizedFile(
        String path,
        FileRole role,
        int lines,
        String moduleId,
        String packageName,
        List<NormalizedToken> tokens,
        List<ImportTarget> imports,
        Map<String, Integer> referencedTypes,
        List<FunctionUnit> functions) {

    public NormalizedFile {
        tokens = List.copyOf(tokens);
        imports = List.copyOf(imports);
        referencedTypes = Collections.unmodifiableMap(new TreeMap<>(referencedTypes));
        functions = List.copyOf(functions);
    }

    public int tokenCount() {
        return tokens.size();
    }
}
