package com.raditha.quotient.source;

import com.raditha.quotient.model.FileRole;

/**
 * One file of a repository snapshot.
 *
 * @param path    Repository-relative path using '/' separators
 * @param content Full text of the file
 */
public record SourceFile(String path, String content) {

    public SourceFile {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be blank");
        }
        path = path.replace('\\', '/');
        if (content == null) {
            content = "";
        }
    }

    /**
     * Number of physical lines.
     */
    public int lineCount() {
        if (content.isEmpty()) {
            return 0;
        }
        return (int) content.lines().count();
    }

    public FileRole role() {
        return FileRole.detect(path);
    }
}
