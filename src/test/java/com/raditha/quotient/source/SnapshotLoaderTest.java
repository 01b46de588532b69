package com.raditha.quotient.source;

import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.model.FileRole;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotLoaderTest {

    @TempDir
    Path tempDir;

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void testLoadsJavaFilesSortedByPath() throws IOException {
        write("src/main/java/b/B.java", "class B {}\n");
        write("src/main/java/a/A.java", "class A {}\n");
        write("src/test/java/a/ATest.java", "class ATest {}\n");
        write("README.md", "# readme\n");

        RepositorySnapshot snapshot = new SnapshotLoader(List.of()).load(tempDir);

        assertEquals(List.of("src/main/java/a/A.java", "src/main/java/b/B.java", "src/test/java/a/ATest.java"),
                snapshot.files().stream().map(SourceFile::path).toList());
        assertEquals(FileRole.TEST, snapshot.files().get(2).role());
        assertEquals(tempDir.toAbsolutePath().normalize(), snapshot.root().orElseThrow());
    }

    @Test
    void testDefaultExclusions() throws IOException {
        write("src/main/java/A.java", "class A {}\n");
        write("target/generated-sources/Gen.java", "class Gen {}\n");
        write("module/build/Out.java", "class Out {}\n");

        RepositorySnapshot snapshot = new SnapshotLoader(QualityConfig.PathSettings.defaults().exclude()).load(tempDir);

        assertEquals(1, snapshot.size());
        assertEquals("src/main/java/A.java", snapshot.files().get(0).path());
    }

    @Test
    void testNotADirectory() throws IOException {
        write("A.java", "class A {}\n");

        assertThrows(IOException.class, () -> new SnapshotLoader(List.of()).load(tempDir.resolve("A.java")));
    }

    @Test
    void testGlobPatterns() {
        assertTrue(SnapshotLoader.matchesGlobPattern("target/X.java", "**/target/**"));
        assertTrue(SnapshotLoader.matchesGlobPattern("a/b/target/c/X.java", "**/target/**"));
        assertFalse(SnapshotLoader.matchesGlobPattern("src/targets/X.java", "**/target/**"));
        assertTrue(SnapshotLoader.matchesGlobPattern("src/legacy/Old.java", "src/legacy/*.java"));
        assertFalse(SnapshotLoader.matchesGlobPattern("src/legacy/deep/Old.java", "src/legacy/*.java"));
    }

    @Test
    void testSnapshotRejectsDuplicatePaths() {
        List<SourceFile> files = List.of(new SourceFile("A.java", "class A {}"), new SourceFile("A.java", ""));

        assertThrows(IllegalArgumentException.class, () -> RepositorySnapshot.of(files));
    }

    @Test
    void testLineCount() {
        assertEquals(0, new SourceFile("A.java", "").lineCount());
        assertEquals(2, new SourceFile("A.java", "class A {\n}\n").lineCount());
        assertEquals("src/A.java", new SourceFile("src\\A.java", null).path());
    }
}
