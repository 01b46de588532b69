package com.raditha.quotient.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FileRoleTest {

    @Test
    void testDetectRoles() {
        assertEquals(FileRole.DEFAULT, FileRole.detect("src/main/java/com/acme/Service.java"));
        assertEquals(FileRole.TEST, FileRole.detect("src/test/java/com/acme/Helper.java"));
        assertEquals(FileRole.TEST, FileRole.detect("module/ServiceTest.java"));
        assertEquals(FileRole.GENERATED, FileRole.detect("target/generated-sources/Parser.java"));
        assertEquals(FileRole.GENERATED, FileRole.detect("app/build/gen/R.java"));
        assertEquals(FileRole.VENDOR, FileRole.detect("third_party/lib/Util.java"));
        assertEquals(FileRole.VENDOR, FileRole.detect("vendor/Json.java"));
    }

    @Test
    void testGeneratedWinsOverTest() {
        assertEquals(FileRole.GENERATED, FileRole.detect("target/generated-test-sources/src/test/FooTest.java"));
    }

    @Test
    void testKey() {
        assertEquals("generated", FileRole.GENERATED.key());
    }
}
