package com.astrepr.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CliApplicationTest {

    private static final String DUMP = """
        File: main.cj {
          PackageSpec: pkgname {
            position: (1,1,1) (1,15,1)
          }
          ImportSpec: tmp-list {
            prefixPaths: std.collection
          }
        }
        """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        return new CliApplication(new PrintWriter(out, true), new PrintWriter(err, true)).run(args);
    }

    private Path writeDump(String content) throws IOException {
        Path input = tempDir.resolve("dump.txt");
        Files.writeString(input, content, StandardCharsets.UTF_8);
        return input;
    }

    private String missingConfig() {
        return tempDir.resolve("no-config.yml").toString();
    }

    @Test
    void testConvertsToStdout() throws IOException {
        Path input = writeDump(DUMP);

        int exitCode = run(input.toString(), "--config", missingConfig());

        assertEquals(0, exitCode, err.toString());
        assertEquals("""
            // position: (1,1,1) (1,15,1)
            package pkgname

            import std.collection.{tmp-list}
            """, out.toString());
    }

    @Test
    void testNoCommentsFlag() throws IOException {
        Path input = writeDump(DUMP);

        int exitCode = run(input.toString(), "--no-comments", "--config", missingConfig());

        assertEquals(0, exitCode);
        assertFalse(out.toString().contains("// position"), out.toString());
    }

    @Test
    void testWritesOutputFileAndCreatesDirectories() throws IOException {
        Path input = writeDump(DUMP);
        Path output = tempDir.resolve("nested/dir/out.cj");

        int exitCode = run(input.toString(), "-o", output.toString(), "--no-comments", "--config", missingConfig());

        assertEquals(0, exitCode);
        assertEquals("", out.toString());
        assertTrue(Files.readString(output).startsWith("package pkgname\n"));
    }

    @Test
    void testConfigFileAppliesAndFlagsOverride() throws IOException {
        Path input = writeDump(DUMP);
        Path config = tempDir.resolve("astrepr-config.yml");
        Files.writeString(config, "includePositionComments: false\n");

        assertEquals(0, run(input.toString(), "--config", config.toString()));
        assertFalse(out.toString().contains("// position"), out.toString());

        out.getBuffer().setLength(0);
        assertEquals(0, run(input.toString(), "--config", config.toString(), "--sanitize-identifiers"));
        assertFalse(out.toString().contains("// position"), out.toString());
        assertTrue(out.toString().contains("package pkgname"), out.toString());
    }

    @Test
    void testDumpTree() throws IOException {
        Path input = writeDump(DUMP);

        int exitCode = run(input.toString(), "--dump-tree", "--config", missingConfig());

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("\"kind\" : \"File\""), out.toString());
        assertTrue(out.toString().contains("\"prefixPaths\" : \"std.collection\""), out.toString());
    }

    @Test
    void testMissingInputIsUsageError() {
        int exitCode = run(tempDir.resolve("absent.txt").toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Input file not found"), err.toString());
    }

    @Test
    void testUnknownOptionIsUsageError() {
        int exitCode = run("--frobnicate");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Usage:"), err.toString());
    }

    @Test
    void testMalformedInputFails() throws IOException {
        Path input = writeDump("this is not a dump\n");

        int exitCode = run(input.toString(), "--config", missingConfig());

        assertEquals(1, exitCode);
        assertEquals("", out.toString());
    }

    @Test
    void testWrongRootKindFails() throws IOException {
        Path input = writeDump("ClassDecl: Foo {\n}\n");

        assertEquals(1, run(input.toString(), "--config", missingConfig()));
    }

    @Test
    void testHelpAndVersion() {
        assertEquals(0, run("--help"));
        assertTrue(out.toString().contains("--sanitize-identifiers"), out.toString());

        out.getBuffer().setLength(0);
        assertEquals(0, run("-V"));
        assertTrue(out.toString().startsWith("astrepr"), out.toString());
    }
}
