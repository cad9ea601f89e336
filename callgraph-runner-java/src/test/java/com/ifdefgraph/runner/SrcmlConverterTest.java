package com.ifdefgraph.runner;

import com.ifdefgraph.core.ConversionException;
import com.ifdefgraph.core.FileProcessor;
import com.ifdefgraph.core.FileResult;
import com.ifdefgraph.core.SourceUnit;
import com.ifdefgraph.core.graph.CallEdge;
import com.ifdefgraph.core.tree.TreeElement;
import com.ifdefgraph.runner.convert.SrcmlConverter;
import com.ifdefgraph.runner.convert.StructuralConverter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SrcmlConverterTest {

    private static final String MISSING_BINARY = "/nonexistent/bin/srcml-not-installed";

    /** Writes an executable shell script that plays the part of srcml. */
    private static Path fakeSrcml(Path dir, String body) throws IOException {
        Path script = dir.resolve("srcml");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        assertTrue(script.toFile().setExecutable(true), "could not mark fake srcml executable");
        return script;
    }

    @Test
    void missingBinaryIsUnavailable() {
        SrcmlConverter converter = new SrcmlConverter(MISSING_BINARY, 5);
        assertThrows(StructuralConverter.ConverterUnavailableException.class, converter::checkAvailable);
    }

    @Test
    void missingBinaryFailsConversion(@TempDir Path tmp) throws IOException {
        Path source = Files.writeString(tmp.resolve("a.c"), "int main(void) { return 0; }\n");
        SrcmlConverter converter = new SrcmlConverter(MISSING_BINARY, 5);
        assertThrows(ConversionException.class, () -> converter.convert(source));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void versionCheckAcceptsWorkingBinary(@TempDir Path tmp) throws IOException {
        Path srcml = fakeSrcml(tmp, "echo 'srcml 1.0.0'");
        assertDoesNotThrow(() -> new SrcmlConverter(srcml.toString(), 5).checkAvailable());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void versionCheckRejectsFailingBinary(@TempDir Path tmp) throws IOException {
        Path srcml = fakeSrcml(tmp, "exit 3");
        assertThrows(StructuralConverter.ConverterUnavailableException.class,
                () -> new SrcmlConverter(srcml.toString(), 5).checkAvailable());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void stdoutIsParsedAsSrcml(@TempDir Path tmp) throws Exception {
        Path srcml = fakeSrcml(tmp, """
            [ "$1" = "--position" ] && [ "$2" = "--cpp-markup-if0" ] || exit 9
            cat <<'XML'
            <unit xmlns="http://www.srcML.org/srcML/src" xmlns:pos="http://www.srcML.org/srcML/position" language="C"><function pos:start="1:1" pos:end="1:20"><name>f</name></function></unit>
            XML""");
        Path source = Files.writeString(tmp.resolve("a.c"), "void f(void) {}\n");

        TreeElement root = new SrcmlConverter(srcml.toString(), 5).convert(source);
        assertEquals("unit", root.tag());
        assertEquals("function", root.children().get(0).tag());
        assertEquals(1, root.children().get(0).span().startLine());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void callsInsideIfZeroBecomeAlwaysFalseEdges(@TempDir Path tmp) throws Exception {
        // Without --cpp-markup-if0 srcML leaves an #if 0 body as plain text
        Path srcml = fakeSrcml(tmp, """
            for arg in "$@"; do [ "$arg" = "--cpp-markup-if0" ] && marked=1; done
            [ -n "$marked" ] || { echo '<unit xmlns="http://www.srcML.org/srcML/src"/>'; exit 0; }
            cat <<'XML'
            <unit xmlns="http://www.srcML.org/srcML/src" xmlns:cpp="http://www.srcML.org/srcML/cpp" language="C"><function><name>f</name><block>{<block_content><cpp:if>#<cpp:directive>if</cpp:directive> <expr><literal type="number">0</literal></expr></cpp:if><expr_stmt><expr><call><name>old_path</name><argument_list>()</argument_list></call></expr>;</expr_stmt><cpp:endif>#<cpp:directive>endif</cpp:directive></cpp:endif></block_content>}</block></function></unit>
            XML""");
        Path source = Files.writeString(tmp.resolve("a.c"), "void f(void) {\n#if 0\n    old_path();\n#endif\n}\n");

        TreeElement root = new SrcmlConverter(srcml.toString(), 5).convert(source);
        FileResult result = new FileProcessor().process(new SourceUnit("proj", "a.c", null, null, root));

        assertEquals(1, result.edges().size());
        CallEdge edge = result.edges().get(0);
        assertEquals("old_path", edge.callee());
        assertEquals("FALSE", edge.presenceText());
        assertTrue(edge.alwaysFalse());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitFailsWithStderr(@TempDir Path tmp) throws IOException {
        Path srcml = fakeSrcml(tmp, "echo 'srcml: Extension not supported' >&2\nexit 1");
        Path source = Files.writeString(tmp.resolve("a.zz"), "?");

        ConversionException e = assertThrows(ConversionException.class,
                () -> new SrcmlConverter(srcml.toString(), 5).convert(source));
        assertTrue(e.getMessage().contains("exited with code 1"));
        assertTrue(e.getMessage().contains("Extension not supported"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void garbageOutputFailsConversion(@TempDir Path tmp) throws IOException {
        Path srcml = fakeSrcml(tmp, "echo 'not xml at all'");
        Path source = Files.writeString(tmp.resolve("a.c"), "int x;\n");
        assertThrows(ConversionException.class, () -> new SrcmlConverter(srcml.toString(), 5).convert(source));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void slowConverterIsKilledAfterTimeout(@TempDir Path tmp) throws IOException {
        Path srcml = fakeSrcml(tmp, "exec sleep 30");
        Path source = Files.writeString(tmp.resolve("a.c"), "int x;\n");

        long start = System.nanoTime();
        ConversionException e = assertThrows(ConversionException.class,
                () -> new SrcmlConverter(srcml.toString(), 1).convert(source));
        long elapsedSeconds = (System.nanoTime() - start) / 1_000_000_000L;

        assertTrue(e.getMessage().contains("timed out after 1s"));
        assertTrue(elapsedSeconds < 20, "conversion should not wait for the child to finish");
    }
}
