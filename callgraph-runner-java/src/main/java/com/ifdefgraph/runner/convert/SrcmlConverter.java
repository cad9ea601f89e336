package com.ifdefgraph.runner.convert;

import com.ifdefgraph.core.ConversionException;
import com.ifdefgraph.core.tree.TreeElement;
import com.ifdefgraph.core.tree.dom.SrcmlDocuments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code srcml --position --cpp-markup-if0 <file>} as a subprocess and parses its stdout.
 * {@code --cpp-markup-if0} makes srcML mark up {@code #if 0} bodies, which it otherwise emits as text.
 *
 * Each invocation is bounded by {@code timeoutSeconds}; on expiry the process is killed and the
 * file fails with a {@link ConversionException}.
 */
public class SrcmlConverter implements StructuralConverter {

    private static final int VERSION_CHECK_TIMEOUT_SECONDS = 10;
    private static final int MAX_STDERR_CHARS = 500;

    private final String srcmlPath;
    private final int timeoutSeconds;

    public SrcmlConverter(String srcmlPath, int timeoutSeconds) {
        this.srcmlPath = srcmlPath;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void checkAvailable() {
        Process process;
        try {
            process = new ProcessBuilder(srcmlPath, "--version").redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new ConverterUnavailableException("Cannot run srcML at '" + srcmlPath + "': " + e.getMessage(), e);
        }
        Collector output = Collector.start(process.getInputStream());
        try {
            if (!process.waitFor(VERSION_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ConverterUnavailableException(
                    "srcML did not answer --version within " + VERSION_CHECK_TIMEOUT_SECONDS + "s");
            }
            if (process.exitValue() != 0) {
                throw new ConverterUnavailableException(
                    "srcML --version exited with code " + process.exitValue() + ": " + output.text());
            }
            System.err.println("[ifdef-callgraph] Using " + firstLine(output.text()) + " (" + srcmlPath + ")");
        } catch (IOException e) {
            throw new ConverterUnavailableException("Failed to read srcML --version output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ConverterUnavailableException("Interrupted while checking srcML", e);
        }
    }

    @Override
    public TreeElement convert(Path sourceFile) throws ConversionException {
        List<String> command = List.of(srcmlPath, "--position", "--cpp-markup-if0", sourceFile.toAbsolutePath().toString());
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ConversionException("Failed to start srcML: " + e.getMessage(), e);
        }
        Collector stdout = Collector.start(process.getInputStream());
        Collector stderr = Collector.start(process.getErrorStream());

        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ConversionException("srcML timed out after " + timeoutSeconds + "s");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new ConversionException("srcML exited with code " + exitCode + ": " + truncate(stderr.text()));
            }
            byte[] xml = stdout.bytes();
            if (xml.length == 0) {
                throw new ConversionException("srcML produced no output");
            }
            return SrcmlDocuments.parse(xml);
        } catch (IOException e) {
            throw new ConversionException("Failed to read srcML output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ConversionException("Interrupted while waiting for srcML", e);
        }
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return (newline >= 0 ? text.substring(0, newline) : text).trim();
    }

    private static String truncate(String text) {
        String trimmed = text.trim();
        return trimmed.length() <= MAX_STDERR_CHARS ? trimmed : trimmed.substring(0, MAX_STDERR_CHARS) + "...";
    }

    /**
     * Drains one process stream on a daemon thread so a full pipe never blocks the child.
     */
    private static final class Collector {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Thread thread;
        private volatile IOException failure;

        private Collector(InputStream in) {
            thread = new Thread(() -> {
                try (in) {
                    in.transferTo(buffer);
                } catch (IOException e) {
                    failure = e;
                }
            }, "srcml-stream");
            thread.setDaemon(true);
        }

        static Collector start(InputStream in) {
            Collector collector = new Collector(in);
            collector.thread.start();
            return collector;
        }

        byte[] bytes() throws IOException, InterruptedException {
            thread.join();
            if (failure != null) {
                throw failure;
            }
            return buffer.toByteArray();
        }

        String text() throws IOException, InterruptedException {
            return new String(bytes(), StandardCharsets.UTF_8);
        }
    }
}
