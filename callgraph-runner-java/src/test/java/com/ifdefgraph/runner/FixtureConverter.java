package com.ifdefgraph.runner;

import com.ifdefgraph.core.ConversionException;
import com.ifdefgraph.core.tree.TreeElement;
import com.ifdefgraph.core.tree.dom.SrcmlDocuments;
import com.ifdefgraph.runner.convert.StructuralConverter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stands in for srcML: returns the pre-converted {@code <file>.xml} stored next to each source file.
 */
class FixtureConverter implements StructuralConverter {

    static final Path SAMPLE_PROJECTS = Paths.get(
            System.getProperty("user.dir"),
            "..", "test-fixtures", "sample-projects").normalize();

    final AtomicInteger conversions = new AtomicInteger();
    private final Set<String> crashOn;
    private final boolean available;

    FixtureConverter() {
        this(Set.of(), true);
    }

    /**
     * @param crashOn file names for which convert throws an unchecked exception
     */
    FixtureConverter(Set<String> crashOn, boolean available) {
        this.crashOn = crashOn;
        this.available = available;
    }

    @Override
    public void checkAvailable() {
        if (!available) {
            throw new ConverterUnavailableException("fixture converter switched off");
        }
    }

    @Override
    public TreeElement convert(Path sourceFile) throws ConversionException {
        conversions.incrementAndGet();
        String name = sourceFile.getFileName().toString();
        if (crashOn.contains(name)) {
            throw new IllegalStateException("converter crashed on " + name);
        }
        Path xml = sourceFile.resolveSibling(name + ".xml");
        if (!Files.exists(xml)) {
            throw new ConversionException("srcML exited with code 1: unsupported input " + name);
        }
        try {
            return SrcmlDocuments.parse(Files.readAllBytes(xml));
        } catch (IOException e) {
            throw new ConversionException("Could not read " + xml + ": " + e.getMessage(), e);
        }
    }
}
