package com.ifdefgraph.runner.discovery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the projects (direct sub-directories) of a projects directory and their source files.
 */
public class ProjectDiscovery {

    public static class DiscoveryException extends RuntimeException {
        public DiscoveryException(String message) { super(message); }
        public DiscoveryException(String message, Throwable cause) { super(message, cause); }
    }

    private final List<String> extensions;

    /**
     * @param extensions file suffixes to include, e.g. {@code ".c"}; matched case-insensitively
     */
    public ProjectDiscovery(List<String> extensions) {
        this.extensions = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    /**
     * @throws DiscoveryException if {@code projectsDir} is not a readable directory
     */
    public List<ProjectSources> discover(Path projectsDir) {
        if (!Files.isDirectory(projectsDir)) {
            throw new DiscoveryException("Projects directory does not exist or is not a directory: " + projectsDir);
        }
        List<Path> projectDirs;
        try (Stream<Path> list = Files.list(projectsDir)) {
            projectDirs = list
                .filter(p -> Files.isDirectory(p) && !Files.isSymbolicLink(p))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new DiscoveryException("Error listing projects directory " + projectsDir + ": " + e.getMessage(), e);
        }

        List<ProjectSources> projects = new ArrayList<>();
        for (Path dir : projectDirs) {
            String id = dir.getFileName().toString();
            try {
                projects.add(new ProjectSources(id, dir.toAbsolutePath(), sourceFiles(dir)));
            } catch (IOException e) {
                System.err.println("[ifdef-callgraph] WARNING: skipping project " + id + ": " + e.getMessage());
            }
        }
        return projects;
    }

    private List<String> sourceFiles(Path projectDir) throws IOException {
        try (Stream<Path> walk = Files.walk(projectDir)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(this::hasSourceExtension)
                .map(p -> relativePath(projectDir, p))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private boolean hasSourceExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (name.endsWith(extension)) return true;
        }
        return false;
    }

    static String relativePath(Path root, Path file) {
        List<String> parts = new ArrayList<>();
        for (Path part : root.relativize(file)) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }
}
