package com.ifdefgraph.runner.discovery;

import java.nio.file.Path;
import java.util.List;

/**
 * One project found under the projects directory.
 *
 * @param id    directory name of the project
 * @param root  absolute project directory
 * @param files source files relative to {@code root}, '/'-separated, sorted
 */
public record ProjectSources(String id, Path root, List<String> files) {

    public ProjectSources {
        files = List.copyOf(files);
    }

    public Path resolve(String file) {
        return root.resolve(file);
    }
}
