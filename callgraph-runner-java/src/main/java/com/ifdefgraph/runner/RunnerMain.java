package com.ifdefgraph.runner;

import com.ifdefgraph.core.outcome.FileStatus;
import com.ifdefgraph.runner.config.RunConfig;
import com.ifdefgraph.runner.config.RunConfigReader;
import com.ifdefgraph.runner.convert.SrcmlConverter;
import com.ifdefgraph.runner.convert.StructuralConverter;
import com.ifdefgraph.runner.discovery.ProjectDiscovery;
import com.ifdefgraph.runner.discovery.ProjectSources;
import com.ifdefgraph.runner.index.ProcessedIndex;
import com.ifdefgraph.runner.sink.CsvSink;
import com.ifdefgraph.runner.sink.JsonSink;
import com.ifdefgraph.runner.sink.OutputSink;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar callgraph-runner-java.jar extract \
 *     --projects <dir-of-projects> \
 *     --output   <output-dir> \
 *     [--config  <run-config.json>] [--workers <n>] [--srcml <path>]
 */
public class RunnerMain {

    static final String USAGE = "Usage: java -jar callgraph-runner-java.jar extract "
            + "--projects <dir> --output <dir> [--config <run-config.json>] [--workers <n>] [--srcml <path>]";

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[ifdef-callgraph] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[ifdef-callgraph] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static BatchResult run(String[] args) {
        return run(args, SrcmlConverter::new);
    }

    /**
     * @param converterFactory builds the converter from the resolved srcML path and per-file timeout
     */
    static BatchResult run(String[] args, BiFunction<String, Integer, StructuralConverter> converterFactory) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("extract")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String projectsDir = null;
        String outputDir = null;
        String configPath = null;
        String workersFlag = null;
        String srcmlFlag = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--projects" -> projectsDir = requireNext(args, i++, "--projects");
                case "--output"   -> outputDir   = requireNext(args, i++, "--output");
                case "--config"   -> configPath  = requireNext(args, i++, "--config");
                case "--workers"  -> workersFlag = requireNext(args, i++, "--workers");
                case "--srcml"    -> srcmlFlag   = requireNext(args, i++, "--srcml");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (projectsDir == null) throw new UsageException("--projects is required");
        if (outputDir == null)   throw new UsageException("--output is required");

        Path projects = Paths.get(projectsDir);
        Path output   = Paths.get(outputDir);

        // 1. Configuration; flags win over the file
        RunConfig config;
        if (configPath != null) {
            System.err.println("[ifdef-callgraph] Reading run config: " + configPath);
            config = new RunConfigReader().read(Paths.get(configPath));
        } else {
            config = new RunConfig();
        }
        int workers = workersFlag != null ? parseWorkers(workersFlag) : config.getWorkers();
        String srcml = srcmlFlag != null ? srcmlFlag : config.getSrcmlPath();

        // 2. Converter must be runnable before any file is touched
        StructuralConverter converter = converterFactory.apply(srcml, config.getTimeoutSeconds());
        converter.checkAvailable();

        // 3. Discovery
        System.err.println("[ifdef-callgraph] Discovering projects in: " + projects);
        List<ProjectSources> discovered = new ProjectDiscovery(config.getExtensions()).discover(projects);
        int fileCount = discovered.stream().mapToInt(p -> p.files().size()).sum();
        System.err.println("[ifdef-callgraph] Found " + discovered.size() + " projects, " + fileCount + " source files");

        // 4. Extraction
        ProcessedIndex index = config.getProcessedIndex() != null
                ? ProcessedIndex.load(output.resolve(config.getProcessedIndex()))
                : ProcessedIndex.disabled();
        BatchResult result = new BatchRunner(converter, workers).run(discovered, index, config.getCommitIds());

        // 5. Output
        System.err.println("[ifdef-callgraph] Writing output to: " + output);
        for (OutputSink sink : sinksFor(config.getOutputFormats())) {
            sink.write(result, output);
        }
        index.save();

        System.err.println("[ifdef-callgraph] Done: " + result.results().size() + " files ("
                + result.count(FileStatus.OK) + " OK, "
                + result.count(FileStatus.PARTIAL) + " PARTIAL, "
                + result.count(FileStatus.FAILED) + " FAILED), "
                + result.edgeCount() + " edges");
        return result;
    }

    private static List<OutputSink> sinksFor(List<String> formats) {
        List<OutputSink> sinks = new ArrayList<>();
        if (formats.contains(RunConfig.FORMAT_CSV))  sinks.add(new CsvSink());
        if (formats.contains(RunConfig.FORMAT_JSON)) sinks.add(new JsonSink());
        return sinks;
    }

    private static int parseWorkers(String value) {
        try {
            int workers = Integer.parseInt(value);
            if (workers < 1) throw new UsageException("--workers must be at least 1");
            return workers;
        } catch (NumberFormatException e) {
            throw new UsageException("--workers expects a number, got: " + value);
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
