package com.ifdefgraph.runner;

import com.ifdefgraph.core.ConversionException;
import com.ifdefgraph.core.FileProcessor;
import com.ifdefgraph.core.FileResult;
import com.ifdefgraph.core.SourceUnit;
import com.ifdefgraph.core.outcome.FileStatus;
import com.ifdefgraph.core.tree.TreeElement;
import com.ifdefgraph.runner.convert.StructuralConverter;
import com.ifdefgraph.runner.discovery.ProjectSources;
import com.ifdefgraph.runner.index.ProcessedIndex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs every discovered file through the converter and the core on a fixed worker pool.
 *
 * Files are dispatched in project/file order and results are collected in the same order, so the
 * output does not depend on scheduling. One file's failure never stops the batch.
 */
public class BatchRunner {

    public static class BatchException extends RuntimeException {
        public BatchException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final StructuralConverter converter;
    private final int workers;
    private final FileProcessor processor = new FileProcessor();

    public BatchRunner(StructuralConverter converter, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        this.converter = converter;
        this.workers = workers;
    }

    /**
     * @param index     consulted before a file is converted and updated with every file that did not fail
     * @param commitIds project id -> commit id; projects without an entry get no commit id
     */
    public BatchResult run(List<ProjectSources> projects, ProcessedIndex index, Map<String, String> commitIds) {
        Instant started = Instant.now();
        List<Pending> pending = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> projectIds = new ArrayList<>();

        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "callgraph-worker");
            t.setDaemon(true);
            return t;
        });
        try {
            for (ProjectSources project : projects) {
                projectIds.add(project.id());
                String commitId = commitIds.get(project.id());
                System.err.println("[ifdef-callgraph] Project " + project.id() + ": "
                        + project.files().size() + " source files");

                for (String file : project.files()) {
                    String key = ProcessedIndex.key(project.id(), file);
                    Path path = project.resolve(file);
                    byte[] content;
                    try {
                        content = Files.readAllBytes(path);
                    } catch (IOException e) {
                        FileResult unreadable = processor.conversionFailed(project.id(), file, null, commitId,
                                new ConversionException("Could not read source file: " + e.getMessage(), e));
                        pending.add(new Pending(project.id(), file, null, commitId, unreadable, null));
                        continue;
                    }
                    String hash = ProcessedIndex.contentHash(content);
                    if (index.isUnchanged(key, hash)) {
                        skipped.add(key);
                        continue;
                    }
                    Future<FileResult> future = pool.submit(() -> processFile(project.id(), file, path, hash, commitId));
                    pending.add(new Pending(project.id(), file, hash, commitId, null, future));
                }
            }

            List<FileResult> results = new ArrayList<>(pending.size());
            for (Pending p : pending) {
                FileResult result = p.await(processor);
                results.add(result);
                report(result);
                if (result.outcome().status() == FileStatus.FAILED) {
                    index.forget(p.key());
                } else {
                    index.record(p.key(), p.hash());
                }
            }
            if (!skipped.isEmpty()) {
                System.err.println("[ifdef-callgraph] Skipped " + skipped.size() + " unchanged files");
            }
            return new BatchResult(projectIds, results, skipped, started, Instant.now());
        } finally {
            pool.shutdownNow();
        }
    }

    private FileResult processFile(String projectId, String file, Path path, String hash, String commitId) {
        TreeElement tree;
        try {
            tree = converter.convert(path);
        } catch (ConversionException e) {
            return processor.conversionFailed(projectId, file, hash, commitId, e);
        } catch (RuntimeException e) {
            return processor.conversionFailed(projectId, file, hash, commitId,
                    new ConversionException(e.getClass().getSimpleName() + ": " + e.getMessage(), e));
        }
        return processor.process(new SourceUnit(projectId, file, hash, commitId, tree));
    }

    private static void report(FileResult result) {
        switch (result.outcome().status()) {
            case OK -> { }
            case PARTIAL -> System.err.println("[ifdef-callgraph] WARNING: " + result.projectId() + "/"
                    + result.filePath() + " is PARTIAL (" + result.outcome().warnings().size() + " warnings)");
            case FAILED -> System.err.println("[ifdef-callgraph] WARNING: " + result.projectId() + "/"
                    + result.filePath() + " FAILED: " + String.join("; ", result.outcome().warnings()));
        }
    }

    private record Pending(String projectId, String file, String hash, String commitId,
                           FileResult done, Future<FileResult> future) {

        String key() {
            return ProcessedIndex.key(projectId, file);
        }

        FileResult await(FileProcessor processor) {
            if (done != null) return done;
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BatchException("Interrupted while waiting for " + key(), e);
            } catch (ExecutionException e) {
                // processFile catches everything it can; an Error ends up here
                Throwable cause = e.getCause();
                return processor.conversionFailed(projectId, file, hash, commitId,
                        new ConversionException("Worker failed: " + cause, cause));
            }
        }
    }
}
