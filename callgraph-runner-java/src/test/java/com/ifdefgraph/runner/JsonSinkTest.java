package com.ifdefgraph.runner;

import com.google.gson.Gson;
import com.ifdefgraph.core.outcome.FileStatus;
import com.ifdefgraph.runner.discovery.ProjectDiscovery;
import com.ifdefgraph.runner.index.ProcessedIndex;
import com.ifdefgraph.runner.sink.JsonSink;
import com.ifdefgraph.runner.sink.OutputModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonSinkTest {

    private static BatchResult sampleRun() {
        return new BatchRunner(new FixtureConverter(), 2).run(
                new ProjectDiscovery(List.of(".c")).discover(FixtureConverter.SAMPLE_PROJECTS),
                ProcessedIndex.disabled(), Map.of("alpha", "c0ffee"));
    }

    private static OutputModel.CallGraphDocument read(Path file) throws Exception {
        try (Reader reader = Files.newBufferedReader(file)) {
            return new Gson().fromJson(reader, OutputModel.CallGraphDocument.class);
        }
    }

    @Test
    void documentHoldsRunSummaryAndFiles(@TempDir Path tmp) throws Exception {
        new JsonSink().write(sampleRun(), tmp);
        OutputModel.CallGraphDocument doc = read(tmp.resolve(JsonSink.FILE_NAME));

        assertEquals("1", doc.formatVersion);
        assertEquals("ifdef-callgraph", doc.run.tool);
        assertEquals(List.of("alpha", "beta"), doc.run.projects);
        assertEquals(4, doc.run.fileCount);
        assertEquals(9, doc.run.edgeCount);
        assertEquals(2, doc.run.okCount);
        assertEquals(1, doc.run.partialCount);
        assertEquals(1, doc.run.failedCount);
        assertNotNull(doc.run.startedAt);
        assertEquals(4, doc.files.size());
    }

    @Test
    void fileRecordsKeepEdgeOrderAndMetadata(@TempDir Path tmp) throws Exception {
        new JsonSink().write(sampleRun(), tmp);
        OutputModel.CallGraphDocument doc = read(tmp.resolve(JsonSink.FILE_NAME));

        OutputModel.FileRecord main = doc.files.get(0);
        assertEquals("alpha", main.project);
        assertEquals("src/main.c", main.file);
        assertEquals("c0ffee", main.commitId);
        assertTrue(main.contentHash.startsWith("sha256:"));
        assertEquals(FileStatus.OK.name(), main.status);
        assertEquals("log_msg", main.edges.get(0).caller);
        assertEquals("net_up", main.edges.get(1).callee);
        assertEquals("defined(HAVE_NET)", main.edges.get(1).presenceCondition);
        assertEquals("FALSE", main.edges.get(3).presenceCondition);
        assertTrue(main.edges.get(3).alwaysFalse);

        OutputModel.FileRecord net = doc.files.get(1);
        assertTrue(net.edges.get(2).isIndirect);
        assertEquals("(*cb)", net.edges.get(2).callee);

        OutputModel.FileRecord generated = doc.files.get(2);
        assertEquals("FAILED", generated.status);
        assertNull(generated.commitId);
        assertTrue(generated.edges.isEmpty());
        assertEquals(1, generated.warnings.size());
    }

    @Test
    void writingTwiceGivesSameFileRecords(@TempDir Path tmp) throws Exception {
        BatchResult run = sampleRun();
        new JsonSink().write(run, tmp.resolve("one"));
        new JsonSink().write(run, tmp.resolve("two"));

        String first = Files.readString(tmp.resolve("one").resolve(JsonSink.FILE_NAME));
        String second = Files.readString(tmp.resolve("two").resolve(JsonSink.FILE_NAME));
        assertEquals(first, second);
        assertTrue(first.contains("\"skipped_files\": []"));
        assertTrue(first.contains("\"presence_condition\": \"defined(HAVE_NET)\""));
    }
}
