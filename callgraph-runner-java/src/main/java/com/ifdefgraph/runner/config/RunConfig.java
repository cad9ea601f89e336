package com.ifdefgraph.runner.config;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Deserialized form of run-config.json. Every field is optional.
 */
public class RunConfig {

    public static final String FORMAT_CSV = "csv";
    public static final String FORMAT_JSON = "json";

    @SerializedName("srcml_path")
    private String srcmlPath;

    /** Size of the file worker pool (default: 4). */
    @SerializedName("workers")
    private Integer workers;

    /** Per-file limit on one srcML invocation (default: 30). */
    @SerializedName("timeout_seconds")
    private Integer timeoutSeconds;

    /** Source file extensions to pick up, with the dot (default: [".c"]). */
    @SerializedName("extensions")
    private List<String> extensions;

    @SerializedName("output_formats")
    private List<String> outputFormats;

    /**
     * Optional path of the skip-if-unchanged index. Relative paths resolve against the output directory.
     */
    @SerializedName("processed_index")
    private String processedIndex;

    /** Optional project id -> commit id, copied onto every record of that project. */
    @SerializedName("commit_ids")
    private Map<String, String> commitIds;

    public String getSrcmlPath()         { return srcmlPath != null ? srcmlPath : "srcml"; }
    public int getWorkers()              { return workers != null ? workers : 4; }
    public int getTimeoutSeconds()       { return timeoutSeconds != null ? timeoutSeconds : 30; }
    public List<String> getExtensions()  { return extensions != null ? extensions : List.of(".c"); }
    public List<String> getOutputFormats() {
        return outputFormats != null ? outputFormats : List.of(FORMAT_CSV, FORMAT_JSON);
    }
    public String getProcessedIndex()    { return processedIndex; }
    public Map<String, String> getCommitIds() {
        return commitIds != null ? commitIds : Collections.emptyMap();
    }
}
