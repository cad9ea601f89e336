package com.ifdefgraph.runner.sink;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * POJOs written to call_graph.json.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class OutputModel {

    private OutputModel() {}

    public static class CallGraphDocument {
        @SerializedName("format_version") public String formatVersion;
        @SerializedName("run")            public RunInfo run;
        @SerializedName("files")          public List<FileRecord> files;
    }

    public static class RunInfo {
        @SerializedName("tool")          public String tool;
        @SerializedName("tool_version")  public String toolVersion;
        @SerializedName("started_at")    public String startedAt;
        @SerializedName("finished_at")   public String finishedAt;
        @SerializedName("projects")      public List<String> projects;
        @SerializedName("file_count")    public int fileCount;
        @SerializedName("edge_count")    public int edgeCount;
        @SerializedName("ok_count")      public long okCount;
        @SerializedName("partial_count") public long partialCount;
        @SerializedName("failed_count")  public long failedCount;
        @SerializedName("skipped_files") public List<String> skippedFiles;
    }

    public static class FileRecord {
        @SerializedName("project")      public String project;
        @SerializedName("file")         public String file;
        @SerializedName("content_hash") public String contentHash;  // nullable
        @SerializedName("commit_id")    public String commitId;     // nullable
        @SerializedName("status")       public String status;       // OK, PARTIAL, FAILED
        @SerializedName("warnings")     public List<String> warnings;
        @SerializedName("edges")        public List<EdgeRecord> edges;
    }

    public static class EdgeRecord {
        @SerializedName("caller")             public String caller;
        @SerializedName("callee")             public String callee;
        @SerializedName("is_indirect")        public boolean isIndirect;
        @SerializedName("presence_condition") public String presenceCondition;
        @SerializedName("always_false")       public boolean alwaysFalse;
    }
}
