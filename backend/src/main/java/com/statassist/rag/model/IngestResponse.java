package com.statassist.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestResponse {

    @JsonProperty("session_id")
    private String sessionId;

    private String collection;

    private String filename;

    @JsonProperty("row_count")
    private int rowCount;

    @JsonProperty("column_count")
    private int columnCount;

    @JsonProperty("chunk_count")
    private int chunkCount;

    @JsonProperty("ingest_time_ms")
    private long ingestTimeMs;
}
