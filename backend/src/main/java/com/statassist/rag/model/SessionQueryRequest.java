package com.statassist.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionQueryRequest {

    @NotBlank(message = "Question is required")
    private String question;

    @JsonProperty("top_k")
    @Min(value = 1, message = "top_k must be at least 1")
    @Max(value = 100, message = "top_k must be at most 100")
    private Integer topK;  // capped by rag.max-top-k

    @JsonProperty("chunk_types")
    private List<String> chunkTypes;  // row_group, column_group, statistical_summary, correlation_matrix
}
