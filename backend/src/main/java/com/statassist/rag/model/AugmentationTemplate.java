package com.statassist.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of query-augmentation.json: the phrase appended to queries of a given type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AugmentationTemplate {

    @JsonProperty("query_type")
    private String queryType;

    @JsonProperty("phrase")
    private String phrase;

    @JsonProperty("description")
    private String description;
}
