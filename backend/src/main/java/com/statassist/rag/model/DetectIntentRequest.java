package com.statassist.rag.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request model for /rag/intent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectIntentRequest {
    @NotBlank(message = "Question is required")
    private String question;
}
