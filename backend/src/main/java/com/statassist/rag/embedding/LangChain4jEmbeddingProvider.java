package com.statassist.rag.embedding;

import com.statassist.rag.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;

/**
 * Embeds text in-process with a LangChain4j {@link EmbeddingModel}
 * (AllMiniLM-L6-v2 quantised by default, 384 dimensions).
 */
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel model;

    public LangChain4jEmbeddingProvider(EmbeddingModel model) {
        this.model = model;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed empty text");
        }
        try {
            Embedding embedding = model.embed(text).content();
            if (embedding == null) {
                throw new EmbeddingException("Embedding model returned no vector");
            }
            return embedding.vector();
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error generating embedding: {}", e.getMessage());
            throw new EmbeddingException("Failed to generate embedding: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "local:" + model.getClass().getSimpleName();
    }
}
