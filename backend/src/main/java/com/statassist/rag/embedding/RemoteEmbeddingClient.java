package com.statassist.rag.embedding;

import com.statassist.rag.exception.EmbeddingException;
import com.statassist.rag.model.EmbedRequest;
import com.statassist.rag.model.EmbedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Embeds text through an HTTP endpoint accepting {@code {"text": ...}} and answering
 * {@code {"embedding": [...], "status": ...}}.
 */
@Slf4j
public class RemoteEmbeddingClient implements EmbeddingProvider {

    private final WebClient webClient;
    private final String embedUrl;
    private final Duration timeout;

    public RemoteEmbeddingClient(WebClient.Builder builder, String embedUrl, Duration timeout) {
        this.webClient = builder
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
        this.embedUrl = embedUrl;
        this.timeout = timeout;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed empty text");
        }
        try {
            log.debug("Generating embedding for text: {}", text.substring(0, Math.min(50, text.length())));

            EmbedResponse response = webClient.post()
                    .uri(embedUrl)
                    .bodyValue(new EmbedRequest(text))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .timeout(timeout)
                    .block();

            if (response == null || response.getEmbedding() == null || response.getEmbedding().isEmpty()) {
                throw new EmbeddingException("Failed to generate embedding: empty response from " + embedUrl);
            }

            List<Double> values = response.getEmbedding();
            float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i).floatValue();
            }
            log.debug("Generated embedding with {} dimensions", vector.length);
            return vector;

        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error generating embedding: {}", e.getMessage());
            throw new EmbeddingException("Failed to generate embedding: " + e.getMessage(), e);
        }
    }

    public boolean checkHealth() {
        try {
            String healthUrl = embedUrl.replace("/api/embed", "/health");
            String response = webClient.get()
                    .uri(healthUrl)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(5))
                    .block();
            return response != null && response.contains("healthy");
        } catch (RuntimeException e) {
            log.warn("Embedding endpoint health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String describe() {
        return "remote:" + embedUrl;
    }
}
