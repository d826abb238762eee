package com.statassist.rag.config;

import com.statassist.rag.embedding.EmbeddingProvider;
import com.statassist.rag.embedding.LangChain4jEmbeddingProvider;
import com.statassist.rag.embedding.RemoteEmbeddingClient;
import com.statassist.rag.embedding.SerializedEmbeddingProvider;
import dev.langchain4j.model.embedding.AllMiniLmL6V2QuantizedEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Locale;

/**
 * Selects the embedding backend.
 * <ul>
 *   <li>{@code rag.embedding.provider=local}: AllMiniLM-L6-v2 (quantised) in-process</li>
 *   <li>{@code rag.embedding.provider=remote}: HTTP endpoint at {@code rag.embedding.url}</li>
 * </ul>
 * With {@code rag.embedding.serialize-calls=true} every call goes through one worker thread.
 */
@Configuration
@Slf4j
public class EmbeddingConfig {

    @Bean
    public EmbeddingProvider embeddingProvider(
            @Value("${rag.embedding.provider:local}") String provider,
            @Value("${rag.embedding.url:http://localhost:8000/api/embed}") String embedUrl,
            @Value("${rag.embedding.timeout-ms:30000}") long timeoutMs,
            @Value("${rag.embedding.serialize-calls:true}") boolean serializeCalls) {

        EmbeddingProvider base;
        switch (provider.trim().toLowerCase(Locale.ROOT)) {
            case "local":
                base = new LangChain4jEmbeddingProvider(new AllMiniLmL6V2QuantizedEmbeddingModel());
                break;
            case "remote":
                base = new RemoteEmbeddingClient(WebClient.builder(), embedUrl, Duration.ofMillis(timeoutMs));
                break;
            default:
                throw new IllegalStateException("Unknown rag.embedding.provider: " + provider
                        + " (expected 'local' or 'remote')");
        }

        EmbeddingProvider selected = serializeCalls ? new SerializedEmbeddingProvider(base) : base;
        log.info("✅ Embedding provider: {}", selected.describe());
        return selected;
    }
}
