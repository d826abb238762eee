package com.statassist.rag;

import com.statassist.rag.embedding.EmbeddingProvider;
import com.statassist.rag.support.HashingEmbeddingProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "rag.embedding.provider=remote",
        "rag.embedding.serialize-calls=false"
})
@AutoConfigureMockMvc
class RagApiApplicationTest {

    @TestConfiguration
    static class HashingEmbeddings {

        @Bean
        @Primary
        EmbeddingProvider hashingEmbeddingProvider() {
            return new HashingEmbeddingProvider();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Test
    void uploadQueryAndDeleteOverHttp() throws Exception {
        StringBuilder csv = new StringBuilder("age,cholesterol,bmi,group\n");
        for (int i = 0; i < 40; i++) {
            csv.append(30 + i).append(',').append(180.0 + i * 1.5).append(',')
                    .append(20 + i % 7).append(',').append(i % 2 == 0 ? "control" : "treated").append('\n');
        }
        MockMultipartFile file = new MockMultipartFile("file", "clinical.csv", "text/csv",
                csv.toString().getBytes());

        mockMvc.perform(multipart("/rag/sessions/it/dataset").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.row_count").value(40))
                .andExpect(jsonPath("$.chunk_count").value(6));

        mockMvc.perform(post("/rag/sessions/it/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"What is the correlation between age and cholesterol?\",\"top_k\":10}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent.type").value("correlation"))
                .andExpect(jsonPath("$.chunks[0]").value(startsWith("Correlation Analysis:")));

        mockMvc.perform(delete("/rag/sessions/it"))
                .andExpect(jsonPath("$.deleted").value(true));

        mockMvc.perform(post("/rag/sessions/it/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"describe\"}"))
                .andExpect(status().isNotFound());
    }
}
