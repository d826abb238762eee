package com.statassist.rag.controller;

import com.statassist.rag.dataset.CsvDatasetReader;
import com.statassist.rag.dataset.Dataset;
import com.statassist.rag.exception.InvalidDatasetException;
import com.statassist.rag.exception.InvalidRequestException;
import com.statassist.rag.intent.QueryIntentClassifier;
import com.statassist.rag.model.ChunkType;
import com.statassist.rag.model.CollectionInfo;
import com.statassist.rag.model.DetectIntentRequest;
import com.statassist.rag.model.IngestResponse;
import com.statassist.rag.model.QueryIntent;
import com.statassist.rag.model.RetrievalResult;
import com.statassist.rag.model.ScoredRetrieval;
import com.statassist.rag.model.SessionQueryRequest;
import com.statassist.rag.service.RetrievalOrchestrator;
import com.statassist.rag.store.CollectionHandle;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/rag")
@CrossOrigin(origins = "*")
@Slf4j
public class RagController {

    private final RetrievalOrchestrator orchestrator;
    private final QueryIntentClassifier classifier;
    private final CsvDatasetReader csvReader;
    private final Clock clock;

    public RagController(RetrievalOrchestrator orchestrator,
                         QueryIntentClassifier classifier,
                         CsvDatasetReader csvReader,
                         Clock clock) {
        this.orchestrator = orchestrator;
        this.classifier = classifier;
        this.csvReader = csvReader;
        this.clock = clock;
    }

    /**
     * Endpoint: /rag/sessions/{sessionId}/dataset
     * Parses an uploaded CSV and (re)builds the session's index.
     */
    @PostMapping(value = "/sessions/{sessionId}/dataset", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestResponse> uploadDataset(@PathVariable String sessionId,
                                                        @RequestParam("file") MultipartFile file) {
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "dataset.csv";
        log.info("Received dataset upload for session {}: {} ({} bytes)", sessionId, filename, file.getSize());
        long start = clock.millis();

        if (file.isEmpty()) {
            throw new InvalidDatasetException("Uploaded file is empty");
        }
        Dataset dataset;
        try (InputStream input = file.getInputStream()) {
            dataset = csvReader.read(filename, input);
        } catch (IOException e) {
            throw new InvalidDatasetException("Could not read uploaded file " + filename + ": " + e.getMessage(), e);
        }

        CollectionHandle handle = orchestrator.ingest(sessionId, dataset, filename);
        int chunkCount = orchestrator.info(sessionId).map(CollectionInfo::getCount).orElse(0);

        return ResponseEntity.ok(IngestResponse.builder()
                .sessionId(sessionId)
                .collection(handle.getName())
                .filename(filename)
                .rowCount(dataset.rowCount())
                .columnCount(dataset.columnCount())
                .chunkCount(chunkCount)
                .ingestTimeMs(clock.millis() - start)
                .build());
    }

    @PostMapping("/sessions/{sessionId}/query")
    public ResponseEntity<RetrievalResult> query(@PathVariable String sessionId,
                                                 @Valid @RequestBody SessionQueryRequest request) {
        log.info("Received query for session {}: {}", sessionId, request.getQuestion());
        RetrievalResult result = orchestrator.query(
                sessionId, request.getQuestion(), request.getTopK(), parseChunkTypes(request.getChunkTypes()));
        return ResponseEntity.ok(result);
    }

    /**
     * Endpoint: /rag/sessions/{sessionId}/query/scored
     * Same as /query with the augmented query and every candidate's scoring factors.
     */
    @PostMapping("/sessions/{sessionId}/query/scored")
    public ResponseEntity<ScoredRetrieval> queryScored(@PathVariable String sessionId,
                                                       @Valid @RequestBody SessionQueryRequest request) {
        log.info("Received scored query for session {}: {}", sessionId, request.getQuestion());
        ScoredRetrieval result = orchestrator.queryScored(sessionId, request.getQuestion(), request.getTopK(),
                parseChunkTypes(request.getChunkTypes()));
        return ResponseEntity.ok(result);
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String sessionId) {
        boolean deleted = orchestrator.delete(sessionId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("session_id", sessionId);
        response.put("deleted", deleted);
        return ResponseEntity.ok(response);
    }

    /**
     * Collection info, or an empty object when the session has no index.
     */
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<Object> info(@PathVariable String sessionId) {
        return ResponseEntity.ok(orchestrator.info(sessionId)
                .<Object>map(info -> info)
                .orElseGet(Map::of));
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<CollectionInfo>> listSessions() {
        return ResponseEntity.ok(orchestrator.listCollections());
    }

    /**
     * Endpoint: /rag/intent
     * Classification only, no retrieval.
     */
    @PostMapping("/intent")
    public ResponseEntity<QueryIntent> detectIntent(@Valid @RequestBody DetectIntentRequest request) {
        log.info("Received /intent request: {}", request.getQuestion());
        return ResponseEntity.ok(classifier.classify(request.getQuestion()));
    }

    private static Set<ChunkType> parseChunkTypes(List<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return null;
        }
        Set<ChunkType> types = EnumSet.noneOf(ChunkType.class);
        for (String label : labels) {
            ChunkType type = ChunkType.fromLabel(label);
            if (type == null) {
                throw new InvalidRequestException("Unknown chunk type: " + label);
            }
            types.add(type);
        }
        return types;
    }
}
