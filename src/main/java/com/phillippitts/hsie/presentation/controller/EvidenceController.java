package com.phillippitts.hsie.presentation.controller;

import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.service.analysis.AnalyzerSet;
import com.phillippitts.hsie.service.pipeline.EvidencePipeline;
import com.phillippitts.hsie.service.store.EvidenceJsonCodec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin REST surface over {@link EvidencePipeline}. Responses use the Evidence JSON schema.
 */
@RestController
@RequestMapping(value = "/evidence", produces = MediaType.APPLICATION_JSON_VALUE)
class EvidenceController {

    private static final Logger LOG = LogManager.getLogger(EvidenceController.class);

    private final EvidencePipeline pipeline;

    EvidenceController(EvidencePipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Capture request; the audio path is resolved on the server host.
     */
    record CaptureRequest(@NotBlank String audioPath, String sessionId) {}

    @PostMapping(value = "/capture", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> capture(@Valid @RequestBody CaptureRequest request) {
        LOG.info("Capture requested for {}", request.audioPath());
        return created(pipeline.capture(Path.of(request.audioPath()), request.sessionId()));
    }

    @PostMapping("/{id}/preprocess")
    ResponseEntity<String> preprocess(@PathVariable String id) {
        return created(pipeline.preprocess(id));
    }

    /**
     * @param dimensions optional subset, e.g. {@code ?dimensions=acoustic,semantic}
     */
    @PostMapping("/{id}/analyze")
    ResponseEntity<String> analyze(@PathVariable String id,
                                   @RequestParam(required = false) List<String> dimensions) {
        if (dimensions == null || dimensions.isEmpty()) {
            return created(pipeline.analyze(id));
        }
        List<AnalyzerKind> kinds = new ArrayList<>();
        for (String d : dimensions) {
            kinds.add(AnalyzerKind.parse(d));
        }
        AnalyzerSet set = AnalyzerSet.of(kinds, pipeline.getDefaultAnalyzerSet().versions());
        return created(pipeline.analyze(id, set));
    }

    @PostMapping("/{id}/score")
    ResponseEntity<String> score(@PathVariable String id) {
        return created(pipeline.score(id));
    }

    @GetMapping("/{id}")
    ResponseEntity<String> get(@PathVariable String id) {
        return ResponseEntity.ok(EvidenceJsonCodec.toJson(pipeline.get(id)).toString());
    }

    @GetMapping("/{id}/lineage")
    ResponseEntity<String> lineage(@PathVariable String id) {
        return ResponseEntity.ok(toJsonArray(pipeline.lineage(id)));
    }

    @GetMapping("/{id}/children")
    ResponseEntity<String> children(@PathVariable String id) {
        return ResponseEntity.ok(toJsonArray(pipeline.children(id)));
    }

    private static ResponseEntity<String> created(Evidence evidence) {
        return ResponseEntity.status(HttpStatus.CREATED).body(EvidenceJsonCodec.toJson(evidence).toString());
    }

    private static String toJsonArray(List<Evidence> evidence) {
        JSONArray arr = new JSONArray();
        for (Evidence e : evidence) {
            arr.put(EvidenceJsonCodec.toJson(e));
        }
        return arr.toString();
    }
}
