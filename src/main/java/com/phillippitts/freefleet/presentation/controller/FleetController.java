package com.phillippitts.freefleet.presentation.controller;

import com.phillippitts.freefleet.domain.FreeModel;
import com.phillippitts.freefleet.domain.ModelCategory;
import com.phillippitts.freefleet.domain.ModelMetadata;
import com.phillippitts.freefleet.domain.ScoutResult;
import com.phillippitts.freefleet.service.metrics.SessionMetrics;
import com.phillippitts.freefleet.service.metrics.UsageMetricsStore;
import com.phillippitts.freefleet.service.oracle.MetadataOracle;
import com.phillippitts.freefleet.service.persistence.AuditEvent;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import com.phillippitts.freefleet.service.scout.Scout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the fleet for the host runtime: ranked discovery, Oracle verdicts,
 * session savings and blocked models.
 */
@RestController
@RequestMapping("/api/fleet")
class FleetController {

    private static final Logger LOG = LogManager.getLogger(FleetController.class);
    private static final int MAX_BLOCKED_LIMIT = 1_000;

    private final Scout scout;
    private final MetadataOracle oracle;
    private final UsageMetricsStore usageMetrics;
    private final AuditLog auditLog;

    FleetController(Scout scout, MetadataOracle oracle, UsageMetricsStore usageMetrics, AuditLog auditLog) {
        this.scout = scout;
        this.oracle = oracle;
        this.usageMetrics = usageMetrics;
        this.auditLog = auditLog;
    }

    /**
     * Ranked free models. With {@code category} only that category is returned, otherwise
     * every category keyed by its name.
     */
    @GetMapping("/models")
    ResponseEntity<Map<String, List<FreeModel>>> models(@RequestParam(required = false) String category) {
        Map<String, List<FreeModel>> body = new LinkedHashMap<>();
        if (category != null && !category.isBlank()) {
            ModelCategory cat = ModelCategory.fromKey(category);
            body.put(cat.key(), scout.results(cat).rankedModels());
        } else {
            for (Map.Entry<ModelCategory, ScoutResult> entry : scout.results().entrySet()) {
                body.put(entry.getKey().key(), entry.getValue().rankedModels());
            }
        }
        return ResponseEntity.ok(body);
    }

    /** Forces a new discovery pass. */
    @PostMapping("/models/refresh")
    ResponseEntity<Map<String, Integer>> refresh() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        scout.discover().forEach((cat, result) -> counts.put(cat.key(), result.rankedModels().size()));
        LOG.info("Discovery refreshed via API: {}", counts);
        return ResponseEntity.ok(counts);
    }

    @GetMapping("/models/{modelId}/verdict")
    ResponseEntity<ModelMetadata> verdict(@PathVariable String modelId,
                                          @RequestParam(required = false) String provider) {
        return ResponseEntity.ok(oracle.fetchModelMetadata(modelId, provider));
    }

    /** Same as {@link #verdict} for ids that contain a slash (e.g. OpenRouter ids). */
    @GetMapping("/verdict")
    ResponseEntity<ModelMetadata> verdictByQuery(@RequestParam("model") String modelId,
                                                 @RequestParam(required = false) String provider) {
        return verdict(modelId, provider);
    }

    @GetMapping("/metrics")
    ResponseEntity<SessionMetrics> metrics() {
        return ResponseEntity.ok(usageMetrics.sessionMetrics());
    }

    @GetMapping("/blocked")
    ResponseEntity<List<AuditEvent>> blocked(@RequestParam(defaultValue = "100") int limit) {
        if (limit <= 0 || limit > MAX_BLOCKED_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_BLOCKED_LIMIT);
        }
        return ResponseEntity.ok(auditLog.blockedModels(limit));
    }
}
