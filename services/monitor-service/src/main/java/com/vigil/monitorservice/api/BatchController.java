package com.vigil.monitorservice.api;

import com.vigil.batch.BatchCoordinator;
import com.vigil.batch.BatchJson;
import com.vigil.batch.BatchOptions;
import com.vigil.batch.BatchResult;
import com.vigil.check.CheckRequest;
import com.vigil.monitorservice.config.EngineProperties;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runs a batch synchronously and returns the ordered results.
 *
 * <p>Check failures, invalid configurations and timeouts are reported per entry with HTTP 200;
 * only a malformed body or invalid knobs produce an error response.
 */
@RestController
@RequestMapping("/api/v1/batch")
public class BatchController {

    private static final Logger log = LoggerFactory.getLogger(BatchController.class);

    private final BatchCoordinator coordinator;
    private final EngineProperties engine;

    public BatchController(BatchCoordinator coordinator, EngineProperties engine) {
        this.coordinator = coordinator;
        this.engine = engine;
    }

    @PostMapping("/run")
    public Map<String, Object> run(@Valid @RequestBody BatchRunRequest request) {
        if (request.checks().size() > engine.maxChecksPerRequest()) {
            throw new IllegalArgumentException("A batch may contain at most " + engine.maxChecksPerRequest()
                    + " checks, got " + request.checks().size());
        }
        BatchOptions options = request.applyTo(engine.toOptions());
        List<CheckRequest> requests = BatchJson.toRequests(request.checks());
        log.debug("Running batch of {} checks with {}", requests.size(), options);
        BatchResult result = coordinator.runBatch(requests, options);
        return BatchJson.toDocument(result);
    }
}
