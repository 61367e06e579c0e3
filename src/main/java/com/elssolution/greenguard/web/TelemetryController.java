package com.elssolution.greenguard.web;

import com.elssolution.greenguard.domain.TelemetryRecord;
import com.elssolution.greenguard.service.IngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/telemetry")
public class TelemetryController {

    private final IngestionService ingestion;

    public TelemetryController(IngestionService ingestion) {
        this.ingestion = ingestion;
    }

    /** Accepts one reading; the audit runs in the background. */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> ingest(@RequestBody Map<String, Object> body) {
        TelemetryRecord stored = ingestion.ingest(body);
        return Map.of(
                "success", true,
                "telemetryId", stored.id(),
                "message", "Telemetry received, audit pipeline started"
        );
    }
}
