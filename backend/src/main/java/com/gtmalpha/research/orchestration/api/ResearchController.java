package com.gtmalpha.research.orchestration.api;

import com.gtmalpha.research.orchestration.model.CompanyEntity;
import com.gtmalpha.research.orchestration.model.DeliveryRecord;
import com.gtmalpha.research.orchestration.model.ProgressSnapshot;
import com.gtmalpha.research.orchestration.model.ProviderAttempt;
import com.gtmalpha.research.orchestration.model.ResearchRunRequest;
import com.gtmalpha.research.orchestration.model.StoredTask;
import com.gtmalpha.research.orchestration.delivery.IdempotentDeliveryService;
import com.gtmalpha.research.orchestration.persistence.ResearchJdbcRepository;
import com.gtmalpha.research.orchestration.service.CompanyCsvLoader;
import com.gtmalpha.research.orchestration.service.ProgressMonitorService;
import com.gtmalpha.research.orchestration.service.ResearchSchedulerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.LinkedHashMap;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/research")
public class ResearchController {
    private final ResearchSchedulerService scheduler;
    private final ProgressMonitorService progressMonitor;
    private final CompanyCsvLoader csvLoader;
    private final ResearchJdbcRepository repository;
    private final IdempotentDeliveryService deliveryService;

    public ResearchController(
        ResearchSchedulerService scheduler,
        ProgressMonitorService progressMonitor,
        CompanyCsvLoader csvLoader,
        ResearchJdbcRepository repository,
        IdempotentDeliveryService deliveryService
    ) {
        this.scheduler = scheduler;
        this.progressMonitor = progressMonitor;
        this.csvLoader = csvLoader;
        this.repository = repository;
        this.deliveryService = deliveryService;
    }

    @PostMapping("/runs")
    public Map<String, Object> startRun(@RequestBody ResearchApiRunRequest request) {
        List<CompanyEntity> entities = request.entities();
        if ((entities == null || entities.isEmpty()) && request.csvPath() != null && !request.csvPath().isBlank()) {
            int limit = request.limit() == null ? 0 : Math.max(0, request.limit());
            entities = csvLoader.load(request.csvPath(), limit).entities();
        }
        if (entities == null || entities.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "entities or csvPath is required");
        }
        long runId = scheduler.startAsync(new ResearchRunRequest(entities, request.batchSize(), request.parallelism()));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", runId);
        body.put("entities", entities.size());
        return body;
    }

    @PostMapping("/runs/stop")
    public Map<String, Object> stopRun() {
        Long runId = scheduler.currentRunId();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", runId);
        body.put("stopRequested", scheduler.stop());
        return body;
    }

    @GetMapping("/progress")
    public ProgressSnapshot progress() {
        return progressMonitor.snapshot();
    }

    @GetMapping("/tasks/{entityId}")
    public Map<String, Object> task(@PathVariable("entityId") String entityId) {
        StoredTask task = repository.findTask(entityId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "task not found"));
        List<ProviderAttempt> attempts = repository.findAttempts(entityId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("task", task);
        body.put("attempts", attempts);
        DeliveryRecord delivery = deliveryService.find(entityId).orElse(null);
        body.put("delivery", delivery);
        return body;
    }
}
