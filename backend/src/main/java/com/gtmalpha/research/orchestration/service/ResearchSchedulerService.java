package com.gtmalpha.research.orchestration.service;

import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.budget.BudgetLedger;
import com.gtmalpha.research.orchestration.model.BatchReport;
import com.gtmalpha.research.orchestration.model.BudgetSnapshot;
import com.gtmalpha.research.orchestration.model.CompanyEntity;
import com.gtmalpha.research.orchestration.model.ResearchRunMeta;
import com.gtmalpha.research.orchestration.model.ResearchRunRequest;
import com.gtmalpha.research.orchestration.model.ResearchRunSummary;
import com.gtmalpha.research.orchestration.model.TaskReport;
import com.gtmalpha.research.orchestration.model.TaskState;
import com.gtmalpha.research.orchestration.model.TerminalOutcome;
import com.gtmalpha.research.orchestration.persistence.ResearchJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fans an entity list out into batches of B tasks with at most P in flight at once. A batch is
 * complete when every member task is terminal; only then is the next batch admitted. A stop
 * request halts admission at once, and tasks still running when the grace period ends are
 * abandoned as CANCELLED.
 */
@Service
public class ResearchSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(ResearchSchedulerService.class);
    private static final long POLL_MILLIS = 100;
    private static final long HEARTBEAT_SECONDS = 30;

    private final ResearchProperties properties;
    private final ResearchTaskRunner taskRunner;
    private final ResearchJdbcRepository repository;
    private final BudgetLedger budgetLedger;
    private final ExecutorService researchExecutor;
    private final ExecutorService researchRunExecutor;
    private final Clock clock;
    private final AtomicReference<RunContext> activeRun = new AtomicReference<>();

    public ResearchSchedulerService(
        ResearchProperties properties,
        ResearchTaskRunner taskRunner,
        ResearchJdbcRepository repository,
        BudgetLedger budgetLedger,
        @Qualifier("researchExecutor") ExecutorService researchExecutor,
        @Qualifier("researchRunExecutor") ExecutorService researchRunExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.taskRunner = taskRunner;
        this.repository = repository;
        this.budgetLedger = budgetLedger;
        this.researchExecutor = researchExecutor;
        this.researchRunExecutor = researchRunExecutor;
        this.clock = clock;
    }

    public ResearchRunSummary run(ResearchRunRequest request) {
        RunContext context = begin(request);
        return execute(context, request);
    }

    public long startAsync(ResearchRunRequest request) {
        RunContext context = begin(request);
        try {
            researchRunExecutor.submit(() -> execute(context, request));
        } catch (RejectedExecutionException e) {
            activeRun.compareAndSet(context, null);
            repository.completeRun(context.runId, clock.instant(), "FAILED", "run executor rejected the run");
            throw e;
        }
        return context.runId;
    }

    public boolean stop() {
        RunContext context = activeRun.get();
        if (context == null) {
            return false;
        }
        if (context.requestStop()) {
            log.info(
                "Stop requested for research run {}; admission halted, grace period {}s",
                context.runId,
                properties.getGracePeriodSeconds()
            );
        }
        return true;
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    public Long currentRunId() {
        RunContext context = activeRun.get();
        return context == null ? null : context.runId;
    }

    public boolean isStopRequested() {
        RunContext context = activeRun.get();
        return context != null && context.stopSignal.isStopped();
    }

    public Map<TaskState, Long> liveTaskCounts() {
        RunContext context = activeRun.get();
        return context == null ? Map.of() : context.taskCounts();
    }

    private synchronized RunContext begin(ResearchRunRequest request) {
        ensureNoActiveRun();
        Instant startedAt = clock.instant();
        List<CompanyEntity> entities = distinctEntities(request.safeEntities());
        long runId = repository.insertRun(startedAt, "RUNNING", "research started", entities.size());
        RunContext context = new RunContext(runId, startedAt, entities);
        activeRun.set(context);
        log.info("Research run {} started for {} entities", runId, entities.size());
        return context;
    }

    private ResearchRunSummary execute(RunContext context, ResearchRunRequest request) {
        int batchSize = request.batchSize() == null ? properties.getBatchSize() : Math.max(1, request.batchSize());
        int parallelism = request.parallelism() == null
            ? properties.getMaxParallelism()
            : Math.max(1, Math.min(request.parallelism(), properties.getMaxParallelism()));
        String status = "FAILED";
        String notes = "research_failed";
        List<BatchReport> batches = new ArrayList<>();

        ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor();
        heartbeat.scheduleAtFixedRate(() -> recordProgress(context), HEARTBEAT_SECONDS, HEARTBEAT_SECONDS, TimeUnit.SECONDS);
        try {
            Set<String> alreadyDelivered = repository.findDeliveredEntityIds(
                context.entities.stream().map(CompanyEntity::entityId).toList()
            );
            if (!alreadyDelivered.isEmpty()) {
                log.info("Research run {}: {} entities already delivered and will be skipped", context.runId, alreadyDelivered.size());
            }
            int batchNumber = 0;
            for (int from = 0; from < context.entities.size(); from += batchSize) {
                batchNumber++;
                List<CompanyEntity> batch = context.entities.subList(from, Math.min(from + batchSize, context.entities.size()));
                BatchReport report = runBatch(context, batchNumber, batch, alreadyDelivered, parallelism);
                batches.add(report);
                logBatchCost(context, report);
                recordProgress(context);
            }
            status = context.stopSignal.isStopped() ? "STOPPED" : "COMPLETED";
            notes = "entities=" + context.entities.size() + ", batches=" + batches.size();
        } catch (RuntimeException e) {
            log.warn("Research run {} failed", context.runId, e);
            notes = "exception=" + e.getClass().getSimpleName();
        } finally {
            heartbeat.shutdownNow();
            Instant finishedAt = clock.instant();
            try {
                repository.completeRun(context.runId, finishedAt, status, notes);
            } catch (DataAccessException e) {
                log.warn("Could not close research run {}: {}", context.runId, e.getMessage());
            }
            activeRun.compareAndSet(context, null);
            context.finishedAt = finishedAt;
        }

        Map<TerminalOutcome, Integer> outcomeCounts = new EnumMap<>(TerminalOutcome.class);
        for (BatchReport batch : batches) {
            for (TaskReport task : batch.tasks()) {
                if (task.outcome() != null) {
                    outcomeCounts.merge(task.outcome(), 1, Integer::sum);
                }
            }
        }
        log.info("Research run {} finished with status {}: {}", context.runId, status, outcomeCounts);
        return new ResearchRunSummary(context.runId, context.startedAt, context.finishedAt, status, batches, outcomeCounts);
    }

    private BatchReport runBatch(
        RunContext context,
        int batchNumber,
        List<CompanyEntity> batch,
        Set<String> alreadyDelivered,
        int parallelism
    ) {
        TaskReport[] reports = new TaskReport[batch.size()];
        List<ResearchTask> tasks = new ArrayList<>();
        List<Integer> taskPositions = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            CompanyEntity entity = batch.get(i);
            if (alreadyDelivered.contains(entity.entityId())) {
                reports[i] = resumedReport(entity);
            } else {
                tasks.add(new ResearchTask(entity, context.runId));
                taskPositions.add(i);
            }
        }
        context.startBatch(tasks, batch.size(), batch.size() - tasks.size());

        Semaphore permits = new Semaphore(parallelism);
        List<Admitted> admitted = new ArrayList<>();
        for (ResearchTask task : tasks) {
            if (!acquirePermit(permits, context.stopSignal)) {
                taskRunner.finish(task, TerminalOutcome.CANCELLED);
                continue;
            }
            try {
                Future<?> future = researchExecutor.submit(() -> {
                    try {
                        taskRunner.run(task, context.stopSignal);
                    } finally {
                        permits.release();
                    }
                });
                admitted.add(new Admitted(task, future));
            } catch (RejectedExecutionException e) {
                permits.release();
                log.warn("Executor rejected task {}", task.entity().entityId());
                taskRunner.finish(task, TerminalOutcome.CANCELLED);
            }
        }

        for (Admitted entry : admitted) {
            awaitTerminal(context, entry);
        }

        BigDecimal batchCost = BigDecimal.ZERO;
        for (int i = 0; i < tasks.size(); i++) {
            TaskReport report = tasks.get(i).report();
            reports[taskPositions.get(i)] = report;
        }
        for (TaskReport report : reports) {
            batchCost = batchCost.add(report.totalCost());
        }
        List<TaskReport> ordered = Arrays.asList(reports);
        context.finishBatch(ordered);
        return new BatchReport(batchNumber, List.copyOf(ordered), batchCost);
    }

    private void awaitTerminal(RunContext context, Admitted entry) {
        while (true) {
            Long graceDeadline = context.graceDeadlineNanos(Duration.ofSeconds(properties.getGracePeriodSeconds()));
            if (graceDeadline != null && System.nanoTime() - graceDeadline >= 0) {
                if (!entry.future().isDone()) {
                    entry.future().cancel(true);
                }
                if (!entry.task().isTerminal()) {
                    log.info("Abandoning task {} after grace period", entry.task().entity().entityId());
                    taskRunner.finish(entry.task(), TerminalOutcome.CANCELLED);
                }
                return;
            }
            try {
                entry.future().get(POLL_MILLIS, TimeUnit.MILLISECONDS);
                return;
            } catch (TimeoutException e) {
                // still running; poll again so a stop request is noticed
                continue;
            } catch (CancellationException e) {
                taskRunner.finish(entry.task(), TerminalOutcome.CANCELLED);
                return;
            } catch (ExecutionException e) {
                log.warn("Task {} crashed", entry.task().entity().entityId(), e.getCause());
                taskRunner.finish(entry.task(), TerminalOutcome.UNREACHABLE);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.requestStop();
                entry.future().cancel(true);
                taskRunner.finish(entry.task(), TerminalOutcome.CANCELLED);
                return;
            }
        }
    }

    private boolean acquirePermit(Semaphore permits, StopSignal stopSignal) {
        try {
            while (!stopSignal.isStopped()) {
                if (permits.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    if (stopSignal.isStopped()) {
                        permits.release();
                        return false;
                    }
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private TaskReport resumedReport(CompanyEntity entity) {
        return new TaskReport(
            entity.entityId(),
            entity.name(),
            TaskState.DELIVERED,
            TerminalOutcome.DELIVERED,
            null,
            null,
            null,
            0,
            BigDecimal.ZERO,
            true
        );
    }

    private void ensureNoActiveRun() {
        RunContext local = activeRun.get();
        if (local != null) {
            throw new ActiveResearchRunException(
                "Active research run in progress (id=" + local.runId + ", startedAt=" + local.startedAt + ")"
            );
        }
        Instant now = clock.instant();
        int aborted = repository.abortStaleRuns(now.minus(Duration.ofMinutes(properties.getActiveRunMinutes())), now);
        if (aborted > 0) {
            log.info("Aborted {} stale research runs", aborted);
        }
        List<ResearchRunMeta> running = repository.findRunningRuns();
        if (!running.isEmpty()) {
            ResearchRunMeta run = running.get(0);
            throw new ActiveResearchRunException(
                "Active research run in progress (id=" + run.runId() + ", startedAt=" + run.startedAt() + ")"
            );
        }
    }

    private void recordProgress(RunContext context) {
        Map<TaskState, Long> counts = context.taskCounts();
        try {
            repository.updateRunProgress(
                context.runId,
                counts.getOrDefault(TaskState.DELIVERED, 0L).intValue(),
                counts.getOrDefault(TaskState.FAILED, 0L).intValue(),
                counts.getOrDefault(TaskState.CANCELLED, 0L).intValue(),
                clock.instant()
            );
        } catch (DataAccessException e) {
            log.debug("Progress update failed for research run {}: {}", context.runId, e.getMessage());
        }
    }

    private void logBatchCost(RunContext context, BatchReport report) {
        Map<String, BigDecimal> spendByClass = new LinkedHashMap<>();
        BigDecimal totalSpend = BigDecimal.ZERO;
        for (BudgetSnapshot snapshot : budgetLedger.snapshots().values()) {
            spendByClass.put(snapshot.costClass(), snapshot.committed());
            totalSpend = totalSpend.add(snapshot.committed());
        }
        int processed = report.tasks().size();
        BigDecimal average = processed == 0
            ? BigDecimal.ZERO
            : report.batchCost().divide(BigDecimal.valueOf(processed), 6, RoundingMode.HALF_UP);
        log.info(
            "Run {} batch {} done: entities={} batchCost=${} avgPerEntity=${} spendToday=${} byClass={}",
            context.runId,
            report.batchNumber(),
            processed,
            report.batchCost(),
            average,
            totalSpend,
            spendByClass
        );
    }

    private List<CompanyEntity> distinctEntities(List<CompanyEntity> entities) {
        Map<String, CompanyEntity> unique = new LinkedHashMap<>();
        for (CompanyEntity entity : entities) {
            if (entity == null) {
                continue;
            }
            if (unique.putIfAbsent(entity.entityId(), entity) != null) {
                log.warn("Duplicate entity {} dropped from run", entity.entityId());
            }
        }
        return List.copyOf(unique.values());
    }

    private record Admitted(ResearchTask task, Future<?> future) {
    }

    private static final class RunContext {
        private final long runId;
        private final Instant startedAt;
        private final List<CompanyEntity> entities;
        private final StopSignal stopSignal = new StopSignal();
        private final AtomicReference<Long> stopRequestedNanos = new AtomicReference<>();
        private final Map<TaskState, Long> settled = new EnumMap<>(TaskState.class);
        private List<ResearchTask> currentBatch = List.of();
        private int currentResumed;
        private int notYetBatched;
        private volatile Instant finishedAt;

        private RunContext(long runId, Instant startedAt, List<CompanyEntity> entities) {
            this.runId = runId;
            this.startedAt = startedAt;
            this.entities = entities;
            this.notYetBatched = entities.size();
        }

        private boolean requestStop() {
            stopRequestedNanos.compareAndSet(null, System.nanoTime());
            return stopSignal.stop();
        }

        private Long graceDeadlineNanos(Duration grace) {
            Long requested = stopRequestedNanos.get();
            return requested == null ? null : requested + grace.toNanos();
        }

        private synchronized void startBatch(List<ResearchTask> tasks, int batchSize, int resumed) {
            currentBatch = List.copyOf(tasks);
            currentResumed = resumed;
            notYetBatched -= batchSize;
        }

        private synchronized void finishBatch(List<TaskReport> reports) {
            for (TaskReport report : reports) {
                settled.merge(report.state(), 1L, Long::sum);
            }
            currentBatch = List.of();
            currentResumed = 0;
        }

        private synchronized Map<TaskState, Long> taskCounts() {
            Map<TaskState, Long> counts = new EnumMap<>(TaskState.class);
            for (TaskState state : TaskState.values()) {
                counts.put(state, settled.getOrDefault(state, 0L));
            }
            for (ResearchTask task : currentBatch) {
                counts.merge(task.state(), 1L, Long::sum);
            }
            counts.merge(TaskState.DELIVERED, (long) currentResumed, Long::sum);
            counts.merge(TaskState.PENDING, (long) Math.max(0, notYetBatched), Long::sum);
            return counts;
        }
    }
}
