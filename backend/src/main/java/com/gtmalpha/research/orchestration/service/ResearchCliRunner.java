package com.gtmalpha.research.orchestration.service;

import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.model.BatchReport;
import com.gtmalpha.research.orchestration.model.EntityLoadResult;
import com.gtmalpha.research.orchestration.model.ResearchRunRequest;
import com.gtmalpha.research.orchestration.model.ResearchRunSummary;
import com.gtmalpha.research.orchestration.model.TaskReport;
import com.gtmalpha.research.orchestration.model.TerminalOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ResearchCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ResearchCliRunner.class);

    private final ResearchProperties properties;
    private final CompanyCsvLoader csvLoader;
    private final ResearchSchedulerService scheduler;
    private final ProgressMonitorService progressMonitor;
    private final ConfigurableApplicationContext applicationContext;

    public ResearchCliRunner(
        ResearchProperties properties,
        CompanyCsvLoader csvLoader,
        ResearchSchedulerService scheduler,
        ProgressMonitorService progressMonitor,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.csvLoader = csvLoader;
        this.scheduler = scheduler;
        this.progressMonitor = progressMonitor;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        ResearchProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        EntityLoadResult loaded = csvLoader.load(cli.getCsvPath(), cli.getLimit());
        if (loaded.skippedRows() > 0) {
            log.warn("CSV rows skipped: {} (samples: {})", loaded.skippedRows(), loaded.sampleErrors());
        }
        ResearchRunRequest request = new ResearchRunRequest(loaded.entities(), cli.getBatchSize(), null);
        ResearchRunSummary summary = scheduler.run(request);
        log.info("Research run {} completed with status {}", summary.runId(), summary.status());
        for (BatchReport batch : summary.batches()) {
            for (TaskReport task : batch.tasks()) {
                if (task.outcome() == TerminalOutcome.DELIVERED) {
                    log.info(
                        "Summary {} ({}): DELIVERED{} attempts={} cost=${}",
                        task.entityId(),
                        task.name(),
                        task.resumed() ? " (resumed)" : "",
                        task.attemptCount(),
                        task.totalCost()
                    );
                } else {
                    log.info(
                        "Summary {} ({}): {} lastProvider={} failure={} reason={}",
                        task.entityId(),
                        task.name(),
                        task.outcome(),
                        task.lastProvider(),
                        task.lastFailureKind(),
                        task.lastReasonCode()
                    );
                }
            }
        }
        var report = progressMonitor.snapshot().costReport();
        log.info(
            "Cost report: total=${} byClass={} avgPerDelivered=${} suggestion={}",
            report.totalSpend(),
            report.spendByCostClass(),
            report.averagePerDeliveredEntity(),
            report.suggestion()
        );
        report.warnings().forEach(warning -> log.warn("Budget warning: {}", warning));

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
