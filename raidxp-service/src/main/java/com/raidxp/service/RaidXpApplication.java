package com.raidxp.service;

import com.raidxp.api.ProgressionQueries;
import com.raidxp.api.exceptions.CompilationException;
import com.raidxp.api.exceptions.ConfigurationException;
import com.raidxp.api.exceptions.StoreException;
import com.raidxp.compiler.RuleCompiler;
import com.raidxp.extractor.EventExtractor;
import com.raidxp.infra.metrics.MetricsRegistry;
import com.raidxp.infra.telemetry.TracingService;
import com.raidxp.infra.telemetry.TracingSettings;
import com.raidxp.leveling.QuadraticLevelCurve;
import com.raidxp.leveling.XpAwardTable;
import com.raidxp.runtime.model.RuleSet;
import com.raidxp.service.config.IngestionConfig;
import com.raidxp.service.ingestion.FileTailer;
import com.raidxp.service.ingestion.IngestionWorker;
import com.raidxp.service.progression.ProgressionEngine;
import com.raidxp.service.progression.QuestRotation;
import com.raidxp.service.repository.JdbcStore;
import com.raidxp.service.service.PlayerManagementService;
import com.raidxp.service.service.ProgressionQueryService;
import com.raidxp.service.service.QuestManagementService;
import io.opentelemetry.api.trace.Tracer;
import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point of the ingestion service.
 *
 * <p>Startup order: configuration, rule compilation (fail fast), store and schema,
 * a first quest rotation, then the ingestion worker. The read and admin services
 * share the same store handle.
 */
public class RaidXpApplication {
    private static final Logger logger = Logger.getLogger(RaidXpApplication.class.getName());

    private final IngestionConfig config;
    private final TracingService tracingService;

    private QuestRotation rotation;
    private FileTailer tailer;
    private IngestionWorker worker;
    private Thread workerThread;

    private ProgressionQueries queries;
    private PlayerManagementService playerManagement;
    private QuestManagementService questManagement;

    public RaidXpApplication(IngestionConfig config, TracingService tracingService) {
        this.config = config;
        this.tracingService = tracingService;
    }

    public static void main(String[] args) {
        configureLogging();
        RaidXpApplication app;
        try {
            app = new RaidXpApplication(IngestionConfig.load(), TracingService.start(TracingSettings.fromEnvironment()));
            app.start();
        } catch (ConfigurationException | CompilationException | IOException e) {
            logger.log(Level.SEVERE, "Startup failed: " + e.getMessage(), e);
            System.exit(1);
            return;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Startup failed", e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "raidxp-shutdown-hook"));

        try {
            app.awaitWorker();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Optional<RuntimeException> failure = app.worker.failure();
        if (failure.isPresent()) {
            System.exit(failure.get() instanceof StoreException ? 2 : 1);
        }
    }

    public void start() throws IOException, CompilationException {
        logger.info("Starting RaidXP ingestion with " + config);
        Tracer tracer = tracingService.getTracer();
        MetricsRegistry metrics = MetricsRegistry.getInstance();
        Clock clock = Clock.systemUTC();

        RuleCompiler compiler = new RuleCompiler(tracer);
        RuleSet ruleSet = compiler.compile(config.getRulesFile());
        XpAwardTable awards = config.getXpFile().isPresent()
                ? XpAwardTable.of(compiler.compileXpTable(config.getXpFile().get()))
                : XpAwardTable.of(ruleSet.getXpAwards());
        logger.info("XP awards: " + awards);

        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL(config.getDbUrl());
        dataSource.setUser(config.getDbUser());
        dataSource.setPassword(config.getDbPassword());
        JdbcStore store = new JdbcStore(dataSource);
        store.initializeSchema();

        queries = new ProgressionQueryService(store);
        playerManagement = new PlayerManagementService(store, clock);
        questManagement = new QuestManagementService(store, clock, tracer);

        rotation = new QuestRotation(store, ruleSet.getQuestSeeds(), ruleSet.getQuestCycleDays(),
                clock, tracer, metrics);
        rotation.start(config.getQuestRotationInterval());

        ProgressionEngine engine = new ProgressionEngine(store, awards, QuadraticLevelCurve.defaultCurve(),
                config.getQuestAcceptance(), clock, tracer, metrics);
        tailer = new FileTailer(config.getLogFile(), metrics);
        worker = new IngestionWorker(tailer, new EventExtractor(ruleSet, clock, metrics), engine,
                config.getPollInterval(), config.getMaxApplyAttempts(), config.getRetryBackoff(), metrics);

        workerThread = new Thread(worker, "Ingestion-Worker");
        workerThread.start();
        logger.info("RaidXP is ingesting " + config.getLogFile());
    }

    public void awaitWorker() throws InterruptedException {
        workerThread.join();
    }

    /**
     * Stops between events: the worker finishes the line in flight first.
     */
    public void shutdown() {
        logger.info("Shutting down RaidXP");
        if (worker != null) {
            worker.stop();
            try {
                workerThread.join(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warning("Interrupted while waiting for the ingestion worker");
            }
        }
        if (rotation != null) {
            rotation.shutdown();
        }
        if (tailer != null) {
            try {
                tailer.close();
            } catch (IOException e) {
                logger.log(Level.WARNING, "Failed to close log source", e);
            }
        }
        tracingService.shutdown();
        logger.info("RaidXP shutdown complete");
    }

    public ProgressionQueries queries() {
        return queries;
    }

    public PlayerManagementService playerManagement() {
        return playerManagement;
    }

    public QuestManagementService questManagement() {
        return questManagement;
    }

    private static void configureLogging() {
        try (InputStream is = RaidXpApplication.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties, using JDK defaults", e);
        }
    }
}
