package in.optiontick.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import in.optiontick.config.FeedConfig;
import in.optiontick.domain.data.ChainCatalog;
import in.optiontick.domain.repository.TickRepository;
import in.optiontick.infrastructure.feed.FeedAuthenticationException;
import in.optiontick.infrastructure.feed.FeedConnectionException;
import in.optiontick.infrastructure.feed.UpstoxFeedAuthorizer;
import in.optiontick.infrastructure.feed.UpstoxFeedDecoder;
import in.optiontick.infrastructure.feed.UpstoxFeedStream;
import in.optiontick.infrastructure.metrics.PrometheusFeedMetrics;
import in.optiontick.migration.TickSchemaMigration;
import in.optiontick.repository.SqliteDataSources;
import in.optiontick.repository.SqliteTickRepository;
import in.optiontick.service.IngestionPipeline;
import in.optiontick.service.InstrumentRegistryLoader;
import in.optiontick.service.TickPersistenceWriter;
import in.optiontick.service.query.OptionChainService;
import in.optiontick.service.query.RangeQueryService;
import in.optiontick.service.query.SnapshotQueryService;
import in.optiontick.service.query.WindowResolver;
import in.optiontick.transport.http.QueryHandlers;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point (no framework).
 *
 * RUN_MODE:
 * - FULL: ingest the Upstox option feed and serve queries
 * - INGEST: ingest only
 * - QUERY: serve queries over an existing store
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== OptionTick Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        FeedConfig config = FeedConfig.fromEnv();
        List<String> problems = config.validate();
        if (!problems.isEmpty()) {
            problems.forEach(p -> log.error("✗ Config: {}", p));
            System.exit(2);
        }
        log.info("✓ Config loaded: mode={}, store={}, http={}",
            config.runMode(), config.storePath(), config.httpEnabled() ? config.httpPort() : "off");

        Clock clock = Clock.systemUTC();
        ObjectMapper objectMapper = new ObjectMapper();

        // ═══════════════════════════════════════════════════════════════
        // Tick store
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = SqliteDataSources.create(
            config.storePath(), config.storePoolSize(), config.storeBusyTimeoutMs());
        new TickSchemaMigration(dataSource).migrate();
        TickRepository repository = new SqliteTickRepository(dataSource);
        log.info("✓ Tick store ready");

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusFeedMetrics metrics = new PrometheusFeedMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Option chains
        // ═══════════════════════════════════════════════════════════════
        ChainCatalog chains = new InstrumentRegistryLoader(objectMapper).loadCatalog(config.registryPath());
        if (config.runMode().ingests() && chains.subscriptionSet().isEmpty()) {
            log.error("✗ No instruments to subscribe in {}", config.registryPath());
            dataSource.close();
            System.exit(2);
        }
        log.info("✓ {} option chains loaded: {}", chains.size(), chains.chains().keySet());

        // ═══════════════════════════════════════════════════════════════
        // Ingestion
        // ═══════════════════════════════════════════════════════════════
        AtomicReference<IngestionPipeline> pipelineRef = new AtomicReference<>();
        if (config.runMode().ingests()) {
            HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
            TickPersistenceWriter writer = new TickPersistenceWriter(
                repository, metrics, config.writerMaxInFlight(), config.writerOfferTimeout());
            pipelineRef.set(new IngestionPipeline(
                new UpstoxFeedAuthorizer(httpClient, objectMapper, URI.create(config.authorizeUrl()), config.connectTimeout()),
                new UpstoxFeedStream(httpClient),
                new UpstoxFeedDecoder(),
                writer,
                metrics,
                objectMapper,
                clock,
                config.feedMode(),
                config.connectTimeout()));
            log.info("✓ Ingestion pipeline ready ({} instruments)", chains.subscriptionSet().size());
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP query surface
        // ═══════════════════════════════════════════════════════════════
        Undertow server = null;
        if (config.httpEnabled()) {
            SnapshotQueryService snapshotService = new SnapshotQueryService(repository, metrics);
            RangeQueryService rangeService = new RangeQueryService(repository, new WindowResolver(clock), metrics);
            QueryHandlers handlers = new QueryHandlers(
                snapshotService,
                rangeService,
                new OptionChainService(snapshotService),
                chains,
                () -> pipelineRef.get() != null ? pipelineRef.get().getState().name() : "DISABLED",
                clock);

            server = Undertow.builder()
                .addHttpListener(config.httpPort(), "0.0.0.0")
                .setHandler(handlers.routes(metrics.getRegistry()))
                .build();
            server.start();
            log.info("✓ HTTP query server started on port {}", config.httpPort());
        }

        // ═══════════════════════════════════════════════════════════════
        // Shutdown
        // ═══════════════════════════════════════════════════════════════
        Undertow httpServer = server;
        Thread shutdownHook = new Thread(() -> shutdown(httpServer, pipelineRef.get(), dataSource, config), "Shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        IngestionPipeline pipeline = pipelineRef.get();
        if (pipeline == null) {
            log.info("OptionTick serving queries on http://localhost:{}/", config.httpPort());
            return;
        }

        int exitCode = 0;
        try {
            pipeline.run(config.accessToken(), chains.subscriptionSet());
            log.info("Feed closed normally");
        } catch (FeedAuthenticationException e) {
            log.error("✗ Feed authorization failed: {}", e.getMessage());
            exitCode = 3;
        } catch (FeedConnectionException e) {
            log.error("✗ Feed connection failed: {}", e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    private static void shutdown(Undertow server, IngestionPipeline pipeline, HikariDataSource dataSource, FeedConfig config) {
        log.info("Shutting down...");
        if (server != null) {
            server.stop();
        }
        if (pipeline != null) {
            pipeline.stop(config.writerShutdownTimeout());
        }
        dataSource.close();
        log.info("✓ Shutdown complete");
    }

    private App() {}
}
