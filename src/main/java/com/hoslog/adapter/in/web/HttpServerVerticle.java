package com.hoslog.adapter.in.web;

import com.hoslog.adapter.in.web.activity.ActivityHandler;
import com.hoslog.adapter.in.web.dailylog.DailyLogHandler;
import com.hoslog.adapter.in.web.trip.TripHandler;
import com.hoslog.adapter.out.http.ActivitySyncHttpAdapter;
import com.hoslog.adapter.out.http.NoOpActivitySyncAdapter;
import com.hoslog.adapter.out.persistence.InMemoryActivityRecordAdapter;
import com.hoslog.adapter.out.persistence.InMemoryTripAdapter;
import com.hoslog.application.port.out.ActivityRecordRepository;
import com.hoslog.application.port.out.ActivitySyncPort;
import com.hoslog.application.port.out.TripRepository;
import com.hoslog.application.service.ActivityCommandValidator;
import com.hoslog.application.service.ActivityTrackingService;
import com.hoslog.application.service.DailyLogService;
import com.hoslog.application.service.DriverLedgerRegistry;
import com.hoslog.application.service.ElapsedTimeSampler;
import com.hoslog.application.service.TripCommandValidator;
import com.hoslog.application.service.TripService;
import com.hoslog.domain.model.HosPolicy;
import com.hoslog.domain.service.ComplianceEvaluator;
import com.hoslog.domain.service.DurationAggregator;
import com.hoslog.domain.service.DutyStatusGraphBuilder;
import com.hoslog.infrastructure.config.HosPolicyFactory;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;

/**
 * HTTP Server Verticle - wires the hexagonal layers and serves the API.
 * Every request for every driver runs on this verticle's event loop, which is what
 * serializes access to the ledgers.
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8080;

    private final Clock clock;

    private HosPolicy policy;
    private ElapsedTimeSampler sampler;
    private ActivitySyncHttpAdapter syncHttpAdapter;
    private Router router;
    private WebRouter webRouter;
    private HttpServer server;

    public HttpServerVerticle() {
        this(Clock.systemUTC());
    }

    public HttpServerVerticle(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeServices()
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (sampler != null) {
            sampler.stop();
        }
        if (syncHttpAdapter != null) {
            syncHttpAdapter.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> initializeServices() {
        try {
            wireServices();
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        log.info("Services wired up (Hexagonal Architecture)");
        sampler.start();
        return Future.succeededFuture();
    }

    private void wireServices() {
        policy = HosPolicyFactory.fromConfig(config());

        // Output ports (adapters)
        ActivityRecordRepository recordRepository = new InMemoryActivityRecordAdapter();
        TripRepository tripRepository = new InMemoryTripAdapter();
        ActivitySyncPort syncPort = createSyncPort(config().getJsonObject("sync", new JsonObject()));

        // Core
        DriverLedgerRegistry registry = new DriverLedgerRegistry(policy);
        DurationAggregator aggregator = new DurationAggregator();

        // Application services (use cases)
        ActivityTrackingService trackingService = new ActivityTrackingService(
                registry,
                recordRepository,
                syncPort,
                new ActivityCommandValidator(),
                aggregator,
                policy,
                clock
        );
        DailyLogService dailyLogService = new DailyLogService(
                registry,
                recordRepository,
                aggregator,
                new DutyStatusGraphBuilder(),
                new ComplianceEvaluator(policy),
                policy,
                clock
        );
        TripService tripService = new TripService(
                registry,
                tripRepository,
                new TripCommandValidator(policy),
                policy,
                clock
        );

        long samplerInterval = config().getJsonObject("sampler", new JsonObject()).getLong("interval-ms", 1000L);
        sampler = new ElapsedTimeSampler(vertx, registry, trackingService, samplerInterval);

        // Input adapters (handlers)
        JsonViews views = new JsonViews(policy);
        router = Router.router(vertx);
        webRouter = new WebRouter(
                router,
                new ActivityHandler(trackingService, views),
                new DailyLogHandler(dailyLogService, views, policy, clock),
                new TripHandler(tripService, views)
        );
    }

    private ActivitySyncPort createSyncPort(JsonObject syncConfig) {
        if (!syncConfig.getBoolean("enabled", false)) {
            log.info("Backend activity sync disabled");
            return new NoOpActivitySyncAdapter();
        }
        String baseUrl = syncConfig.getString("base-url");
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("sync.base-url is required when sync is enabled");
        }
        requireHttpUrl(baseUrl);
        log.info("Backend activity sync enabled: {}", baseUrl);
        syncHttpAdapter = new ActivitySyncHttpAdapter(vertx, baseUrl, syncConfig.getLong("timeout-ms", 5000L));
        return syncHttpAdapter;
    }

    private static void requireHttpUrl(String baseUrl) {
        URI uri;
        try {
            uri = new URI(baseUrl);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("sync.base-url is not a valid URI: " + baseUrl, e);
        }
        String scheme = uri.getScheme();
        if (!("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
            throw new IllegalArgumentException("sync.base-url must be an absolute http(s) URL: " + baseUrl);
        }
    }

    private Future<Void> startHttpServer() {
        // Global handlers
        router.route().handler(LoggerHandler.create());

        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> ApiResponse.error("Endpoint not found").send(ctx, 404));

        int port = config().getJsonObject("http", new JsonObject()).getInteger("port", DEFAULT_PORT);

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(listening -> {
                    server = listening;
                    log.info("HTTP server listening on port {}", listening.actualPort());
                })
                .mapEmpty();
    }

    /**
     * Port actually bound, useful when configured with port 0
     */
    public int actualPort() {
        return server == null ? -1 : server.actualPort();
    }
}
