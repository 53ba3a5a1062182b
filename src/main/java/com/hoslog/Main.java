package com.hoslog;

import com.hoslog.adapter.in.web.HttpServerVerticle;
import com.hoslog.adapter.out.eventbus.ElapsedTimeEventCodec;
import com.hoslog.domain.event.ElapsedTimeEvent;
import com.hoslog.infrastructure.config.ApplicationConfigLoader;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting HOS Duty Log service...");

        // Write PID to file for easy process management
        writePidToFile();

        JsonObject config;
        try {
            config = ApplicationConfigLoader.load();
        } catch (IllegalStateException e) {
            log.error("Cannot start without configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        Vertx vertx = Vertx.vertx(new VertxOptions()
                .setWorkerPoolSize(4)
                .setEventLoopPoolSize(2));

        // Register message codec for ElapsedTimeEvent
        vertx.eventBus().registerDefaultCodec(ElapsedTimeEvent.class, new ElapsedTimeEventCodec());
        log.info("Registered ElapsedTimeEvent message codec");

        // Single instance: one event loop owns every driver ledger
        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                        .setConfig(config)
                        .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down HOS Duty Log service...");
                        vertx.close();
                    }));

                    log.info("HOS Duty Log service is ready!");
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    /**
     * Write the current process PID to a file for easy management
     */
    private static void writePidToFile() {
        try {
            String pid = String.valueOf(ProcessHandle.current().pid());
            try (FileWriter writer = new FileWriter("app.pid")) {
                writer.write(pid);
            }
            log.info("PID written to app.pid: {}", pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
