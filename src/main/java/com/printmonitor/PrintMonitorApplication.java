package com.printmonitor;

import com.printmonitor.utils.LoggingConfigurator;

import com.printmonitor.verticles.MonitoringVerticle;

import io.vertx.config.ConfigRetriever;

import io.vertx.config.ConfigRetrieverOptions;

import io.vertx.config.ConfigStoreOptions;

import io.vertx.core.DeploymentOptions;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * PrintMonitor Application - Main Entry Point (Vert.x 5.0.4)

 * Startup:
 * 1. Load application.conf (HOCON)
 * 2. Apply the logging section
 * 3. Deploy MonitoringVerticle with the whole configuration

 * The REST and WebSocket adapters live outside this process's core: they talk to it
 * through the event bus addresses exposed by MonitoringVerticle.
 */
public class PrintMonitorApplication
{

    private static final Logger logger = LoggerFactory.getLogger(PrintMonitorApplication.class);

    private static final String CONFIG_PATH = "application.conf";

    private static Vertx vertx;

    private static String deploymentId;

    /**
     * Main entry point
     *
     * @param args Command line arguments (not used)
     */
    public static void main(String[] args)
    {
        logger.info("Starting PrintMonitor Application");

        vertx = Vertx.vertx();

        loadConfiguration()
            .compose(config ->
            {
                LoggingConfigurator.configure(config);

                return deploy(config);
            })
            .onSuccess(id ->
            {
                logger.info("PrintMonitor Application started");

                Runtime.getRuntime().addShutdownHook(new Thread(() ->
                {
                    logger.info("Shutdown signal received");

                    cleanup()
                        .compose(v -> vertx.close())
                        .onSuccess(v -> logger.info("Application stopped gracefully"))
                        .onFailure(cause -> logger.error("Error during graceful shutdown", cause));
                }));
            })
            .onFailure(cause ->
            {
                logger.error("Failed to start PrintMonitor Application", cause);

                cleanup()
                    .compose(v -> vertx.close())
                    .onComplete(result ->
                    {
                        if (result.failed())
                        {
                            logger.error("Failed to close Vertx instance", result.cause());
                        }

                        System.exit(1);
                    });
            });
    }

    /**
     * Deploy the monitoring verticle.
     *
     * @param config application configuration
     * @return Future with the deployment id
     */
    private static Future<String> deploy(JsonObject config)
    {
        return vertx.deployVerticle(new MonitoringVerticle(), new DeploymentOptions().setConfig(config))
            .onSuccess(id ->
            {
                deploymentId = id;

                logger.debug("MonitoringVerticle deployed: {}", id);
            })
            .onFailure(cause -> logger.error("Failed to deploy MonitoringVerticle", cause));
    }

    /**
     * Undeploy the monitoring verticle, which stops every session.
     *
     * @return Future completed when cleanup is done
     */
    private static Future<Void> cleanup()
    {
        if (deploymentId == null)
        {
            return Future.succeededFuture();
        }

        var id = deploymentId;

        deploymentId = null;

        return vertx.undeploy(id)
            .onSuccess(v -> logger.debug("Verticle undeployed: {}", id))
            .onFailure(cause -> logger.error("Failed to undeploy verticle: {}", id, cause));
    }

    /**
     * Loads application configuration from application.conf using HOCON format.
     *
     * @return Future containing the loaded configuration
     */
    private static Future<JsonObject> loadConfiguration()
    {
        var promise = Promise.<JsonObject>promise();

        var fileStore = new ConfigStoreOptions()
            .setType("file")
            .setFormat("hocon")
            .setConfig(new JsonObject().put("path", CONFIG_PATH));

        var retriever = ConfigRetriever.create(vertx, new ConfigRetrieverOptions().addStore(fileStore));

        retriever.getConfig()
            .onSuccess(config ->
            {
                logger.info("Configuration loaded from {}", CONFIG_PATH);

                promise.complete(config);
            })
            .onFailure(cause ->
            {
                logger.error("Failed to load configuration from {}", CONFIG_PATH, cause);

                promise.fail(cause);
            });

        return promise.future();
    }

}
