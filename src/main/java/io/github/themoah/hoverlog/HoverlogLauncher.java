package io.github.themoah.hoverlog;

import io.github.themoah.hoverlog.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: creates Vert.x and deploys the main verticle.
 */
public class HoverlogLauncher {

  private static final Logger log = LoggerFactory.getLogger(HoverlogLauncher.class);

  public static void main(String[] args) {
    VertxOptions vertxOptions = VertxConfig.createVertxOptions();
    Vertx vertx = Vertx.vertx(vertxOptions);

    DeploymentOptions deploymentOptions = VertxConfig.createDeploymentOptions();

    vertx.deployVerticle(new MainVerticle(), deploymentOptions)
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      log.info("Shutdown requested, closing Vert.x");
      vertx.close().toCompletionStage().toCompletableFuture().join();
    }, "hoverlog-shutdown"));
  }
}
