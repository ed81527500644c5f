package org.folio.layoutxml.server;

import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class Main {
  static final Logger log = LogManager.getLogger(Main.class);

  /**
   * Start layout conversion server; configured with system properties.
   * @param args ignored
   */
  public static void main(String[] args) {
    Vertx vertx = Vertx.vertx();
    vertx.deployVerticle(new MainVerticle())
        .onFailure(e -> {
          log.error(e.getMessage(), e);
          vertx.close().onComplete(x -> System.exit(1));
        });
  }
}
