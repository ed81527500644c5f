package org.folio.layoutxml.client;

import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.layoutxml.util.LayoutXmlException;

public class Main {
  static final Logger log = LogManager.getLogger(Main.class);

  /**
   * Main program for client.
   * @param args command-line args
   */
  public static void main(String[] args) {
    Vertx vertx = Vertx.vertx();
    Client.exec(vertx, args)
        .eventually(x -> vertx.close())
        .onFailure(e -> {
          if (e instanceof LayoutXmlException) {
            LayoutXmlException le = (LayoutXmlException) e;
            log.error("{} at line {} column {}: {}", le.getErrorType(), le.getLine(),
                le.getColumn(), le.getMessage());
          } else {
            log.error(e.getMessage(), e);
          }
          System.exit(1);
        });
  }
}
