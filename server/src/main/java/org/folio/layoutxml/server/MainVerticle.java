package org.folio.layoutxml.server;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.ext.web.Router;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.layoutxml.util.Config;

public class MainVerticle extends AbstractVerticle {
  final Logger log = LogManager.getLogger(MainVerticle.class);

  static final String PORT_KEY = "port";
  static final String CACHE_SIZE_KEY = "cache.size";

  @Override
  public void start(Promise<Void> promise) {
    final int port = Config.getSysConfInteger(PORT_KEY, 8081, config());
    final int cacheSize = Config.getSysConfInteger(CACHE_SIZE_KEY, 100, config());
    log.info("Listening on port {}, layout cache size {}", port, cacheSize);

    LayoutService layoutService = new LayoutService(new LayoutCache(cacheSize));
    Router router = layoutService.mount(Router.router(vertx));

    HttpServerOptions so = new HttpServerOptions()
        .setCompressionSupported(true)
        .setDecompressionSupported(true)
        .setHandle100ContinueAutomatically(true);
    vertx.createHttpServer(so)
        .requestHandler(router)
        .listen(port)
        .<Void>mapEmpty()
        .onComplete(promise);
  }
}
