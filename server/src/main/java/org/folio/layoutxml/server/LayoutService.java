package org.folio.layoutxml.server;

import io.vertx.core.Future;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.layoutxml.util.Digest;
import org.folio.layoutxml.util.LayoutXmlException;
import org.folio.layoutxml.util.ParseResult;
import org.folio.layoutxml.util.readstream.LayoutTokenParser;
import org.folio.layoutxml.util.readstream.LayoutTreeParser;
import org.folio.layoutxml.util.token.Token;
import org.folio.layoutxml.util.token.TokenSink;

public class LayoutService {
  private static final Logger log = LogManager.getLogger(LayoutService.class);

  static final String JSON_TYPE = "application/json";
  static final String NDJSON_TYPE = "application/x-ndjson";
  static final String TEXT_TYPE = "text/plain";

  private final LayoutCache cache;

  public LayoutService(LayoutCache cache) {
    this.cache = cache;
  }

  /**
   * Create router with the layout routes.
   * @param router router to extend
   * @return same router
   */
  public Router mount(Router router) {
    router.post("/layouts/tokens").handler(ctx -> handle(ctx, this::postTokens));
    router.post("/layouts").handler(ctx -> handle(ctx, this::postLayout));
    router.get("/layouts/:digest").handler(ctx -> handle(ctx, this::getLayout));
    router.delete("/layouts/:digest").handler(ctx -> handle(ctx, this::deleteLayout));
    router.get("/admin/health").handler(ctx -> ctx.response()
        .putHeader("Content-Type", TEXT_TYPE).end("OK"));
    return router;
  }

  private static void handle(RoutingContext ctx, Function<RoutingContext, Future<Void>> fn) {
    Future<Void> future;
    try {
      future = fn.apply(ctx);
    } catch (Exception e) {
      future = Future.failedFuture(e);
    }
    future.onFailure(e -> failure(ctx, e));
  }

  static void failure(RoutingContext ctx, Throwable e) {
    HttpServerResponse response = ctx.response();
    if (response.headWritten()) {
      log.warn("Aborting response: {}", e.getMessage());
      response.reset();
      return;
    }
    int code = 500;
    if (e instanceof LayoutXmlException) {
      LayoutXmlException le = (LayoutXmlException) e;
      switch (le.getErrorType()) {
        case SYNTAX_ERROR:
        case FINALIZE_ERROR:
        case READ_FAILURE:
          code = 400;
          break;
        default:
          break;
      }
      log.warn("{} {}", le.getErrorType(), le.getMessage());
    } else if (e instanceof IllegalArgumentException) {
      code = 400;
    } else {
      log.error(e.getMessage(), e);
    }
    response.setStatusCode(code)
        .putHeader("Content-Type", TEXT_TYPE)
        .end(e.getMessage() == null ? e.getClass().getName() : e.getMessage());
  }

  static String etag(Digest digest) {
    return "\"" + digest.toHex() + "\"";
  }

  Future<Void> postLayout(RoutingContext ctx) {
    return LayoutTreeParser.parse(ctx.request())
        .compose(result -> {
          cache.put(result.getDigest(), result.getTree());
          log.info("Converted layout {}", result.getDigest());
          return ctx.response()
              .putHeader("Content-Type", JSON_TYPE)
              .putHeader("ETag", etag(result.getDigest()))
              .end(result.toJson().encode());
        });
  }

  Future<Void> postTokens(RoutingContext ctx) {
    HttpServerResponse response = ctx.response();
    response.setChunked(true);
    response.putHeader("Content-Type", NDJSON_TYPE);
    TokenSink sink = new TokenSink() {
      @Override
      public void onToken(Token token) {
        response.write(token.toJson().encode() + "\n");
      }

      @Override
      public void onComplete(Digest digest) {
        response.putTrailer("ETag", etag(digest));
        response.write(new JsonObject().put(ParseResult.DIGEST_LABEL, digest.toHex()).encode()
            + "\n");
      }
    };
    return LayoutTokenParser.parse(ctx.request(), sink)
        .compose(digest -> {
          log.info("Streamed tokens for layout {}", digest);
          return response.end();
        });
  }

  Future<Void> getLayout(RoutingContext ctx) {
    Digest digest = Digest.fromHex(ctx.pathParam("digest"));
    JsonObject layout = cache.get(digest);
    if (layout == null) {
      ctx.response().setStatusCode(404)
          .putHeader("Content-Type", TEXT_TYPE)
          .end("Layout " + digest + " not found");
      return Future.succeededFuture();
    }
    return ctx.response()
        .putHeader("Content-Type", JSON_TYPE)
        .putHeader("ETag", etag(digest))
        .end(new ParseResult(layout, digest).toJson().encode());
  }

  Future<Void> deleteLayout(RoutingContext ctx) {
    Digest digest = Digest.fromHex(ctx.pathParam("digest"));
    if (!cache.invalidate(digest)) {
      ctx.response().setStatusCode(404)
          .putHeader("Content-Type", TEXT_TYPE)
          .end("Layout " + digest + " not found");
      return Future.succeededFuture();
    }
    ctx.response().setStatusCode(204).end();
    return Future.succeededFuture();
  }
}
