package org.folio.layoutxml.client;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;
import io.vertx.core.json.JsonObject;
import java.io.PrintStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.layoutxml.util.Config;
import org.folio.layoutxml.util.ContentHasher;
import org.folio.layoutxml.util.Digest;
import org.folio.layoutxml.util.LayoutXmlException;
import org.folio.layoutxml.util.LayoutXmlException.ErrorType;
import org.folio.layoutxml.util.LayoutXmlParser;
import org.folio.layoutxml.util.ParseResult;
import org.folio.layoutxml.util.readstream.LayoutTokenParser;
import org.folio.layoutxml.util.readstream.LayoutTreeParser;
import org.folio.layoutxml.util.token.Token;
import org.folio.layoutxml.util.token.TokenSink;

@java.lang.SuppressWarnings({"squid:S106"})
public class Client {
  static final Logger log = LogManager.getLogger(Client.class);

  static final String CHUNK_SIZE_KEY = "chunk.size";

  int chunkSize;
  boolean tokens;
  boolean digestOnly;
  boolean compact;
  final Vertx vertx;
  PrintStream out = System.out;

  /**
   * Construct client.
   * @param vertx Vert.x handle used for file access
   */
  public Client(Vertx vertx) {
    this.vertx = vertx;
    chunkSize = Config.getSysConfInteger(CHUNK_SIZE_KEY,
        LayoutXmlParser.DEFAULT_CHUNK_SIZE, null);
  }

  /**
   * Set number of bytes read from file at a time.
   * @param chunkSize positive read size
   */
  public void setChunkSize(int chunkSize) {
    if (chunkSize <= 0) {
      throw new ClientException("chunk must be positive: " + chunkSize);
    }
    this.chunkSize = chunkSize;
  }

  public void setTokens() {
    this.tokens = true;
  }

  public void setDigestOnly() {
    this.digestOnly = true;
  }

  public void setCompact() {
    this.compact = true;
  }

  void setOut(PrintStream out) {
    this.out = out;
  }

  Future<AsyncFile> open(String fname) {
    return vertx.fileSystem().open(fname, new OpenOptions().setRead(true).setWrite(false))
        .map(file -> file.setReadBufferSize(chunkSize))
        .recover(e -> Future.failedFuture(new LayoutXmlException(ErrorType.SOURCE_UNAVAILABLE,
            "Cannot open " + fname + ": " + e.getMessage(), e)));
  }

  private String encode(JsonObject json) {
    return compact ? json.encode() : json.encodePrettily();
  }

  Future<Void> convertTree(AsyncFile file) {
    return LayoutTreeParser.parse(file)
        .onSuccess(result -> out.println(encode(result.toJson())))
        .mapEmpty();
  }

  Future<Void> convertTokens(AsyncFile file) {
    TokenSink sink = new TokenSink() {
      @Override
      public void onToken(Token token) {
        out.println(token.toJson().encode());
      }

      @Override
      public void onComplete(Digest digest) {
        out.println(new JsonObject().put(ParseResult.DIGEST_LABEL, digest.toHex()).encode());
      }
    };
    return LayoutTokenParser.parse(file, sink).mapEmpty();
  }

  Future<Void> digestFile(AsyncFile file) {
    ContentHasher hasher = new ContentHasher();
    Promise<Void> promise = Promise.promise();
    file.handler(buffer -> hasher.update(buffer.getBytes()));
    file.exceptionHandler(e -> promise.tryFail(
        new LayoutXmlException(ErrorType.READ_FAILURE, e.getMessage(), e)));
    file.endHandler(x -> {
      out.println(hasher.digest().toHex());
      promise.tryComplete();
    });
    return promise.future();
  }

  /**
   * Convert file and write result to output.
   * @param fname filename of XML layout
   * @return async result; fails with {@link LayoutXmlException} if file is unusable
   */
  public Future<Void> convertFile(String fname) {
    return open(fname).compose(file -> {
      Future<Void> future;
      if (digestOnly) {
        future = digestFile(file);
      } else if (tokens) {
        future = convertTokens(file);
      } else {
        future = convertTree(file);
      }
      return future.eventually(x -> file.close());
    });
  }

  private static String getArgument(String [] args, int i) {
    if (i >= args.length) {
      throw new ClientException("Missing argument for option '" + args[i - 1] + "'");
    }
    return args[i];
  }

  /** Execute command line layout client.
   *
   * @param vertx Vertx handle
   * @param args command line args
   * @return async result
   */
  public static Future<Void> exec(Vertx vertx, String[] args) {
    return exec(new Client(vertx), args);
  }

  static Future<Void> exec(Client client, String[] args) {
    try {
      Future<Void> future = Future.succeededFuture();
      int i = 0;
      while (i < args.length) {
        String arg;
        if (args[i].startsWith("--")) {
          switch (args[i].substring(2)) {
            case "help":
              client.out.println("[options] [file..]");
              client.out.println(" --chunk sz          (defaults to "
                  + LayoutXmlParser.DEFAULT_CHUNK_SIZE + ")");
              client.out.println(" --tokens            (output token stream)");
              client.out.println(" --digest            (output digest only)");
              client.out.println(" --compact           (no pretty printing)");
              break;
            case "chunk":
              arg = getArgument(args, ++i);
              try {
                client.setChunkSize(Integer.parseInt(arg));
              } catch (NumberFormatException e) {
                throw new ClientException("Bad value for '--chunk': " + arg);
              }
              break;
            case "tokens":
              client.setTokens();
              break;
            case "digest":
              client.setDigestOnly();
              break;
            case "compact":
              client.setCompact();
              break;
            default:
              throw new ClientException("Unsupported option: '" + args[i] + "'");
          }
        } else {
          arg = args[i];
          log.debug("Converting {} chunk {}", arg, client.chunkSize);
          future = future.compose(x -> client.convertFile(arg));
        }
        i++;
      }
      return future;
    } catch (Exception e) {
      return Future.failedFuture(e);
    }
  }
}
