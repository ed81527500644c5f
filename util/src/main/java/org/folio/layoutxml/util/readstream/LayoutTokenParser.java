package org.folio.layoutxml.util.readstream;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.streams.ReadStream;
import org.folio.layoutxml.util.Digest;
import org.folio.layoutxml.util.LayoutXmlException;
import org.folio.layoutxml.util.LayoutXmlException.ErrorType;
import org.folio.layoutxml.util.token.Token;
import org.folio.layoutxml.util.token.TokenSink;

/**
 * Streaming layout parser ala JsonParser.
 *
 * <p>Reads raw XML from a stream and emits layout tokens. The digest of the input is
 * delivered to the completion handler once all tokens are emitted; it is never
 * delivered if the input fails to parse.
 *
 * @see <a href="https://vertx.io/docs/apidocs/io/vertx/core/parsetools/JsonParser.html">JsonParser</a>
 */
public class LayoutTokenParser extends MappingReadStream<Token, Buffer> {

  private final TokenMapper tokenMapper;

  private Handler<Digest> completionHandler;

  private LayoutTokenParser(ReadStream<Buffer> stream, TokenMapper tokenMapper) {
    super(stream, tokenMapper);
    this.tokenMapper = tokenMapper;
  }

  public static LayoutTokenParser newParser(ReadStream<Buffer> stream) {
    return new LayoutTokenParser(stream, new TokenMapper());
  }

  /**
   * Parse stream, delivering tokens to sink.
   * @param stream raw XML
   * @param sink token receiver
   * @return digest, or failure with {@link LayoutXmlException} (or the sink's exception)
   */
  public static Future<Digest> parse(ReadStream<Buffer> stream, TokenSink sink) {
    Promise<Digest> promise = Promise.promise();
    LayoutTokenParser parser = newParser(stream);
    parser.handler(sink::onToken);
    parser.completionHandler(digest -> {
      sink.onComplete(digest);
      promise.tryComplete(digest);
    });
    parser.exceptionHandler(promise::tryFail);
    parser.resume();
    return promise.future();
  }

  /**
   * Set handler for the digest, called once after the last token and before the end handler.
   * @param handler digest handler
   * @return this
   */
  public LayoutTokenParser completionHandler(Handler<Digest> handler) {
    completionHandler = handler;
    return this;
  }

  /**
   * Digest of input.
   * @return digest; null until all input has been parsed
   */
  public Digest getDigest() {
    return tokenMapper.getDigest();
  }

  @Override
  protected void completed() {
    if (completionHandler != null) {
      completionHandler.handle(tokenMapper.getDigest());
    }
  }

  @Override
  protected Throwable sourceFailure(Throwable e) {
    return new LayoutXmlException(ErrorType.READ_FAILURE, e.getMessage(), e);
  }
}
