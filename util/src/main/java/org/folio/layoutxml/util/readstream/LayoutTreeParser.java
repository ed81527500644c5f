package org.folio.layoutxml.util.readstream;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.streams.ReadStream;
import org.folio.layoutxml.util.LayoutXmlException;
import org.folio.layoutxml.util.LayoutXmlException.ErrorType;
import org.folio.layoutxml.util.ParseResult;

/**
 * Stream of exactly one layout tree, emitted when the raw XML stream ends.
 */
public class LayoutTreeParser extends MappingReadStream<ParseResult, Buffer> {

  private LayoutTreeParser(ReadStream<Buffer> stream) {
    super(stream, new TreeMapper());
  }

  public static LayoutTreeParser newParser(ReadStream<Buffer> stream) {
    return new LayoutTreeParser(stream);
  }

  /**
   * Parse stream to tree.
   * @param stream raw XML
   * @return tree and digest, or failure with {@link LayoutXmlException}
   */
  public static Future<ParseResult> parse(ReadStream<Buffer> stream) {
    Promise<ParseResult> promise = Promise.promise();
    LayoutTreeParser parser = newParser(stream);
    parser.handler(promise::tryComplete);
    parser.exceptionHandler(promise::tryFail);
    parser.resume();
    return promise.future();
  }

  @Override
  protected Throwable sourceFailure(Throwable e) {
    return new LayoutXmlException(ErrorType.READ_FAILURE, e.getMessage(), e);
  }
}
