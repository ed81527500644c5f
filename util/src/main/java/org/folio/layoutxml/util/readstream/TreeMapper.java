package org.folio.layoutxml.util.readstream;

import io.vertx.core.buffer.Buffer;
import org.folio.layoutxml.util.Digest;
import org.folio.layoutxml.util.LayoutXmlFeeder;
import org.folio.layoutxml.util.ParseResult;
import org.folio.layoutxml.util.TreeBuilder;

/**
 * Maps raw XML buffers to one layout tree, produced when input ends.
 */
public class TreeMapper implements Mapper<Buffer, ParseResult> {

  private final TreeBuilder treeBuilder = new TreeBuilder();

  private final LayoutXmlFeeder feeder = new LayoutXmlFeeder(treeBuilder);

  private boolean finished;

  @Override
  public void push(Buffer buffer) {
    try {
      feeder.feed(buffer.getBytes());
    } catch (RuntimeException e) {
      close();
      throw e;
    }
  }

  @Override
  public ParseResult poll(boolean ended) {
    if (!ended || finished) {
      return null;
    }
    finished = true;
    try {
      Digest digest = feeder.end();
      return new ParseResult(treeBuilder.result(), digest);
    } finally {
      close();
    }
  }

  @Override
  public void close() {
    feeder.close();
  }
}
