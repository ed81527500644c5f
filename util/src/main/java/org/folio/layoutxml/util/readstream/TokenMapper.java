package org.folio.layoutxml.util.readstream;

import io.vertx.core.buffer.Buffer;
import java.util.ArrayDeque;
import java.util.Deque;
import org.folio.layoutxml.util.Digest;
import org.folio.layoutxml.util.LayoutXmlFeeder;
import org.folio.layoutxml.util.TokenEmitter;
import org.folio.layoutxml.util.token.Token;

/**
 * Maps raw XML buffers to layout tokens, computing the digest as buffers pass by.
 */
public class TokenMapper implements Mapper<Buffer, Token> {

  private final Deque<Token> tokens = new ArrayDeque<>();

  private final LayoutXmlFeeder feeder = new LayoutXmlFeeder(new TokenEmitter(tokens::add));

  private Digest digest;

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
  public Token poll(boolean ended) {
    if (tokens.isEmpty() && ended && !finished) {
      finished = true;
      try {
        digest = feeder.end();
      } finally {
        close();
      }
    }
    return tokens.poll();
  }

  /**
   * Digest of all buffers.
   * @return digest; null until input has ended and parsed successfully
   */
  public Digest getDigest() {
    return digest;
  }

  @Override
  public void close() {
    feeder.close();
  }
}
