package org.folio.layoutxml.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.layoutxml.util.LayoutXmlException.ErrorType;
import org.folio.layoutxml.util.token.TokenSink;

/**
 * Blocking layout parser: reads input in bounded chunks, hashing each chunk before
 * it is parsed.
 *
 * <p>Produces either a JSON tree ({@link #parseTree(InputStream)}) or a token stream
 * ({@link #parseTokens(InputStream, TokenSink)}). Every failure aborts the parse with a
 * {@link LayoutXmlException}; no partial result is returned. Instances hold no parse
 * state and may be shared between threads.
 */
public class LayoutXmlParser {
  private static final Logger log = LogManager.getLogger(LayoutXmlParser.class);

  public static final int DEFAULT_CHUNK_SIZE = 4096;

  private final int chunkSize;

  public LayoutXmlParser() {
    this(DEFAULT_CHUNK_SIZE);
  }

  /**
   * Create parser with given read size.
   * @param chunkSize maximum number of bytes per read
   */
  public LayoutXmlParser(int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    this.chunkSize = chunkSize;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  /**
   * Parse stream to tree.
   * @param stream XML source; not closed
   * @return tree and digest
   * @throws LayoutXmlException on any failure
   */
  public ParseResult parseTree(InputStream stream) {
    TreeBuilder treeBuilder = new TreeBuilder();
    Digest digest = run(stream, treeBuilder);
    return new ParseResult(treeBuilder.result(), digest);
  }

  /**
   * Parse in-memory document to tree; the buffer is one final chunk.
   * @param xml XML bytes
   * @return tree and digest
   * @throws LayoutXmlException on any failure
   */
  public ParseResult parseTree(byte[] xml) {
    TreeBuilder treeBuilder = new TreeBuilder();
    Digest digest = run(xml, treeBuilder);
    return new ParseResult(treeBuilder.result(), digest);
  }

  /**
   * Parse file to tree.
   * @param path XML file
   * @return tree and digest
   * @throws LayoutXmlException SOURCE_UNAVAILABLE if file cannot be opened; others on parse
   */
  public ParseResult parseTree(Path path) {
    try (InputStream stream = open(path)) {
      return parseTree(stream);
    } catch (IOException e) {
      throw new LayoutXmlException(ErrorType.READ_FAILURE, e.getMessage(), e);
    }
  }

  /**
   * Parse stream to tokens.
   * @param stream XML source; not closed
   * @param sink receives tokens, then the digest on success
   * @return digest
   * @throws LayoutXmlException on any failure; sink.onComplete is not called then
   */
  public Digest parseTokens(InputStream stream, TokenSink sink) {
    Digest digest = run(stream, new TokenEmitter(sink::onToken));
    sink.onComplete(digest);
    return digest;
  }

  /**
   * Parse in-memory document to tokens.
   * @param xml XML bytes
   * @param sink receives tokens, then the digest on success
   * @return digest
   * @throws LayoutXmlException on any failure; sink.onComplete is not called then
   */
  public Digest parseTokens(byte[] xml, TokenSink sink) {
    Digest digest = run(xml, new TokenEmitter(sink::onToken));
    sink.onComplete(digest);
    return digest;
  }

  /**
   * Convert stream to pretty-printed JSON tree.
   * @param stream XML source; not closed
   * @return JSON text; null if the input could not be converted
   */
  public String convertToJson(InputStream stream) {
    try {
      return parseTree(stream).getTree().encodePrettily();
    } catch (LayoutXmlException e) {
      log.warn("{} {}", e.getErrorType(), e.getMessage());
      return null;
    }
  }

  /**
   * Digest of stream without parsing it.
   * @param stream source; not closed
   * @return SHA-256 of all bytes
   * @throws LayoutXmlException READ_FAILURE if stream fails
   */
  public Digest digest(InputStream stream) {
    requireSource(stream);
    ContentHasher hasher = new ContentHasher();
    byte[] buf = allocate();
    try {
      int n;
      while ((n = stream.read(buf)) != -1) {
        hasher.update(buf, 0, n);
      }
    } catch (IOException e) {
      throw new LayoutXmlException(ErrorType.READ_FAILURE, e.getMessage(), e);
    }
    return hasher.digest();
  }

  Digest run(InputStream stream, LayoutEventHandler handler) {
    requireSource(stream);
    byte[] buf = allocate();
    try (LayoutXmlFeeder feeder = new LayoutXmlFeeder(handler)) {
      int n;
      while ((n = read(stream, buf)) != -1) {
        feeder.feed(buf, 0, n);
      }
      return feeder.end();
    }
  }

  static Digest run(byte[] xml, LayoutEventHandler handler) {
    if (xml == null) {
      throw new LayoutXmlException(ErrorType.SOURCE_UNAVAILABLE, "No input");
    }
    try (LayoutXmlFeeder feeder = new LayoutXmlFeeder(handler)) {
      feeder.feed(xml);
      return feeder.end();
    }
  }

  private static int read(InputStream stream, byte[] buf) {
    try {
      return stream.read(buf);
    } catch (IOException e) {
      throw new LayoutXmlException(ErrorType.READ_FAILURE, e.getMessage(), e);
    }
  }

  private static void requireSource(InputStream stream) {
    if (stream == null) {
      throw new LayoutXmlException(ErrorType.SOURCE_UNAVAILABLE, "No input stream");
    }
  }

  private static InputStream open(Path path) {
    try {
      return Files.newInputStream(path);
    } catch (IOException e) {
      throw new LayoutXmlException(ErrorType.SOURCE_UNAVAILABLE,
          "Cannot open " + path + ": " + e.getMessage(), e);
    }
  }

  @SuppressWarnings({"squid:S1181"}) // Throwable and Error should not be caught
  private byte[] allocate() {
    try {
      return new byte[chunkSize];
    } catch (OutOfMemoryError e) {
      throw new LayoutXmlException(ErrorType.ALLOCATION_FAILURE,
          "Cannot allocate read buffer of " + chunkSize + " bytes", e);
    }
  }
}
