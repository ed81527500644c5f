package org.folio.layoutxml.util.token;

import io.vertx.core.json.JsonObject;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.folio.layoutxml.util.Digest;
import org.folio.layoutxml.util.LayoutXmlException;
import org.folio.layoutxml.util.LayoutXmlException.ErrorType;
import org.folio.layoutxml.util.LayoutXmlParser;
import org.folio.layoutxml.util.ParseResult;
import org.junit.Assert;
import org.junit.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class TokenTreeCollectorTest {

  static final String LAYOUT = "<LinearLayout orientation=\"vertical\">\n"
      + "  <TextView text=\"a\">label</TextView>\n"
      + "  <FrameLayout><View/></FrameLayout>\n"
      + "</LinearLayout>\n";

  @Test
  public void sameAsTree() {
    byte[] xml = LAYOUT.getBytes(StandardCharsets.UTF_8);
    LayoutXmlParser parser = new LayoutXmlParser(5);
    ParseResult expected = parser.parseTree(new ByteArrayInputStream(xml));

    TokenTreeCollector collector = new TokenTreeCollector();
    Digest digest = parser.parseTokens(new ByteArrayInputStream(xml), collector);
    assertThat(collector.getResult(), is(expected));
    assertThat(digest, is(expected.getDigest()));
  }

  @Test
  public void incomplete() {
    TokenTreeCollector collector = new TokenTreeCollector();
    collector.onToken(Token.start("a", null));
    collector.onToken(Token.text("x"));
    assertThat(collector.getResult(), is(nullValue()));
    Digest digest = Digest.of(new byte[Digest.LENGTH]);
    LayoutXmlException e = Assert.assertThrows(LayoutXmlException.class,
        () -> collector.onComplete(digest));
    assertThat(e.getErrorType(), is(ErrorType.FINALIZE_ERROR));
    assertThat(collector.getResult(), is(nullValue()));
  }

  @Test
  public void manual() {
    TokenTreeCollector collector = new TokenTreeCollector();
    collector.onToken(Token.start("a", null));
    collector.onToken(Token.start("b", null));
    collector.onToken(Token.end("b"));
    collector.onToken(Token.end("a"));
    Digest digest = Digest.of(new byte[Digest.LENGTH]);
    collector.onComplete(digest);
    assertThat(collector.getResult().getTree(),
        is(new JsonObject("{\"type\":\"a\",\"children\":[{\"type\":\"b\"}]}")));
    assertThat(collector.getResult().getDigest(), is(digest));
  }

  @Test
  public void secondRoot() {
    TokenTreeCollector collector = new TokenTreeCollector();
    collector.onToken(Token.start("a", null));
    collector.onToken(Token.end("a"));
    LayoutXmlException e = Assert.assertThrows(LayoutXmlException.class,
        () -> collector.onToken(Token.start("b", null)));
    assertThat(e.getErrorType(), is(ErrorType.SYNTAX_ERROR));
  }
}
