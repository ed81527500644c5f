package org.folio.layoutxml.util.token;

import io.vertx.core.json.JsonObject;
import java.util.Map;
import org.junit.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class TokenTest {

  @Test
  public void start() {
    Token.StartElement token = Token.start("Button", Map.of("text", "OK"));
    assertThat(token.getKind(), is(Token.Kind.START));
    assertThat(token.getType(), is("Button"));
    assertThat(token.toJson(), is(new JsonObject()
        .put("kind", "start")
        .put("type", "Button")
        .put("attributes", new JsonObject().put("text", "OK"))));
    assertThat(token.toString(), is("Start(Button {text=OK})"));
  }

  @Test
  public void startWithoutAttributes() {
    Token.StartElement token = Token.start("a", null);
    assertThat(token.getAttributes(), is(anEmptyMap()));
    assertThat(token.toJson().encode(), is("{\"kind\":\"start\",\"type\":\"a\"}"));
    assertThat(token, is(Token.start("a", Map.of())));
    assertThat(token.hashCode(), is(Token.start("a", Map.of()).hashCode()));
    assertThat(token.toString(), is("Start(a)"));
  }

  @Test
  public void end() {
    Token.EndElement token = Token.end("a");
    assertThat(token.getKind(), is(Token.Kind.END));
    assertThat(token.toJson().encode(), is("{\"kind\":\"end\",\"type\":\"a\"}"));
    assertThat(token, is(Token.end("a")));
    assertThat(token, is(not((Token) Token.start("a", null))));
    assertThat(token.toString(), is("End(a)"));
  }

  @Test
  public void text() {
    Token.Text token = Token.text("hi");
    assertThat(token.getKind(), is(Token.Kind.TEXT));
    assertThat(token.getContent(), is("hi"));
    assertThat(token.toJson().encode(), is("{\"kind\":\"text\",\"content\":\"hi\"}"));
    assertThat(token, is(Token.text("hi")));
    assertThat(token.toString(), is("Text(hi)"));
  }
}
