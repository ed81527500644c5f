package org.folio.layoutxml.util.readstream;

import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.unit.Async;
import io.vertx.ext.unit.TestContext;
import io.vertx.ext.unit.junit.VertxUnitRunner;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

@RunWith(VertxUnitRunner.class)
public class MappingReadStreamTest {
  Vertx vertx;

  @Before
  public void before() {
    vertx = Vertx.vertx();
  }

  @After
  public void after(TestContext context) {
    vertx.close().onComplete(context.asyncAssertSuccess());
  }

  /** Emits each byte of the input as a one-character string; fails on '!'. */
  static class CharMapper implements Mapper<Buffer, String> {
    final Deque<String> pending = new ArrayDeque<>();
    boolean closed;

    @Override
    public void push(Buffer buffer) {
      for (byte b : buffer.getBytes()) {
        if (b == '!') {
          throw new IllegalArgumentException("bang");
        }
        pending.add(String.valueOf((char) b));
      }
    }

    @Override
    public String poll(boolean ended) {
      return pending.poll();
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  @Test
  public void all(TestContext context) {
    List<String> items = new ArrayList<>();
    CharMapper mapper = new CharMapper();
    MappingReadStream<String, Buffer> stream =
        new MappingReadStream<>(new ChunkReadStream(vertx, "abcde", 2), mapper);
    stream.handler(items::add);
    stream.exceptionHandler(context::fail);
    Async async = context.async();
    stream.endHandler(x -> {
      assertThat(items, contains("a", "b", "c", "d", "e"));
      assertThat(mapper.closed, is(false));
      async.complete();
    });
    stream.resume();
  }

  @Test
  public void endWaitsForDemand(TestContext context) {
    List<String> items = new ArrayList<>();
    ChunkReadStream source = new ChunkReadStream(vertx, "abc", 10);
    MappingReadStream<String, Buffer> stream = new MappingReadStream<>(source, new CharMapper());
    Promise<Void> promise = Promise.promise();
    stream.handler(items::add);
    stream.exceptionHandler(promise::tryFail);
    stream.endHandler(x -> promise.tryComplete());
    source.context.runOnContext(v -> {
      stream.pause();
      stream.fetch(1);
      vertx.setTimer(50, x -> {
        assertThat(items, contains("a"));
        assertThat(source.pauseCount > 0, is(true));
        assertThat(promise.future().isComplete(), is(false));
        stream.fetch(5);
      });
    });
    promise.future().onComplete(context.asyncAssertSuccess(x ->
        assertThat(items, hasSize(3))));
  }

  @Test
  public void mapperFailure(TestContext context) {
    List<String> items = new ArrayList<>();
    CharMapper mapper = new CharMapper();
    MappingReadStream<String, Buffer> stream =
        new MappingReadStream<>(new ChunkReadStream(vertx, "ab!cd", 2), mapper);
    stream.handler(items::add);
    stream.endHandler(x -> context.fail("ended"));
    Async async = context.async();
    stream.exceptionHandler(e -> {
      assertThat(e.getMessage(), is("bang"));
      assertThat(mapper.closed, is(true));
      assertThat(items, contains("a", "b"));
      async.complete();
    });
    stream.resume();
  }

  @Test
  public void sourceFailure(TestContext context) {
    List<String> items = new ArrayList<>();
    IllegalStateException failure = new IllegalStateException("source");
    MappingReadStream<String, Buffer> stream = new MappingReadStream<>(
        new ChunkReadStream(vertx, new byte[0], 1, failure), new CharMapper());
    stream.handler(items::add);
    Async async = context.async();
    stream.exceptionHandler(e -> {
      assertThat(e, is(failure));
      assertThat(items, is(empty()));
      async.complete();
    });
    stream.resume();
  }
}
