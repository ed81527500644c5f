package org.folio.layoutxml.util.readstream;

import io.vertx.core.Handler;
import io.vertx.core.streams.ReadStream;

public class MappingReadStream<T,V> implements ReadStream<T>, Handler<V> {

  boolean emitting;

  long demand = Long.MAX_VALUE;

  boolean ended;

  boolean failed;

  boolean done;

  protected final ReadStream<V> stream;

  Handler<T> eventHandler;

  Handler<Void> endHandler;

  Handler<Throwable> exceptionHandler;

  Mapper<V, T> mapper;

  /**
   * Wrap a read stream with a stream capable of applying mapper to the stream's elements.
   * @param stream stream to wrap
   * @param mapper mapper to apply
   */
  public MappingReadStream(ReadStream<V> stream, Mapper<V, T> mapper) {
    this.stream = stream;
    this.mapper = mapper;
    stream.handler(this);
    stream.endHandler(v -> end());
    stream.exceptionHandler(e -> fail(sourceFailure(e)));
  }

  @Override
  public ReadStream<T> exceptionHandler(Handler<Throwable> handler) {
    exceptionHandler = handler;
    return this;
  }

  @Override
  public ReadStream<T> handler(Handler<T> handler) {
    eventHandler = handler;
    return this;
  }

  @Override
  public ReadStream<T> pause() {
    demand = 0L;
    return this;
  }

  @Override
  public ReadStream<T> resume() {
    return fetch(Long.MAX_VALUE);
  }

  @Override
  public ReadStream<T> fetch(long l) {
    demand += l;
    if (demand < 0L) {
      demand = Long.MAX_VALUE;
    }
    checkPending();
    return this;
  }

  @Override
  public ReadStream<T> endHandler(Handler<Void> handler) {
    if (!ended) {
      endHandler = handler;
    }
    return this;
  }

  void end() {
    if (ended) {
      throw new IllegalStateException("Parsing already done");
    }
    ended = true;
    checkPending();
  }

  @Override
  public void handle(V event) {
    if (failed) {
      return;
    }
    try {
      mapper.push(event);
    } catch (Exception e) {
      fail(e);
      return;
    }
    checkPending();
  }

  /**
   * Map a failure reported by the wrapped stream.
   * @param e failure of wrapped stream
   * @return failure to report to this stream's exception handler
   */
  protected Throwable sourceFailure(Throwable e) {
    return e;
  }

  /**
   * Called once when all elements have been emitted after the wrapped stream ended,
   * just before the end handler.
   */
  protected void completed() {
  }

  void fail(Throwable e) {
    if (failed) {
      return;
    }
    failed = true;
    stream.handler(null); // only interested in first error
    mapper.close();
    if (exceptionHandler != null) {
      exceptionHandler.handle(e);
    }
  }

  private void checkPending()  {
    if (emitting || failed || done) {
      return;
    }
    emitting = true;
    try {
      boolean drained = false;
      while (demand > 0L) {
        T t = mapper.poll(ended);
        if (t == null) {
          drained = true;
          break;
        }
        if (demand != Long.MAX_VALUE) {
          --demand;
        }
        if (eventHandler != null) {
          eventHandler.handle(t);
        }
      }
      if (ended && drained) {
        done = true;
        completed();
        Handler<Void> handler = endHandler;
        endHandler = null;
        if (handler != null) {
          handler.handle(null);
        }
      }
    } catch (Exception e) {
      fail(e);
    } finally {
      emitting = false;
    }
    // last: the wrapped stream may deliver on another thread once resumed
    if (!ended && !failed) {
      if (demand == 0L) {
        stream.pause();
      } else {
        stream.resume();
      }
    }
  }

}
