package io.github.themoah.hoverlog.analyzer;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request-scoped cancellation signal shared by the analyzer and the storage calls it makes.
 * Cancelled either explicitly (client went away) or by a deadline timer.
 */
public final class CancellationToken {

  private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

  private final Promise<Void> cancellation = Promise.promise();
  private Vertx vertx;
  private Long timerId;

  private CancellationToken() {}

  /**
   * Creates a token that is only cancelled explicitly.
   */
  public static CancellationToken create() {
    return new CancellationToken();
  }

  /**
   * Creates a token that cancels itself once the deadline elapses.
   *
   * @param vertx the Vert.x instance owning the timer
   * @param timeoutMs deadline in milliseconds from now
   * @return the token
   */
  public static CancellationToken withDeadline(Vertx vertx, long timeoutMs) {
    CancellationToken token = new CancellationToken();
    token.vertx = vertx;
    token.timerId = vertx.setTimer(timeoutMs, id -> {
      if (token.cancel("deadline of " + timeoutMs + "ms exceeded")) {
        log.warn("Analysis deadline of {}ms exceeded", timeoutMs);
      }
    });
    return token;
  }

  /**
   * Cancels the token.
   *
   * @param reason human readable reason
   * @return true if this call cancelled the token, false if it was already cancelled
   */
  public boolean cancel(String reason) {
    return cancellation.tryFail(new AnalysisCancelledException("Analysis cancelled: " + reason));
  }

  public boolean isCancelled() {
    return cancellation.future().failed();
  }

  /**
   * Returns the cancellation error, or null if the token is still active.
   */
  public AnalysisCancelledException cause() {
    return isCancelled() ? (AnalysisCancelledException) cancellation.future().cause() : null;
  }

  /**
   * Starts an operation unless the token is already cancelled, and fails the returned
   * future as soon as the token is cancelled, whichever comes first.
   *
   * @param operation supplier of the asynchronous operation
   * @return future completing with the operation's outcome or the cancellation error
   */
  public <T> Future<T> guard(Supplier<Future<T>> operation) {
    if (isCancelled()) {
      return Future.failedFuture(cause());
    }
    Promise<T> guarded = Promise.promise();
    cancellation.future().onFailure(guarded::tryFail);
    Future<T> started;
    try {
      started = operation.get();
    } catch (RuntimeException e) {
      guarded.tryFail(e);
      return guarded.future();
    }
    started.onComplete(ar -> {
      if (ar.succeeded()) {
        guarded.tryComplete(ar.result());
      } else {
        guarded.tryFail(ar.cause());
      }
    });
    return guarded.future();
  }

  /**
   * Releases the deadline timer. Safe to call more than once.
   */
  public void release() {
    if (vertx != null && timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
  }
}
