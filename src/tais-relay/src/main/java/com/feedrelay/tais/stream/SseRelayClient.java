package com.feedrelay.tais.stream;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * {@link RelayClient} backed by a Server-Sent Events emitter.
 *
 * <p>Envelopes go into a bounded queue that a sender task drains onto the emitter, one
 * {@code data:} frame per envelope. Producers never touch the emitter: a full queue rejects the
 * envelope and a failed write closes the client. Heartbeats take the same sender path.
 */
public class SseRelayClient implements RelayClient {
  private static final Logger log = LoggerFactory.getLogger(SseRelayClient.class);

  private final SseEmitter emitter;
  private final BlockingQueue<byte[]> outbound;
  private final Executor sender;
  private final AtomicBoolean draining = new AtomicBoolean(false);
  private final AtomicBoolean open = new AtomicBoolean(true);
  private final AtomicBoolean heartbeatPending = new AtomicBoolean(false);
  private final AtomicReference<Runnable> onClose = new AtomicReference<>();

  public SseRelayClient(SseEmitter emitter, int queueCapacity, Executor sender) {
    this.emitter = emitter;
    this.outbound = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
    this.sender = sender;
  }

  @Override
  public boolean enqueue(byte[] payload) {
    if (!open.get()) {
      return false;
    }
    if (!outbound.offer(payload)) {
      log.debug("SSE client queue full ({} pending), dropping envelope", outbound.size());
      return false;
    }
    scheduleDrain();
    return true;
  }

  @Override
  public boolean isOpen() {
    return open.get();
  }

  /**
   * Registers the release hook run once when the client closes; runs it at once if already closed.
   */
  public void onClose(Runnable callback) {
    onClose.set(callback);
    if (!open.get()) {
      runCloseCallback();
    }
  }

  /**
   * Requests an SSE comment line so idle connections survive proxies. The comment is written by
   * the sender once queued envelopes are out; the calling thread never touches the emitter.
   */
  public void heartbeat() {
    if (!open.get()) {
      return;
    }
    heartbeatPending.set(true);
    scheduleDrain();
  }

  /** Marks the client closed after the emitter completed, timed out or failed. */
  public void markClosed() {
    if (open.compareAndSet(true, false)) {
      outbound.clear();
      runCloseCallback();
    }
  }

  int pending() {
    return outbound.size();
  }

  private void scheduleDrain() {
    if (!draining.compareAndSet(false, true)) {
      return;
    }
    try {
      sender.execute(this::drain);
    } catch (RejectedExecutionException ex) {
      draining.set(false);
      log.debug("SSE sender rejected drain task, closing client: {}", ex.getMessage());
      markClosed();
    }
  }

  private void drain() {
    try {
      while (open.get()) {
        byte[] next = outbound.poll();
        if (next != null) {
          if (!send(SseEmitter.event().data(new String(next, StandardCharsets.UTF_8)), "envelope")) {
            return;
          }
        } else if (heartbeatPending.getAndSet(false)) {
          if (!send(SseEmitter.event().comment("keepalive"), "heartbeat")) {
            return;
          }
        } else {
          break;
        }
      }
    } finally {
      draining.set(false);
    }
    // Work that lost the race with the finally block above still needs a drain.
    if (open.get() && (!outbound.isEmpty() || heartbeatPending.get())) {
      scheduleDrain();
    }
  }

  private boolean send(SseEmitter.SseEventBuilder event, String what) {
    try {
      emitter.send(event);
      return true;
    } catch (Exception ex) {
      handleSendFailure(what, ex);
      return false;
    }
  }

  private void handleSendFailure(String what, Exception ex) {
    boolean expected = ClientDisconnects.isExpectedClientDisconnect(ex);
    markClosed();
    if (expected) {
      log.debug("SSE client disconnected during {} delivery: {}", what, ClientDisconnects.rootCauseSummary(ex));
      completeSilently();
      return;
    }
    log.warn("SSE {} delivery failed", what, ex);
    completeWithErrorSilently(ex);
  }

  private void runCloseCallback() {
    Runnable callback = onClose.getAndSet(null);
    if (callback != null) {
      callback.run();
    }
  }

  private void completeSilently() {
    try {
      emitter.complete();
    } catch (Exception ex) {
      log.trace("Emitter already closed: {}", ex.getMessage());
    }
  }

  private void completeWithErrorSilently(Exception error) {
    try {
      emitter.completeWithError(error);
    } catch (Exception ex) {
      log.trace("Emitter already closed: {}", ex.getMessage());
    }
  }
}
