package com.feedrelay.tais.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.feedrelay.tais.MutableClock;
import com.feedrelay.tais.config.TaisProperties;
import com.feedrelay.tais.query.TrackQueryService;
import com.feedrelay.tais.state.TrackStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

class SseStreamServiceTest {
  private static final Executor DIRECT = Runnable::run;

  private ClientRegistry registry;
  private SubscriptionService subscriptionService;

  @BeforeEach
  void setUp() {
    MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    registry = new ClientRegistry();
    subscriptionService = new SubscriptionService(
        registry,
        new TrackQueryService(new TrackStore(clock), clock),
        new StreamEnvelopeWriter(new ObjectMapper()),
        new SimpleMeterRegistry());
  }

  @Test
  void openStream_subscribesAndSendsSnapshotFirst() {
    ScriptedEmitter emitter = ScriptedEmitter.healthy();
    TestSseStreamService service = new TestSseStreamService(subscriptionService, emitter, DIRECT);

    SseEmitter opened = service.openStream("N90");

    assertSame(emitter, opened);
    assertTrue(registry.hasClients("N90"));
    assertEquals(1, service.openClients());
    assertEquals("data:{\"type\":\"snapshot\",\"payload\":[]}\n\n", emitter.frames.get(0));
  }

  @Test
  void openStream_expectedDisconnectUnsubscribes() {
    ScriptedEmitter emitter = ScriptedEmitter.failOnSend(1, new IOException("Broken pipe"));
    TestSseStreamService service = new TestSseStreamService(subscriptionService, emitter, DIRECT);

    service.openStream("N90");

    assertTrue(emitter.completeCalled);
    assertFalse(emitter.completeWithErrorCalled);
    assertFalse(registry.hasClients("N90"));
    assertEquals(0, service.openClients());
  }

  @Test
  void heartbeat_isDeliveredBySenderPool() {
    ScriptedEmitter emitter = ScriptedEmitter.healthy();
    ManualExecutor sender = new ManualExecutor();
    TestSseStreamService service = new TestSseStreamService(subscriptionService, emitter, sender);
    service.openStream("N90");
    sender.runAll();

    service.heartbeat();
    assertEquals(1, emitter.sendCalls);

    sender.runAll();
    assertEquals(2, emitter.sendCalls);
    assertEquals(":keepalive\n\n", emitter.frames.get(1));
  }

  @Test
  void heartbeat_stuckClientDoesNotBlockCaller() throws Exception {
    CountDownLatch sendStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    StuckEmitter emitter = new StuckEmitter(sendStarted, release);
    ExecutorService sender = Executors.newCachedThreadPool();
    try {
      TestSseStreamService service = new TestSseStreamService(subscriptionService, emitter, sender);
      service.openStream("N90");
      assertTrue(sendStarted.await(2, TimeUnit.SECONDS));

      assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
        service.heartbeat();
        service.heartbeat();
      });
      assertEquals(1, emitter.sendCalls.get());
    } finally {
      release.countDown();
      sender.shutdownNow();
    }
  }

  private static final class TestSseStreamService extends SseStreamService {
    private final SseEmitter emitter;

    private TestSseStreamService(
        SubscriptionService subscriptionService, SseEmitter emitter, Executor sender) {
      super(subscriptionService, new TaisProperties(), sender);
      this.emitter = emitter;
    }

    @Override
    SseEmitter createEmitter() {
      return emitter;
    }
  }

  // Emitter whose socket write hangs until released.
  private static final class StuckEmitter extends SseEmitter {
    private final CountDownLatch sendStarted;
    private final CountDownLatch release;
    private final AtomicInteger sendCalls = new AtomicInteger();

    private StuckEmitter(CountDownLatch sendStarted, CountDownLatch release) {
      super(0L);
      this.sendStarted = sendStarted;
      this.release = release;
    }

    @Override
    public void send(SseEventBuilder builder) throws IOException {
      sendCalls.incrementAndGet();
      sendStarted.countDown();
      try {
        release.await();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new IOException("interrupted", ex);
      }
    }
  }
}
