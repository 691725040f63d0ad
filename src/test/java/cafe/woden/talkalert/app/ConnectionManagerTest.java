package cafe.woden.talkalert.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import cafe.woden.talkalert.config.TalkAlertProperties;
import cafe.woden.talkalert.gateway.ChatGatewayClient;
import cafe.woden.talkalert.gateway.GatewayException;
import cafe.woden.talkalert.gateway.GatewayListener;
import cafe.woden.talkalert.gateway.GatewaySession;
import cafe.woden.talkalert.gateway.InboundMessage;
import cafe.woden.talkalert.model.Settings;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectionManagerTest {

  private final SettingsBus settings = new SettingsBus();
  private final QueuedEventMarshal marshal = new QueuedEventMarshal();
  private final NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);
  private final FakeGateway gateway = new FakeGateway();
  private final ExecutorService lifecycle = Executors.newSingleThreadExecutor();
  private final List<ConnectionStatus> seen = new CopyOnWriteArrayList<>();

  private ConnectionManager manager;

  @BeforeEach
  void setUp() {
    TalkAlertProperties props =
        new TalkAlertProperties(
            "",
            new TalkAlertProperties.Connection(Duration.ofMillis(200), Duration.ZERO, null),
            null,
            null);
    manager = new ConnectionManager(gateway, settings, dispatcher, marshal, props, lifecycle);
    manager.statuses().subscribe(seen::add);
    settings.set(Settings.defaults().withAuthToken("token-aaaaaaaaaaaaaaaaaaaa"));
  }

  @AfterEach
  void tearDown() {
    manager.stop();
    lifecycle.shutdownNow();
  }

  @Test
  void startTwiceOpensOneSession() throws Exception {
    manager.start();
    manager.start();
    gateway.awaitWorkerWaiting(1);

    assertEquals(1, gateway.opens.get());
    awaitStatus(s -> s.state() == ConnectionState.CONNECTING);
  }

  @Test
  void startAsyncOpensSessionOnLifecycleExecutor() throws Exception {
    manager.startAsync().get(5, TimeUnit.SECONDS);
    gateway.awaitWorkerWaiting(1);

    assertEquals(1, gateway.opens.get());
    assertTrue(manager.isWorkerAlive());
  }

  @Test
  void statusesObservedOnMarshalSchedulerArriveWhenDrained() {
    List<ConnectionStatus> onControl = new CopyOnWriteArrayList<>();
    manager.statuses().observeOn(marshal.scheduler()).subscribe(onControl::add);
    assertTrue(onControl.isEmpty());

    marshal.drainPending();

    assertEquals(
        List.of(ConnectionState.OFFLINE),
        onControl.stream().map(ConnectionStatus::state).toList());
  }

  @Test
  void startWithoutTokenReportsNotConfigured() {
    settings.set(Settings.defaults());

    manager.start();
    marshal.drainPending();

    assertEquals(0, gateway.opens.get());
    assertFalse(manager.isWorkerAlive());
    assertTrue(manager.currentStatus().isNotConfigured());
  }

  @Test
  void readyReportsOnlineWithTag() throws Exception {
    manager.start();
    gateway.awaitWorkerWaiting(1);

    gateway.lastListener.onReady("bot-1", "Alerts#0001");

    ConnectionStatus s = awaitStatus(x -> x.state() == ConnectionState.ONLINE);
    assertEquals("Bot: online (Alerts#0001)", s.text());
  }

  @Test
  void restartFromOnlineGoesOfflineThenConnectingAgain() throws Exception {
    manager.start();
    gateway.awaitWorkerWaiting(1);
    gateway.lastListener.onReady("bot-1", "Alerts#0001");
    awaitStatus(s -> s.state() == ConnectionState.ONLINE);
    seen.clear();

    manager.restart();
    gateway.awaitWorkerWaiting(2);
    marshal.drainPending();

    assertEquals(
        List.of(ConnectionState.OFFLINE, ConnectionState.CONNECTING),
        seen.stream().map(ConnectionStatus::state).toList());
    assertEquals(1, gateway.sessions.get(0).closeCalls.get());
  }

  @Test
  void restartFromIdleStillReportsOfflineFirst() throws Exception {
    marshal.drainPending();
    seen.clear();

    manager.restart();
    gateway.awaitWorkerWaiting(1);
    marshal.drainPending();

    assertEquals(
        List.of(ConnectionState.OFFLINE, ConnectionState.CONNECTING),
        seen.stream().map(ConnectionStatus::state).toList());
  }

  @Test
  void stopForcesCloseWhenSessionIgnoresGracefulClose() throws Exception {
    gateway.ignoreClose = true;
    manager.start();
    gateway.awaitWorkerWaiting(1);

    manager.stop();
    marshal.drainPending();

    FakeSession s = gateway.sessions.get(0);
    assertEquals(1, s.closeCalls.get());
    assertTrue(s.forceCalls.get() >= 1);
    assertEquals(ConnectionState.OFFLINE, manager.currentStatus().state());
  }

  @Test
  void stopWithoutWorkerIsNoOp() {
    manager.stop();
    marshal.drainPending();

    assertEquals(ConnectionStatus.offline().text(), manager.currentStatus().text());
    assertEquals(0, gateway.opens.get());
  }

  @Test
  void readyFromStoppedWorkerIsDropped() throws Exception {
    manager.start();
    gateway.awaitWorkerWaiting(1);
    GatewayListener stale = gateway.lastListener;

    manager.stop();
    stale.onReady("bot-1", "Old#0001");
    marshal.drainPending();

    assertEquals(ConnectionState.OFFLINE, manager.currentStatus().state());
  }

  @Test
  void messagesFromSelfAndBotsAreNotDispatched() throws Exception {
    manager.start();
    gateway.awaitWorkerWaiting(1);
    GatewayListener l = gateway.lastListener;

    l.onMessage(new InboundMessage(FakeSession.SELF_ID, "me", false, "DM", "echo", ""));
    l.onMessage(new InboundMessage("42", "hook", true, "DM", "beep", ""));
    verify(dispatcher, never()).dispatch(any(InboundMessage.class));

    InboundMessage human = new InboundMessage("123", "Alice", false, "DM", "hi", "");
    l.onMessage(human);
    verify(dispatcher).dispatch(human);
  }

  @Test
  void loginFailureIsReported() throws Exception {
    gateway.failWith = new GatewayException("Login failed: the bot token was rejected");

    manager.start();

    ConnectionStatus s = awaitStatus(x -> x.text().startsWith("Bot: start failed"));
    assertEquals("Bot: start failed (Login failed: the bot token was rejected)", s.text());
  }

  @Test
  void stopUnconfiguredEndsOnNotConfigured() throws Exception {
    manager.start();
    gateway.awaitWorkerWaiting(1);

    manager.stopUnconfiguredAsync().get(5, TimeUnit.SECONDS);
    marshal.drainPending();

    assertTrue(manager.currentStatus().isNotConfigured());
    assertFalse(manager.isWorkerAlive());
  }

  private ConnectionStatus awaitStatus(Predicate<ConnectionStatus> p) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (System.nanoTime() < deadline) {
      marshal.drainPending();
      ConnectionStatus cur = manager.currentStatus();
      if (p.test(cur)) return cur;
      Thread.sleep(10);
    }
    throw new AssertionError("status not reached; last was " + manager.currentStatus());
  }

  private static final class FakeGateway implements ChatGatewayClient {
    final AtomicInteger opens = new AtomicInteger();
    final List<FakeSession> sessions = new CopyOnWriteArrayList<>();
    volatile GatewayListener lastListener;
    volatile GatewayException failWith;
    volatile boolean ignoreClose;

    @Override
    public GatewaySession open(String token, GatewayListener listener) throws GatewayException {
      if (failWith != null) throw failWith;
      FakeSession s = new FakeSession(ignoreClose);
      sessions.add(s);
      lastListener = listener;
      opens.incrementAndGet();
      return s;
    }

    /** Waits until the n-th session's worker has settled into its close wait. */
    void awaitWorkerWaiting(int n) throws InterruptedException {
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (sessions.size() < n) {
        if (System.nanoTime() > deadline) throw new AssertionError("expected " + n + " opens");
        Thread.sleep(5);
      }
      if (!sessions.get(n - 1).waiting.await(5, TimeUnit.SECONDS)) {
        throw new AssertionError("worker never waited on session " + n);
      }
    }
  }

  private static final class FakeSession implements GatewaySession {
    static final String SELF_ID = "bot-1";

    final CountDownLatch closed = new CountDownLatch(1);
    final CountDownLatch waiting = new CountDownLatch(1);
    final AtomicInteger closeCalls = new AtomicInteger();
    final AtomicInteger forceCalls = new AtomicInteger();
    private final boolean ignoreClose;

    FakeSession(boolean ignoreClose) {
      this.ignoreClose = ignoreClose;
    }

    @Override
    public String selfId() {
      return SELF_ID;
    }

    @Override
    public void close() {
      closeCalls.incrementAndGet();
      if (!ignoreClose) closed.countDown();
    }

    @Override
    public void forceClose() {
      forceCalls.incrementAndGet();
      closed.countDown();
    }

    @Override
    public boolean awaitClosed(Duration timeout) throws InterruptedException {
      waiting.countDown();
      return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
  }
}
