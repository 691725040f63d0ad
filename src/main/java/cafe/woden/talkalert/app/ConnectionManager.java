package cafe.woden.talkalert.app;

import cafe.woden.talkalert.config.ExecutorConfig;
import cafe.woden.talkalert.config.TalkAlertProperties;
import cafe.woden.talkalert.gateway.ChatGatewayClient;
import cafe.woden.talkalert.gateway.GatewayException;
import cafe.woden.talkalert.gateway.GatewayListener;
import cafe.woden.talkalert.gateway.GatewaySession;
import cafe.woden.talkalert.gateway.InboundMessage;
import cafe.woden.talkalert.util.DaemonThreads;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.subjects.BehaviorSubject;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Owns the gateway session lifecycle.
 *
 * <p>At most one worker thread holds a session at a time; {@link #start}, {@link #stop} and {@link
 * #restart} serialize on one guard. Every status report is marshalled to the control thread, and
 * reports from a worker that has since been stopped or replaced are dropped there.
 */
@Service
public class ConnectionManager {

  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private static final Duration WORKER_POLL = Duration.ofSeconds(1);

  private final ChatGatewayClient gateway;
  private final SettingsBus settings;
  private final NotificationDispatcher dispatcher;
  private final EventMarshal marshal;
  private final ExecutorService lifecycleExecutor;
  private final Duration stopTimeout;
  private final Duration restartDelay;

  private final Object guard = new Object();
  private final AtomicLong generation = new AtomicLong();
  private final BehaviorSubject<ConnectionStatus> status =
      BehaviorSubject.createDefault(ConnectionStatus.offline());

  private Worker worker;

  public ConnectionManager(
      ChatGatewayClient gateway,
      SettingsBus settings,
      NotificationDispatcher dispatcher,
      EventMarshal marshal,
      TalkAlertProperties properties,
      @Qualifier(ExecutorConfig.CONNECTION_LIFECYCLE_EXECUTOR) ExecutorService lifecycleExecutor) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.marshal = Objects.requireNonNull(marshal, "marshal");
    this.lifecycleExecutor = Objects.requireNonNull(lifecycleExecutor, "lifecycleExecutor");
    TalkAlertProperties.Connection c =
        (properties != null ? properties : TalkAlertProperties.defaults()).connection();
    this.stopTimeout = c.stopTimeout();
    this.restartDelay = c.restartDelay();
  }

  /**
   * Status reports, emitted on the control thread. Replays the latest one on subscribe, on the
   * subscribing thread; observe on {@link EventMarshal#scheduler()} to stay on the control thread.
   */
  public Observable<ConnectionStatus> statuses() {
    return status.hide();
  }

  public ConnectionStatus currentStatus() {
    return status.getValue();
  }

  public boolean isWorkerAlive() {
    synchronized (guard) {
      return worker != null && worker.thread.isAlive();
    }
  }

  /**
   * Connects with the stored token unless a worker is already running.
   *
   * <p>With no token, stays offline and reports {@link ConnectionStatus#notConfigured()}.
   */
  public void start() {
    String token = settings.get().authToken();
    if (token.isEmpty()) {
      publish(ConnectionStatus.notConfigured());
      return;
    }

    synchronized (guard) {
      if (worker != null && worker.thread.isAlive()) {
        log.debug("[talkalert] start ignored; gateway worker already running");
        return;
      }
      long gen = generation.incrementAndGet();
      Worker w = new Worker(gen, token);
      worker = w;
      publish(ConnectionStatus.connecting());
      w.thread.start();
      log.info("[talkalert] gateway worker {} started", gen);
    }
  }

  /** Closes the session, waiting a bounded time before dropping it. No-op without a worker. */
  public void stop() {
    stopWorker();
  }

  private boolean stopWorker() {
    synchronized (guard) {
      Worker w = worker;
      worker = null;
      if (w == null || !w.thread.isAlive()) return false;

      generation.incrementAndGet();
      w.requestStop();
      boolean joined = false;
      try {
        w.thread.join(Math.max(1L, stopTimeout.toMillis()));
        joined = !w.thread.isAlive();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (!joined) {
        log.warn(
            "[talkalert] gateway worker {} did not stop within {}ms; forcing close",
            w.generation,
            stopTimeout.toMillis());
        w.forceClose();
      }
      publish(ConnectionStatus.offline());
      log.info("[talkalert] gateway worker {} stopped", w.generation);
      return true;
    }
  }

  @PreDestroy
  void shutdown() {
    stop();
  }

  /**
   * Full stop, a short settle delay, then start again with the current token. Always reports
   * offline before connecting again.
   */
  public void restart() {
    synchronized (guard) {
      if (!stopWorker()) {
        generation.incrementAndGet();
        publish(ConnectionStatus.offline());
      }
      try {
        Thread.sleep(restartDelay.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      start();
    }
  }

  /** {@link #start} on the lifecycle executor, so callers never wait on a stop in progress. */
  public CompletableFuture<Void> startAsync() {
    return runOnLifecycle("start", this::start);
  }

  public CompletableFuture<Void> restartAsync() {
    return runOnLifecycle("restart", this::restart);
  }

  public CompletableFuture<Void> stopAsync() {
    return runOnLifecycle("stop", this::stop);
  }

  /** Stops any session, then reports that no token is configured. */
  public CompletableFuture<Void> stopUnconfiguredAsync() {
    return runOnLifecycle(
        "stop",
        () -> {
          stop();
          publish(ConnectionStatus.notConfigured());
        });
  }

  private CompletableFuture<Void> runOnLifecycle(String what, Runnable task) {
    return CompletableFuture.runAsync(
        () -> {
          try {
            task.run();
          } catch (RuntimeException e) {
            log.warn("[talkalert] connection {} failed", what, e);
            publish(ConnectionStatus.failed(e.getMessage()));
          }
        },
        lifecycleExecutor);
  }

  private void publish(ConnectionStatus next) {
    marshal.post(() -> status.onNext(next));
  }

  private void publishFrom(long gen, ConnectionStatus next) {
    marshal.post(
        () -> {
          if (gen != generation.get()) {
            log.debug("[talkalert] dropping {} from superseded worker {}", next.state(), gen);
            return;
          }
          status.onNext(next);
        });
  }

  private boolean isCurrent(long gen) {
    return gen == generation.get();
  }

  private final class Worker implements GatewayListener {
    final long generation;
    final Thread thread;
    private final String token;
    private volatile GatewaySession session;
    private volatile String selfId = "";
    private volatile String selfTag = "";
    private volatile boolean stopRequested;

    Worker(long generation, String token) {
      this.generation = generation;
      this.token = token;
      this.thread = DaemonThreads.unstarted("talkalert-gateway-" + generation, this::run);
    }

    private void run() {
      GatewaySession s;
      try {
        s = gateway.open(token, this);
      } catch (GatewayException e) {
        log.warn("[talkalert] gateway login failed: {}", e.getMessage());
        log.debug("[talkalert] gateway login failure", e);
        publishFrom(generation, ConnectionStatus.failed(e.getMessage()));
        return;
      } catch (RuntimeException e) {
        log.warn("[talkalert] gateway worker {} crashed during login", generation, e);
        publishFrom(generation, ConnectionStatus.failed(e.toString()));
        return;
      }
      session = s;
      if (!s.selfId().isEmpty()) selfId = s.selfId();
      if (stopRequested) s.close();

      try {
        while (!s.awaitClosed(WORKER_POLL)) {
          // Session ends via stop() or a fatal gateway close.
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        s.forceClose();
      }
      if (!stopRequested) {
        publishFrom(generation, ConnectionStatus.disconnected("session closed"));
      }
      log.debug("[talkalert] gateway worker {} exiting", generation);
    }

    void requestStop() {
      stopRequested = true;
      GatewaySession s = session;
      if (s != null) {
        try {
          s.close();
        } catch (RuntimeException e) {
          log.debug("[talkalert] gateway close failed", e);
        }
      }
    }

    void forceClose() {
      GatewaySession s = session;
      try {
        if (s != null) s.forceClose();
      } catch (RuntimeException e) {
        log.debug("[talkalert] gateway force close failed", e);
      } finally {
        thread.interrupt();
      }
    }

    @Override
    public void onReady(String id, String tag) {
      if (id != null && !id.isBlank()) selfId = id;
      selfTag = Objects.toString(tag, "");
      log.info("[talkalert] gateway ready as {}", selfTag);
      publishFrom(generation, ConnectionStatus.online(selfTag));
    }

    @Override
    public void onDisconnect(String reason) {
      log.info("[talkalert] gateway disconnected: {}", reason);
      publishFrom(generation, ConnectionStatus.disconnected(reason));
    }

    @Override
    public void onResumed() {
      publishFrom(generation, ConnectionStatus.online(selfTag));
    }

    @Override
    public void onMessage(InboundMessage message) {
      if (message == null || !isCurrent(generation)) return;
      if (message.automated()) return;
      if (!selfId.isEmpty() && selfId.equals(message.senderId())) return;
      try {
        dispatcher.dispatch(message);
      } catch (RuntimeException e) {
        log.warn("[talkalert] dispatch failed for sender {}", message.senderId(), e);
      }
    }

    @Override
    public void onClosed() {
      log.debug("[talkalert] gateway session {} closed", generation);
    }
  }
}
