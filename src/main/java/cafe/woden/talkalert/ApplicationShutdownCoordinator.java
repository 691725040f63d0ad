package cafe.woden.talkalert;

import cafe.woden.talkalert.app.ConnectionManager;
import cafe.woden.talkalert.app.SettingsBus;
import cafe.woden.talkalert.config.RuntimeConfigStore;
import cafe.woden.talkalert.notify.sound.PlaybackController;
import cafe.woden.talkalert.rules.RuleTable;
import cafe.woden.talkalert.ui.tray.TrayService;
import cafe.woden.talkalert.util.DaemonThreads;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.support.AbstractApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Tears the app down in a fixed order: tray, audio, connection, persisted state, then the process.
 *
 * <p>Each step is bounded or best-effort. A watchdog halts the JVM if the sequence itself hangs.
 */
@Component
public class ApplicationShutdownCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ApplicationShutdownCoordinator.class);

  // Hard-stop fallback so a wedged native tray or gateway thread can never keep the process alive.
  private static final long SHUTDOWN_WATCHDOG_MS = 8000L;

  private final ConfigurableApplicationContext applicationContext;
  private final ObjectProvider<TrayService> trayProvider;
  private final PlaybackController playback;
  private final ConnectionManager connections;
  private final RuntimeConfigStore store;
  private final SettingsBus settings;
  private final RuleTable rules;
  private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

  public ApplicationShutdownCoordinator(
      ConfigurableApplicationContext applicationContext,
      ObjectProvider<TrayService> trayProvider,
      PlaybackController playback,
      ConnectionManager connections,
      RuntimeConfigStore store,
      SettingsBus settings,
      RuleTable rules) {
    this.applicationContext = applicationContext;
    this.trayProvider = trayProvider;
    this.playback = playback;
    this.connections = connections;
    this.store = store;
    this.settings = settings;
    this.rules = rules;
  }

  public boolean isShutdownStarted() {
    return shutdownStarted.get();
  }

  public void shutdown() {
    if (!shutdownStarted.compareAndSet(false, true)) {
      return;
    }

    DaemonThreads.start(
        "talkalert-shutdown-watchdog",
        () -> {
          try {
            Thread.sleep(SHUTDOWN_WATCHDOG_MS);
          } catch (InterruptedException ignored) {
            return;
          }
          log.error(
              "[talkalert] Shutdown watchdog fired after {}ms; forcing JVM halt.",
              SHUTDOWN_WATCHDOG_MS);
          Runtime.getRuntime().halt(1);
        });

    DaemonThreads.start(
        "talkalert-shutdown",
        () -> {
          int exitCode = runShutdownSequence();
          exitCode = closeContext(exitCode);
          System.exit(exitCode);
        });
  }

  /** Runs every teardown step in order. Returns 0, or 1 if any step failed. */
  int runShutdownSequence() {
    int exitCode = 0;
    log.info("[talkalert] shutting down");

    try {
      trayProvider.ifAvailable(TrayService::stop);
    } catch (Throwable t) {
      log.warn("[talkalert] Error while removing tray icon", t);
      exitCode = 1;
    }

    try {
      playback.shutdown();
    } catch (Throwable t) {
      log.warn("[talkalert] Error while stopping audio", t);
      exitCode = 1;
    }

    try {
      connections.stop();
    } catch (Throwable t) {
      log.warn("[talkalert] Error while stopping gateway connection", t);
      exitCode = 1;
    }

    try {
      store.save(settings.get(), rules.all());
    } catch (Throwable t) {
      log.warn("[talkalert] Error while saving runtime config", t);
      exitCode = 1;
    }
    return exitCode;
  }

  private int closeContext(int exitCode) {
    try {
      if (isApplicationContextAlreadyClosed()) {
        log.debug("[talkalert] Spring context already closed before shutdown coordinator exit.");
        return exitCode;
      }
      int code = SpringApplication.exit(applicationContext, () -> 0);
      return Math.max(code, exitCode);
    } catch (IllegalStateException ise) {
      if (isAlreadyClosedException(ise)) {
        // Another path already closed the context.
        log.debug("[talkalert] Spring context already closed during shutdown.", ise);
        return exitCode;
      }
      log.warn("[talkalert] Error while closing Spring context", ise);
      return 1;
    } catch (Throwable t) {
      log.warn("[talkalert] Error while closing Spring context", t);
      return 1;
    }
  }

  private boolean isApplicationContextAlreadyClosed() {
    if (applicationContext instanceof AbstractApplicationContext ac) {
      return !ac.isActive();
    }
    return false;
  }

  private static boolean isAlreadyClosedException(IllegalStateException ex) {
    String msg = ex == null ? "" : String.valueOf(ex.getMessage());
    msg = msg.toLowerCase(Locale.ROOT);
    return msg.contains("has been closed already")
        || msg.contains("beanfactory not initialized or already closed");
  }
}
