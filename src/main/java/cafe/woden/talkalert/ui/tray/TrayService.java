package cafe.woden.talkalert.ui.tray;

import cafe.woden.talkalert.ApplicationShutdownCoordinator;
import cafe.woden.talkalert.app.ControlSurface;
import cafe.woden.talkalert.app.EventMarshal;
import cafe.woden.talkalert.app.SettingsBus;
import cafe.woden.talkalert.config.TalkAlertProperties;
import cafe.woden.talkalert.model.Settings;
import cafe.woden.talkalert.ui.MainWindow;
import dorkbox.systemTray.Checkbox;
import dorkbox.systemTray.MenuItem;
import dorkbox.systemTray.SystemTray;
import jakarta.annotation.PreDestroy;
import java.beans.PropertyChangeListener;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * System tray presence.
 *
 * <p>The icon only exists while the window is parked in the tray. Menu callbacks arrive on the
 * tray library's thread and are forwarded through the {@link EventMarshal}.
 */
@Component
@Lazy
public class TrayService {

  private static final Logger log = LoggerFactory.getLogger(TrayService.class);

  private final SettingsBus settingsBus;
  private final EventMarshal marshal;
  private final ObjectProvider<MainWindow> windowProvider;
  private final ObjectProvider<ControlSurface> controlProvider;
  private final ApplicationShutdownCoordinator shutdownCoordinator;
  private final boolean enabled;
  private final PropertyChangeListener settingsListener;

  private final AtomicBoolean installed = new AtomicBoolean(false);
  private final AtomicBoolean exitRequested = new AtomicBoolean(false);

  private volatile SystemTray systemTray;
  private volatile Checkbox muteItem;

  public TrayService(
      SettingsBus settingsBus,
      EventMarshal marshal,
      ObjectProvider<MainWindow> windowProvider,
      ObjectProvider<ControlSurface> controlProvider,
      ApplicationShutdownCoordinator shutdownCoordinator,
      TalkAlertProperties properties) {
    this.settingsBus = settingsBus;
    this.marshal = marshal;
    this.windowProvider = windowProvider;
    this.controlProvider = controlProvider;
    this.shutdownCoordinator = shutdownCoordinator;
    this.enabled =
        (properties != null ? properties : TalkAlertProperties.defaults()).ui().trayEnabled();
    this.settingsListener =
        evt -> {
          if (!SettingsBus.PROP_SETTINGS.equals(evt.getPropertyName())) return;
          if (evt.getNewValue() instanceof Settings s) syncMuteItem(s.muted());
        };
    settingsBus.addListener(settingsListener);
  }

  @PreDestroy
  void shutdown() {
    settingsBus.removeListener(settingsListener);
    stop();
  }

  public boolean isEnabled() {
    return enabled;
  }

  public boolean isTrayActive() {
    return systemTray != null;
  }

  public boolean isExitRequested() {
    return exitRequested.get();
  }

  /**
   * Installs the tray icon once. Safe to call repeatedly.
   *
   * @return whether the icon is now active
   */
  public boolean show() {
    if (!enabled) return false;
    if (!installed.compareAndSet(false, true)) {
      return isTrayActive();
    }

    try {
      SystemTray tray = SystemTray.get(TalkAlertProperties.APP_NAME);
      if (tray == null) {
        log.warn("[tray] SystemTray.get() returned null (tray not available)");
        installed.set(false);
        return false;
      }

      tray.setTooltip(TalkAlertProperties.APP_NAME);
      tray.setImage(TrayIconFactory.createTrayIconPngStream());

      tray.getMenu().add(new MenuItem("Open", e -> marshal.post(this::toggleMainWindow)));
      Checkbox mute =
          new Checkbox(
              "Mute",
              e -> {
                boolean checked = ((Checkbox) e.getSource()).getChecked();
                marshal.post(() -> applyMuteFromTray(checked));
              });
      mute.setChecked(settingsBus.get().muted());
      tray.getMenu().add(mute);
      tray.getMenu().add(new MenuItem("Exit", e -> marshal.post(this::requestExit)));

      muteItem = mute;
      systemTray = tray;
      log.info("[tray] installed");
      return true;
    } catch (Throwable t) {
      log.warn("[tray] failed to install system tray icon", t);
      installed.set(false);
      return false;
    }
  }

  /** Removes the icon. The window must already be visible. */
  public void hide() {
    SystemTray tray = this.systemTray;
    this.systemTray = null;
    this.muteItem = null;

    if (tray != null) {
      try {
        tray.shutdown();
      } catch (Throwable t) {
        log.debug("[tray] shutdown failed", t);
      }
      log.info("[tray] removed");
    }
    installed.set(false);
  }

  /** Final removal during application exit. Idempotent. */
  public void stop() {
    hide();
  }

  public void toggleMainWindow() {
    MainWindow window = windowProvider.getIfAvailable();
    if (window == null) return;
    if (window.isVisible() && !window.isIconified()) {
      window.hideToTray(true);
    } else {
      window.showFromTray();
    }
  }

  public void requestExit() {
    if (!exitRequested.compareAndSet(false, true)) {
      return;
    }
    try {
      MainWindow window = windowProvider.getIfAvailable();
      if (window != null) window.dispose();
    } finally {
      shutdownCoordinator.shutdown();
    }
  }

  private void applyMuteFromTray(boolean muted) {
    ControlSurface control = controlProvider.getIfAvailable();
    if (control != null) control.setMuted(muted);
  }

  private void syncMuteItem(boolean muted) {
    Checkbox item = this.muteItem;
    if (item == null) return;
    try {
      if (item.getChecked() != muted) item.setChecked(muted);
    } catch (Throwable t) {
      log.debug("[tray] could not update mute item", t);
    }
  }
}
