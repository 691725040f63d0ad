package cafe.woden.talkalert.ui;

import cafe.woden.talkalert.ApplicationShutdownCoordinator;
import cafe.woden.talkalert.app.ConnectionManager;
import cafe.woden.talkalert.app.ConnectionState;
import cafe.woden.talkalert.app.ConnectionStatus;
import cafe.woden.talkalert.app.ControlSurface;
import cafe.woden.talkalert.app.EventMarshal;
import cafe.woden.talkalert.app.SettingsBus;
import cafe.woden.talkalert.config.TalkAlertProperties;
import cafe.woden.talkalert.model.Rule;
import cafe.woden.talkalert.model.Settings;
import cafe.woden.talkalert.rules.RuleTable;
import cafe.woden.talkalert.ui.tray.TrayIconFactory;
import cafe.woden.talkalert.ui.tray.TrayService;
import cafe.woden.talkalert.util.DaemonThreads;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Frame;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.beans.PropertyChangeListener;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import javax.swing.BorderFactory;
import javax.swing.JComponent;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JTable;
import javax.swing.JToggleButton;
import javax.swing.Timer;
import javax.swing.WindowConstants;
import javax.swing.table.AbstractTableModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Status window: connection dot and text, mute toggle, and the rule list.
 *
 * <p>Created and used on the EDT only. Minimizing parks the window in the tray when that is
 * enabled and the tray icon actually comes up.
 */
@Component
@Lazy
public class MainWindow extends JFrame {

  private static final Logger log = LoggerFactory.getLogger(MainWindow.class);

  static final int BLINK_INTERVAL_MS = 450;
  // Catches minimizes whose window event never arrived.
  static final int MINIMIZE_CHECK_INTERVAL_MS = 350;

  private static final Color ONLINE_COLOR = new Color(0x2ECC71);
  private static final Color OFFLINE_COLOR = new Color(0xE74C3C);

  private final SettingsBus settingsBus;
  private final RuleTable rules;
  private final ControlSurface control;
  private final EventMarshal marshal;
  private final ObjectProvider<TrayService> trayProvider;
  private final ApplicationShutdownCoordinator shutdownCoordinator;

  private final StatusDot dot = new StatusDot();
  private final JLabel statusLabel = new JLabel(ConnectionStatus.offline().text());
  private final JToggleButton muteButton = new JToggleButton("Mute");
  private final RuleTableModel ruleModel = new RuleTableModel();
  private final Timer blinkTimer;
  private final Timer minimizeCheckTimer;
  private final CompositeDisposable disposables = new CompositeDisposable();
  private final PropertyChangeListener rulesListener;
  private final PropertyChangeListener settingsListener;

  private ConnectionState state = ConnectionState.OFFLINE;
  private boolean blinkOn = true;
  private boolean inTray;
  private boolean trayPending;

  public MainWindow(
      ConnectionManager connections,
      SettingsBus settingsBus,
      RuleTable rules,
      ControlSurface control,
      EventMarshal marshal,
      ObjectProvider<TrayService> trayProvider,
      ApplicationShutdownCoordinator shutdownCoordinator) {
    super(TalkAlertProperties.APP_NAME);
    this.settingsBus = settingsBus;
    this.rules = rules;
    this.control = control;
    this.marshal = marshal;
    this.trayProvider = trayProvider;
    this.shutdownCoordinator = shutdownCoordinator;

    setIconImage(TrayIconFactory.createTrayImage());
    setDefaultCloseOperation(WindowConstants.DO_NOTHING_ON_CLOSE);
    setMinimumSize(new Dimension(560, 300));
    buildLayout();

    ruleModel.setRules(rules.all());
    muteButton.setSelected(settingsBus.get().muted());
    muteButton.addActionListener(e -> muteButton.setSelected(control.toggleMute()));

    rulesListener = evt -> marshal.runOrPost(() -> ruleModel.setRules(rules.all()));
    settingsListener =
        evt -> {
          if (evt.getNewValue() instanceof Settings s) {
            marshal.runOrPost(() -> muteButton.setSelected(s.muted()));
          }
        };
    rules.addListener(rulesListener);
    settingsBus.addListener(settingsListener);

    disposables.add(
        connections
            .statuses()
            .observeOn(marshal.scheduler())
            .subscribe(
                this::applyStatus, err -> log.warn("[talkalert] status stream failed", err)));

    blinkTimer = new Timer(BLINK_INTERVAL_MS, e -> tickBlink());
    blinkTimer.start();
    minimizeCheckTimer = new Timer(MINIMIZE_CHECK_INTERVAL_MS, e -> checkMinimized());
    minimizeCheckTimer.start();

    addWindowListener(
        new WindowAdapter() {
          @Override
          public void windowIconified(WindowEvent e) {
            hideToTray(false);
          }

          @Override
          public void windowClosing(WindowEvent e) {
            confirmExit();
          }
        });

    pack();
    setLocationRelativeTo(null);
  }

  private void buildLayout() {
    JPanel top = new JPanel(new BorderLayout(8, 0));
    top.setBorder(BorderFactory.createEmptyBorder(8, 10, 8, 10));
    JPanel status = new JPanel(new BorderLayout(6, 0));
    status.add(dot, BorderLayout.WEST);
    status.add(statusLabel, BorderLayout.CENTER);
    top.add(status, BorderLayout.CENTER);
    top.add(muteButton, BorderLayout.EAST);

    JTable table = new JTable(ruleModel);
    table.setFillsViewportHeight(true);
    table.getTableHeader().setReorderingAllowed(false);

    getContentPane().setLayout(new BorderLayout());
    getContentPane().add(top, BorderLayout.NORTH);
    getContentPane().add(new JScrollPane(table), BorderLayout.CENTER);
  }

  public boolean isIconified() {
    return (getExtendedState() & Frame.ICONIFIED) != 0;
  }

  /**
   * Withdraws the window into the tray.
   *
   * @param force ignore the minimize-to-tray preference (tray "Open" toggle)
   */
  public void hideToTray(boolean force) {
    if (inTray || trayPending) return;
    if (!force && !settingsBus.get().trayOnMinimize()) return;
    TrayService tray = trayProvider.getIfAvailable();
    if (tray == null) return;

    trayPending = true;
    // Native tray setup can block; never do it on the EDT.
    DaemonThreads.start(
        "talkalert-tray-install",
        () -> {
          boolean active;
          try {
            active = tray.show();
          } catch (Throwable t) {
            log.warn("[talkalert] tray install failed", t);
            active = false;
          }
          boolean started = active;
          marshal.post(() -> finishHideToTray(started));
        });
  }

  private void finishHideToTray(boolean trayStarted) {
    trayPending = false;
    if (!trayStarted) {
      log.warn("[talkalert] tray unavailable; keeping the window visible");
      return;
    }
    inTray = true;
    setVisible(false);
  }

  public void showFromTray() {
    inTray = false;
    setVisible(true);
    setExtendedState(getExtendedState() & ~Frame.ICONIFIED);
    toFront();
    requestFocus();
    TrayService tray = trayProvider.getIfAvailable();
    if (tray != null) tray.hide();
  }

  @Override
  public void dispose() {
    blinkTimer.stop();
    minimizeCheckTimer.stop();
    disposables.dispose();
    rules.removeListener(rulesListener);
    settingsBus.removeListener(settingsListener);
    super.dispose();
  }

  private void confirmExit() {
    if (inTray) showFromTray();
    int choice =
        JOptionPane.showConfirmDialog(
            this,
            "Stop monitoring and exit " + TalkAlertProperties.APP_NAME + "?",
            TalkAlertProperties.APP_NAME,
            JOptionPane.OK_CANCEL_OPTION,
            JOptionPane.QUESTION_MESSAGE);
    if (choice != JOptionPane.OK_OPTION) return;
    dispose();
    shutdownCoordinator.shutdown();
  }

  private void applyStatus(ConnectionStatus status) {
    state = status.state();
    statusLabel.setText(status.text());
    blinkOn = true;
    dot.setColor(state == ConnectionState.OFFLINE ? OFFLINE_COLOR : ONLINE_COLOR);
  }

  private void tickBlink() {
    if (state == ConnectionState.ONLINE) {
      dot.setColor(ONLINE_COLOR);
      return;
    }
    blinkOn = !blinkOn;
    Color c = state == ConnectionState.CONNECTING ? ONLINE_COLOR : OFFLINE_COLOR;
    dot.setColor(blinkOn ? c : null);
  }

  private void checkMinimized() {
    if (!inTray && isVisible() && isIconified() && settingsBus.get().trayOnMinimize()) {
      hideToTray(false);
    }
  }

  private static final class StatusDot extends JComponent {
    private Color color = OFFLINE_COLOR;

    StatusDot() {
      setPreferredSize(new Dimension(14, 14));
    }

    void setColor(Color next) {
      color = next;
      repaint();
    }

    @Override
    protected void paintComponent(Graphics g) {
      if (color == null) return;
      Graphics2D g2 = (Graphics2D) g.create();
      try {
        g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2.setColor(color);
        int d = Math.min(getWidth(), getHeight()) - 2;
        g2.fillOval((getWidth() - d) / 2, (getHeight() - d) / 2, d, d);
      } finally {
        g2.dispose();
      }
    }
  }

  private static final class RuleTableModel extends AbstractTableModel {
    private static final String[] COLUMNS = {"Name", "Sender ID", "Sound", "Volume", "Push sound"};

    private List<Rule> rows = List.of();

    void setRules(List<Rule> next) {
      rows = next != null ? next : List.of();
      fireTableDataChanged();
    }

    @Override
    public int getRowCount() {
      return rows.size();
    }

    @Override
    public int getColumnCount() {
      return COLUMNS.length;
    }

    @Override
    public String getColumnName(int column) {
      return COLUMNS[column];
    }

    @Override
    public Object getValueAt(int rowIndex, int columnIndex) {
      Rule r = rows.get(rowIndex);
      return switch (columnIndex) {
        case 0 -> r.name();
        case 1 -> r.senderId();
        case 2 -> fileName(r.soundPath());
        case 3 -> r.volume() + "%";
        case 4 -> r.hasPushSound() ? r.pushSound() : "(default)";
        default -> "";
      };
    }

    private static String fileName(String path) {
      try {
        Path p = Paths.get(path).getFileName();
        return p != null ? p.toString() : path;
      } catch (RuntimeException e) {
        return path;
      }
    }
  }
}
