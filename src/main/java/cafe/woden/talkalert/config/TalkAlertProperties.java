package cafe.woden.talkalert.config;

import java.time.Duration;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Static application settings bound from {@code application.yml} / command line.
 *
 * <p>User-editable state (rules, mute, credentials) lives in the runtime config file managed by
 * {@link RuntimeConfigStore}, not here.
 */
@ConfigurationProperties(prefix = "talkalert")
public record TalkAlertProperties(
    String runtimeConfig, Connection connection, Push push, Ui ui) {

  public static final String APP_NAME = "TalkAlert";

  public TalkAlertProperties {
    runtimeConfig = Objects.toString(runtimeConfig, "").trim();
    if (runtimeConfig.isEmpty()) {
      runtimeConfig = System.getProperty("user.home") + "/.config/talkalert/talkalert.yml";
    }
    if (connection == null) connection = new Connection(null, null, null);
    if (push == null) push = new Push(null, null, null, null);
    if (ui == null) ui = new Ui(null, null);
  }

  public static TalkAlertProperties defaults() {
    return new TalkAlertProperties(null, null, null, null);
  }

  /** Gateway lifecycle timings. */
  public record Connection(Duration stopTimeout, Duration restartDelay, Integer minTokenLength) {
    public Connection {
      if (stopTimeout == null || stopTimeout.isNegative() || stopTimeout.isZero()) {
        stopTimeout = Duration.ofMillis(2500);
      }
      if (stopTimeout.compareTo(Duration.ofSeconds(30)) > 0) stopTimeout = Duration.ofSeconds(30);

      if (restartDelay == null || restartDelay.isNegative()) restartDelay = Duration.ofMillis(400);
      if (restartDelay.compareTo(Duration.ofSeconds(10)) > 0) restartDelay = Duration.ofSeconds(10);

      if (minTokenLength == null || minTokenLength < 0) minTokenLength = 20;
    }
  }

  /** Pushover endpoint settings. Credentials are runtime state, not properties. */
  public record Push(String endpoint, Duration timeout, String title, String urlTitle) {
    public Push {
      endpoint = Objects.toString(endpoint, "").trim();
      if (endpoint.isEmpty()) endpoint = "https://api.pushover.net/1/messages.json";

      if (timeout == null || timeout.isNegative() || timeout.isZero()) {
        timeout = Duration.ofSeconds(10);
      }
      if (timeout.compareTo(Duration.ofSeconds(60)) > 0) timeout = Duration.ofSeconds(60);

      title = Objects.toString(title, "").trim();
      if (title.isEmpty()) title = APP_NAME;

      urlTitle = Objects.toString(urlTitle, "").trim();
      if (urlTitle.isEmpty()) urlTitle = "Open in Discord";
    }
  }

  /** Desktop integration switches. */
  public record Ui(Boolean headless, Boolean trayEnabled) {
    public Ui {
      if (headless == null) headless = false;
      if (trayEnabled == null) trayEnabled = true;
    }
  }
}
