package cafe.woden.talkalert.app;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** One connection state report plus the status line that goes with it. */
@ValueObject
public record ConnectionStatus(ConnectionState state, String text, Instant at) {

  public static final String NOT_CONFIGURED_TEXT = "Bot: token not set (add one in Settings)";

  public ConnectionStatus {
    Objects.requireNonNull(state, "state");
    text = Objects.toString(text, "").trim();
    if (at == null) at = Instant.now();
  }

  public static ConnectionStatus offline() {
    return new ConnectionStatus(ConnectionState.OFFLINE, "Bot: offline", null);
  }

  public static ConnectionStatus notConfigured() {
    return new ConnectionStatus(ConnectionState.OFFLINE, NOT_CONFIGURED_TEXT, null);
  }

  public static ConnectionStatus connecting() {
    return new ConnectionStatus(ConnectionState.CONNECTING, "Bot: connecting...", null);
  }

  public static ConnectionStatus online(String selfTag) {
    String tag = Objects.toString(selfTag, "").trim();
    return new ConnectionStatus(
        ConnectionState.ONLINE, tag.isEmpty() ? "Bot: online" : "Bot: online (" + tag + ")", null);
  }

  public static ConnectionStatus disconnected(String reason) {
    String r = Objects.toString(reason, "").trim();
    return new ConnectionStatus(
        ConnectionState.OFFLINE,
        r.isEmpty() ? "Bot: disconnected" : "Bot: disconnected (" + r + ")",
        null);
  }

  public static ConnectionStatus failed(String reason) {
    String r = Objects.toString(reason, "").trim();
    if (r.isEmpty()) r = "unknown error";
    return new ConnectionStatus(ConnectionState.OFFLINE, "Bot: start failed (" + r + ")", null);
  }

  public boolean isNotConfigured() {
    return state == ConnectionState.OFFLINE && NOT_CONFIGURED_TEXT.equals(text);
  }
}
