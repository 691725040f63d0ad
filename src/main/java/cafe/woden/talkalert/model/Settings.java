package cafe.woden.talkalert.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Process-wide user settings persisted in the runtime config file. */
@ValueObject
public record Settings(
    boolean muted,
    String authToken,
    boolean trayOnMinimize,
    boolean pushEnabled,
    String pushUserKey,
    String pushAppToken,
    boolean pushWhenMuted,
    boolean pushIncludeMessage) {

  public Settings {
    authToken = Objects.toString(authToken, "").trim();
    pushUserKey = Objects.toString(pushUserKey, "").trim();
    pushAppToken = Objects.toString(pushAppToken, "").trim();
  }

  public static Settings defaults() {
    return new Settings(false, "", true, false, "", "", true, true);
  }

  public boolean hasAuthToken() {
    return !authToken.isEmpty();
  }

  /** True when push is switched on and both Pushover credentials are present. */
  public boolean pushConfigured() {
    return pushEnabled && !pushUserKey.isEmpty() && !pushAppToken.isEmpty();
  }

  public Settings withMuted(boolean next) {
    return new Settings(
        next,
        authToken,
        trayOnMinimize,
        pushEnabled,
        pushUserKey,
        pushAppToken,
        pushWhenMuted,
        pushIncludeMessage);
  }

  public Settings withAuthToken(String next) {
    return new Settings(
        muted,
        next,
        trayOnMinimize,
        pushEnabled,
        pushUserKey,
        pushAppToken,
        pushWhenMuted,
        pushIncludeMessage);
  }

  public Settings withPreferences(
      boolean nextTrayOnMinimize,
      boolean nextPushEnabled,
      String nextPushUserKey,
      String nextPushAppToken,
      boolean nextPushWhenMuted,
      boolean nextPushIncludeMessage) {
    return new Settings(
        muted,
        authToken,
        nextTrayOnMinimize,
        nextPushEnabled,
        nextPushUserKey,
        nextPushAppToken,
        nextPushWhenMuted,
        nextPushIncludeMessage);
  }

  @Override
  public String toString() {
    // Credentials stay out of logs.
    return "Settings[muted="
        + muted
        + ", authToken="
        + (hasAuthToken() ? "<set>" : "<empty>")
        + ", trayOnMinimize="
        + trayOnMinimize
        + ", pushEnabled="
        + pushEnabled
        + ", pushWhenMuted="
        + pushWhenMuted
        + ", pushIncludeMessage="
        + pushIncludeMessage
        + "]";
  }
}
