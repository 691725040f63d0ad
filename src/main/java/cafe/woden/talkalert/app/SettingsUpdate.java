package cafe.woden.talkalert.app;

import java.util.Objects;

/**
 * Values submitted from the settings form.
 *
 * @param authToken new bot token, or empty to keep the stored one
 */
public record SettingsUpdate(
    String authToken,
    boolean trayOnMinimize,
    boolean pushEnabled,
    String pushUserKey,
    String pushAppToken,
    boolean pushWhenMuted,
    boolean pushIncludeMessage) {

  public SettingsUpdate {
    authToken = Objects.toString(authToken, "").trim();
    pushUserKey = Objects.toString(pushUserKey, "").trim();
    pushAppToken = Objects.toString(pushAppToken, "").trim();
  }
}
