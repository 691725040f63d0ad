package cafe.woden.talkalert.app;

import cafe.woden.talkalert.config.ExecutorConfig;
import cafe.woden.talkalert.config.RuntimeConfigStore;
import cafe.woden.talkalert.config.TalkAlertProperties;
import cafe.woden.talkalert.model.Rule;
import cafe.woden.talkalert.model.Settings;
import cafe.woden.talkalert.notify.pushover.PushoverClient;
import cafe.woden.talkalert.notify.pushover.PushoverClient.PushResult;
import cafe.woden.talkalert.notify.sound.PlaybackController;
import cafe.woden.talkalert.notify.sound.PlaybackUnavailableException;
import cafe.woden.talkalert.rules.InvalidSoundExtensionException;
import cafe.woden.talkalert.rules.RuleTable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * User actions, run on the control thread.
 *
 * <p>Every mutation of rules or settings is persisted before the method returns. Anything that could
 * block (connection restarts, push tests) is handed to a worker.
 */
@Service
public class ControlSurface {

  private static final Logger log = LoggerFactory.getLogger(ControlSurface.class);

  public static final String TEST_RULE_ID = "__test__";
  static final String TEST_PUSH_MESSAGE =
      "TalkAlert test notification. Per-rule push sounds are set on each rule.";

  private final RuleTable rules;
  private final SettingsBus settings;
  private final RuntimeConfigStore store;
  private final PlaybackController playback;
  private final PushoverClient push;
  private final ConnectionManager connections;
  private final ExecutorService pushTestExecutor;
  private final EventMarshal marshal;
  private final int minTokenLength;

  public ControlSurface(
      RuleTable rules,
      SettingsBus settings,
      RuntimeConfigStore store,
      PlaybackController playback,
      PushoverClient push,
      ConnectionManager connections,
      EventMarshal marshal,
      TalkAlertProperties properties,
      @Qualifier(ExecutorConfig.PUSH_TEST_EXECUTOR) ExecutorService pushTestExecutor) {
    this.rules = rules;
    this.settings = settings;
    this.store = store;
    this.playback = playback;
    this.push = push;
    this.connections = connections;
    this.marshal = marshal;
    this.pushTestExecutor = pushTestExecutor;
    this.minTokenLength =
        (properties != null ? properties : TalkAlertProperties.defaults())
            .connection()
            .minTokenLength();
  }

  public void addRule(String name, String senderId, String soundPath, int volume, String pushSound) {
    rules.add(new Rule(name, senderId, soundPath, volume, pushSound));
    persist();
  }

  public void updateRule(
      String oldSenderId,
      String name,
      String senderId,
      String soundPath,
      int volume,
      String pushSound) {
    rules.update(oldSenderId, new Rule(name, senderId, soundPath, volume, pushSound));
    persist();
  }

  public void removeRule(String senderId) {
    rules.remove(senderId);
    persist();
  }

  public void reorderRules(List<String> senderIds) {
    rules.reorder(senderIds);
    persist();
  }

  /** Flips mute, silences whatever is playing, and returns the new mute state. */
  public boolean toggleMute() {
    return setMuted(!settings.get().muted());
  }

  public boolean setMuted(boolean muted) {
    Settings cur = settings.get();
    playback.stop();
    if (cur.muted() != muted) {
      settings.set(cur.withMuted(muted));
      log.info("[talkalert] sounds {}", muted ? "muted" : "unmuted");
    }
    persist();
    return muted;
  }

  /**
   * Applies the settings form.
   *
   * <p>An empty token keeps the stored one. Afterwards the connection is restarted when the token
   * changed, started if it is not running, or stopped when there is no token at all.
   *
   * @throws InvalidSettingsException if a new token is too short to be real
   */
  public void saveSettings(SettingsUpdate update) {
    Objects.requireNonNull(update, "update");
    Settings cur = settings.get();

    String token = update.authToken();
    if (!token.isEmpty() && token.length() < minTokenLength) {
      throw new InvalidSettingsException("The bot token is too short.");
    }
    boolean tokenChanged = !token.isEmpty() && !token.equals(cur.authToken());

    Settings next = applyPreferences(cur, update);
    if (!token.isEmpty()) next = next.withAuthToken(token);
    settings.set(next);
    persist();

    if (next.hasAuthToken()) {
      if (tokenChanged) {
        connections.restartAsync();
      } else {
        connections.startAsync();
      }
    } else {
      connections.stopUnconfiguredAsync();
    }
  }

  /** Forgets the stored token, keeps the other form values, and stops the connection. */
  public void clearToken(SettingsUpdate update) {
    Settings cur = settings.get();
    Settings next = (update != null ? applyPreferences(cur, update) : cur).withAuthToken("");
    settings.set(next);
    persist();
    connections.stopUnconfiguredAsync();
    log.info("[talkalert] bot token cleared");
  }

  /**
   * Plays a sound on demand so the user can check a file and volume.
   *
   * @param ruleId the selected rule, or blank for {@link #TEST_RULE_ID}
   * @return false when muted and nothing was played
   */
  public boolean testPlayback(String soundPath, int volume, String ruleId)
      throws PlaybackUnavailableException {
    if (!Rule.isAllowedSoundPath(soundPath)) {
      throw new InvalidSoundExtensionException(soundPath);
    }
    if (settings.get().muted()) return false;

    String id = Objects.toString(ruleId, "").trim();
    playback.play(soundPath, volume, id.isEmpty() ? TEST_RULE_ID : id);
    return true;
  }

  /** Sends a test push in the background; {@code onResult} runs on the control thread. */
  public void testPush(String appToken, String userKey, Consumer<PushResult> onResult) {
    Consumer<PushResult> sink = onResult != null ? onResult : r -> {};
    CompletableFuture.supplyAsync(
            () -> push.send(appToken, userKey, null, TEST_PUSH_MESSAGE, null, null),
            pushTestExecutor)
        .whenComplete(
            (result, err) -> {
              PushResult r = result;
              if (err != null) {
                log.warn("[talkalert] test push failed", err);
                r = PushResult.failed(Objects.toString(err.getMessage(), "Test push failed"));
              }
              PushResult delivered = r;
              marshal.post(() -> sink.accept(delivered));
            });
  }

  public void adjustLiveVolume(String ruleId, int volume) {
    if (settings.get().muted()) return;
    playback.setLiveVolume(ruleId, volume);
  }

  /** Writes the current settings and rules to the runtime config file. */
  public void persist() {
    store.save(settings.get(), rules.all());
  }

  private static Settings applyPreferences(Settings cur, SettingsUpdate u) {
    return cur.withPreferences(
        u.trayOnMinimize(),
        u.pushEnabled(),
        u.pushUserKey(),
        u.pushAppToken(),
        u.pushWhenMuted(),
        u.pushIncludeMessage());
  }
}
