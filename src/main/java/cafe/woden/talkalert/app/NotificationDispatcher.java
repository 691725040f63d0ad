package cafe.woden.talkalert.app;

import cafe.woden.talkalert.gateway.InboundMessage;
import cafe.woden.talkalert.model.Rule;
import cafe.woden.talkalert.model.Settings;
import cafe.woden.talkalert.notify.pushover.PushoverClient;
import cafe.woden.talkalert.notify.sound.PlaybackController;
import cafe.woden.talkalert.notify.sound.PlaybackUnavailableException;
import cafe.woden.talkalert.rules.RuleTable;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one inbound message into alerts.
 *
 * <p>Called on gateway threads. Playback is posted to the control thread and push runs on the push
 * executor, so neither branch waits on the other or on the caller.
 */
@Service
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  static final String FALLBACK_WHO = "User";
  static final String EMPTY_TEXT_PLACEHOLDER = "(no text)";

  private final RuleTable rules;
  private final SettingsBus settings;
  private final PlaybackController playback;
  private final PushoverClient push;
  private final EventMarshal marshal;

  public NotificationDispatcher(
      RuleTable rules,
      SettingsBus settings,
      PlaybackController playback,
      PushoverClient push,
      EventMarshal marshal) {
    this.rules = rules;
    this.settings = settings;
    this.playback = playback;
    this.push = push;
    this.marshal = marshal;
  }

  public void dispatch(InboundMessage message) {
    if (message == null) return;
    dispatch(
        message.senderId(),
        message.senderDisplayName(),
        message.locationLabel(),
        message.text(),
        message.jumpUrl());
  }

  public void dispatch(
      String senderId, String senderDisplayName, String locationLabel, String text, String jumpUrl) {
    Optional<Rule> match = rules.find(senderId);
    if (match.isEmpty()) return;
    Rule rule = match.get();
    Settings s = settings.get();

    if (!s.muted()) {
      marshal.post(() -> playAlert(rule));
    }

    if (s.pushConfigured() && (!s.muted() || s.pushWhenMuted())) {
      String body =
          composeBody(rule, senderDisplayName, locationLabel, text, s.pushIncludeMessage());
      push.sendAsync(
              s.pushAppToken(), s.pushUserKey(), null, body, jumpUrl, rule.pushSound())
          .whenComplete(
              (result, err) -> {
                if (err != null) {
                  log.warn("[talkalert] push for {} failed", rule.senderId(), err);
                } else if (result.delivered()) {
                  log.debug("[talkalert] push for {} sent", rule.senderId());
                } else {
                  log.warn("[talkalert] push for {} not delivered: {}", rule.senderId(), result.reason());
                }
              });
    }
  }

  private void playAlert(Rule rule) {
    // Mute may have been switched on while this callback was queued.
    if (settings.get().muted()) return;
    try {
      playback.play(rule.soundPath(), rule.volume(), rule.senderId());
    } catch (PlaybackUnavailableException e) {
      log.warn("[talkalert] alert sound for {} not played: {}", rule.senderId(), e.getMessage());
    } catch (RuntimeException e) {
      log.warn("[talkalert] alert sound for {} failed", rule.senderId(), e);
    }
  }

  static String composeBody(
      Rule rule,
      String senderDisplayName,
      String locationLabel,
      String text,
      boolean includeMessage) {
    String who = rule.hasName() ? rule.name() : Objects.toString(senderDisplayName, "").trim();
    if (who.isEmpty()) who = FALLBACK_WHO;
    String where = Objects.toString(locationLabel, "").trim();

    String head = who + " @ " + where;
    if (!includeMessage) return head;

    String t = Objects.toString(text, "").trim();
    return head + ": " + (t.isEmpty() ? EMPTY_TEXT_PLACEHOLDER : t);
  }
}
