package cafe.woden.talkalert.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One alert binding: messages from {@code senderId} play {@code soundPath} at {@code volume} and may
 * be forwarded as a push notification using {@code pushSound}.
 *
 * <p>{@code senderId} is an exact, case-sensitive key. Volume is clamped to 0..100 on every
 * construction, so every {@code with*} copy stays in range.
 */
@ValueObject
public record Rule(String name, String senderId, String soundPath, int volume, String pushSound) {

  public static final int DEFAULT_VOLUME = 100;
  public static final List<String> ALLOWED_SOUND_EXTENSIONS = List.of(".wav", ".mp3");

  public Rule {
    name = Objects.toString(name, "").trim();
    senderId = Objects.toString(senderId, "").trim();
    soundPath = Objects.toString(soundPath, "").trim();
    volume = clampVolume(volume);
    pushSound = Objects.toString(pushSound, "").trim();
  }

  public static Rule of(String senderId, String soundPath, int volume) {
    return new Rule("", senderId, soundPath, volume, "");
  }

  public Rule withVolume(int nextVolume) {
    return new Rule(name, senderId, soundPath, nextVolume, pushSound);
  }

  public Rule withPushSound(String nextPushSound) {
    return new Rule(name, senderId, soundPath, volume, nextPushSound);
  }

  public boolean hasName() {
    return !name.isEmpty();
  }

  public boolean hasPushSound() {
    return !pushSound.isEmpty();
  }

  public boolean hasAllowedSoundExtension() {
    return isAllowedSoundPath(soundPath);
  }

  public static boolean isAllowedSoundPath(String path) {
    String p = Objects.toString(path, "").trim().toLowerCase(Locale.ROOT);
    if (p.isEmpty()) return false;
    for (String ext : ALLOWED_SOUND_EXTENSIONS) {
      if (p.endsWith(ext)) return true;
    }
    return false;
  }

  public static int clampVolume(int volume) {
    return Math.max(0, Math.min(100, volume));
  }
}
