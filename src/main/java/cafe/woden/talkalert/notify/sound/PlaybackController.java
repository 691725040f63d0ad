package cafe.woden.talkalert.notify.sound;

import cafe.woden.talkalert.app.EventMarshal;
import cafe.woden.talkalert.model.Rule;
import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Serializes use of the single {@link AudioEngine} output slot and tracks what is sounding.
 *
 * <p>All methods are meant for the control thread. A new {@link #play} always replaces the current
 * playback. Natural completion is reported by the engine on its own thread and marshalled back
 * before {@link NowPlaying} is cleared.
 */
@Service
public class PlaybackController {

  private static final Logger log = LoggerFactory.getLogger(PlaybackController.class);

  private final AudioEngine engine;
  private final EventMarshal marshal;

  private volatile NowPlaying nowPlaying;
  private volatile Boolean engineReady;

  public PlaybackController(AudioEngine engine, EventMarshal marshal) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.marshal = Objects.requireNonNull(marshal, "marshal");
    this.engine.onFinished(() -> this.marshal.post(this::clearIfIdle));
  }

  public void play(String path, int volume, String ruleId) throws PlaybackUnavailableException {
    if (!ensureReady()) {
      throw new PlaybackUnavailableException("Audio output is not available");
    }
    String p = Objects.toString(path, "").trim();
    if (p.isEmpty()) {
      throw new PlaybackUnavailableException("No sound file set");
    }

    stop();

    int v = Rule.clampVolume(volume);
    try {
      engine.load(resolve(p));
    } catch (Exception e) {
      throw new PlaybackUnavailableException("Could not load '" + p + "': " + e.getMessage(), e);
    }
    engine.setVolume(v / 100f);
    engine.play();
    nowPlaying = new NowPlaying(Objects.toString(ruleId, ""), v);
    log.debug("[talkalert] playing {} at {} for {}", p, v, ruleId);
  }

  public void stop() {
    try {
      engine.stop();
    } catch (RuntimeException e) {
      log.debug("[talkalert] engine stop failed", e);
    }
    nowPlaying = null;
  }

  /**
   * Adjusts gain of the current playback when it belongs to {@code ruleId}; otherwise does nothing.
   */
  public void setLiveVolume(String ruleId, int volume) {
    NowPlaying cur = nowPlaying;
    if (cur == null || ruleId == null || !cur.ruleId().equals(ruleId)) return;

    int v = Rule.clampVolume(volume);
    engine.setVolume(v / 100f);
    nowPlaying = new NowPlaying(cur.ruleId(), v);
  }

  public Optional<NowPlaying> nowPlaying() {
    return Optional.ofNullable(nowPlaying);
  }

  @PreDestroy
  public void shutdown() {
    stop();
    try {
      engine.shutdown();
    } catch (RuntimeException e) {
      log.debug("[talkalert] engine shutdown failed", e);
    }
    engineReady = Boolean.FALSE;
  }

  private boolean ensureReady() {
    Boolean r = engineReady;
    if (r == null) {
      r = engine.init();
      engineReady = r;
      if (!r) log.warn("[talkalert] audio engine did not initialize; sounds will not play");
    }
    return r;
  }

  private void clearIfIdle() {
    if (nowPlaying != null && !engine.isBusy()) {
      nowPlaying = null;
    }
  }

  private static Path resolve(String path) {
    return Paths.get(path).toAbsolutePath().normalize();
  }
}
