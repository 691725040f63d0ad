package cafe.woden.talkalert.notify.sound;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.FloatControl;
import javax.sound.sampled.LineEvent;
import javax.sound.sampled.LineListener;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link AudioEngine} on {@code javax.sound.sampled}.
 *
 * <p>Sources are decoded to 16-bit signed PCM up front and held in one {@link Clip}. MP3 decoding
 * comes from whichever service provider is on the classpath (mp3spi in the packaged app).
 */
@Component
public class JavaSoundAudioEngine implements AudioEngine {

  private static final Logger log = LoggerFactory.getLogger(JavaSoundAudioEngine.class);

  private static final float MIN_GAIN_DB = -80f;

  private final Object lock = new Object();

  private Clip clip;
  private LineListener clipListener;
  private float volume = 1.0f;
  private volatile boolean ready;
  private volatile boolean stopRequested;
  private volatile Runnable finishedCallback = () -> {};

  @Override
  public boolean init() {
    if (ready) return true;
    try {
      Mixer.Info[] mixers = AudioSystem.getMixerInfo();
      if (mixers == null || mixers.length == 0) {
        log.warn("[talkalert] no audio mixers available; playback disabled");
        return false;
      }
      Clip probe = AudioSystem.getClip();
      probe.close();
      ready = true;
      return true;
    } catch (LineUnavailableException | IllegalArgumentException | SecurityException e) {
      log.warn("[talkalert] audio output unavailable: {}", e.toString());
      log.debug("[talkalert] audio init failure", e);
      return false;
    }
  }

  @Override
  public void load(Path path) throws IOException {
    if (!ready) throw new IOException("Audio engine is not initialized");
    if (path == null || !Files.isRegularFile(path)) {
      throw new IOException("Sound file not found: " + path);
    }

    byte[] pcm;
    AudioFormat format;
    try (InputStream in = new BufferedInputStream(Files.newInputStream(path));
        AudioInputStream original = AudioSystem.getAudioInputStream(in);
        AudioInputStream decoded = toPcm16(original)) {
      format = decoded.getFormat();
      pcm = decoded.readAllBytes();
    } catch (UnsupportedAudioFileException e) {
      throw new IOException("Unsupported audio format: " + path.getFileName(), e);
    }

    synchronized (lock) {
      releaseClip();
      try {
        Clip next = AudioSystem.getClip();
        next.open(format, pcm, 0, pcm.length);
        LineListener listener = event -> onLineEvent(next, event);
        next.addLineListener(listener);
        clip = next;
        clipListener = listener;
        applyGain(next, volume);
      } catch (LineUnavailableException | IllegalArgumentException e) {
        throw new IOException("Audio line unavailable: " + e.getMessage(), e);
      }
    }
  }

  @Override
  public void setVolume(float next) {
    synchronized (lock) {
      volume = Math.max(0f, Math.min(1f, next));
      if (clip != null) applyGain(clip, volume);
    }
  }

  @Override
  public void play() {
    synchronized (lock) {
      if (clip == null) return;
      stopRequested = false;
      clip.setFramePosition(0);
      clip.start();
    }
  }

  @Override
  public void stop() {
    synchronized (lock) {
      stopRequested = true;
      if (clip != null && clip.isRunning()) clip.stop();
    }
  }

  @Override
  public boolean isBusy() {
    synchronized (lock) {
      return clip != null && clip.isRunning();
    }
  }

  @Override
  public void onFinished(Runnable callback) {
    finishedCallback = callback != null ? callback : () -> {};
  }

  @Override
  public void shutdown() {
    synchronized (lock) {
      stopRequested = true;
      releaseClip();
      ready = false;
    }
  }

  private void onLineEvent(Clip source, LineEvent event) {
    if (event == null || event.getType() != LineEvent.Type.STOP) return;
    synchronized (lock) {
      // Stale clips and explicit stops are not completions.
      if (source != clip || stopRequested) return;
    }
    try {
      finishedCallback.run();
    } catch (RuntimeException e) {
      log.debug("[talkalert] playback completion callback failed", e);
    }
  }

  private void releaseClip() {
    Clip c = clip;
    clip = null;
    if (c == null) return;
    if (clipListener != null) c.removeLineListener(clipListener);
    clipListener = null;
    if (c.isRunning()) c.stop();
    if (c.isOpen()) c.close();
  }

  private static AudioInputStream toPcm16(AudioInputStream original) {
    AudioFormat base = original.getFormat();
    boolean needsDecode =
        base.getEncoding() != AudioFormat.Encoding.PCM_SIGNED || base.getSampleSizeInBits() != 16;
    if (!needsDecode) return original;

    AudioFormat decodedFormat =
        new AudioFormat(
            AudioFormat.Encoding.PCM_SIGNED,
            base.getSampleRate(),
            16,
            base.getChannels(),
            base.getChannels() * 2,
            base.getSampleRate(),
            false);
    return AudioSystem.getAudioInputStream(decodedFormat, original);
  }

  private static void applyGain(Clip c, float volume) {
    if (c.isControlSupported(FloatControl.Type.MASTER_GAIN)) {
      FloatControl gain = (FloatControl) c.getControl(FloatControl.Type.MASTER_GAIN);
      float db = volume <= 0f ? MIN_GAIN_DB : (float) (20.0 * Math.log10(volume));
      gain.setValue(Math.max(gain.getMinimum(), Math.min(gain.getMaximum(), db)));
    } else if (c.isControlSupported(FloatControl.Type.VOLUME)) {
      FloatControl v = (FloatControl) c.getControl(FloatControl.Type.VOLUME);
      float scaled = v.getMinimum() + (v.getMaximum() - v.getMinimum()) * volume;
      v.setValue(scaled);
    } else {
      log.debug("[talkalert] clip has no gain control; volume ignored");
    }
  }
}
