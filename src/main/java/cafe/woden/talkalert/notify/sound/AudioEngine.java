package cafe.woden.talkalert.notify.sound;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A single audio output slot.
 *
 * <p>Loading a new source replaces the previous one. Calls come from the control thread; the
 * {@link #onFinished} callback fires on the engine's own thread when a loaded source plays to its
 * end (never for an explicit {@link #stop()}).
 */
public interface AudioEngine {

  /** Prepares the output device. Returns false when no audio output is usable. */
  boolean init();

  void load(Path path) throws IOException;

  /** Sets output gain, 0.0 (silent) to 1.0 (full). */
  void setVolume(float volume);

  void play();

  void stop();

  boolean isBusy();

  void onFinished(Runnable callback);

  void shutdown();
}
