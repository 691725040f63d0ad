package cafe.woden.talkalert.notify.sound;

/** Audio output is not ready, or the requested source could not be loaded. */
public class PlaybackUnavailableException extends Exception {

  public PlaybackUnavailableException(String message) {
    super(message);
  }

  public PlaybackUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
