package cafe.woden.talkalert.app;

/** A settings form value was rejected; nothing was applied. */
public class InvalidSettingsException extends RuntimeException {

  public InvalidSettingsException(String message) {
    super(message);
  }
}
