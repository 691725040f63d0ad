package cafe.woden.talkalert.gateway;

/** The gateway session could not be opened. The message is shown as connection status. */
public class GatewayException extends Exception {

  public GatewayException(String message) {
    super(message);
  }

  public GatewayException(String message, Throwable cause) {
    super(message, cause);
  }
}
