package cafe.woden.talkalert.gateway;

/** Opens authenticated sessions against the chat gateway. */
public interface ChatGatewayClient {

  /**
   * Logs in with {@code token} and starts delivering events to {@code listener}.
   *
   * <p>The call may block while credentials are checked; connection progress afterwards arrives
   * only through the listener, on the gateway library's own threads.
   *
   * @throws GatewayException when the session cannot be established at all
   */
  GatewaySession open(String token, GatewayListener listener) throws GatewayException;
}
