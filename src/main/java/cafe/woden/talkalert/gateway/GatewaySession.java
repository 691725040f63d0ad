package cafe.woden.talkalert.gateway;

import java.time.Duration;

/** One live login. Closing it ends the event stream with {@link GatewayListener#onClosed()}. */
public interface GatewaySession {

  /** Id of the account this session is logged in as, or empty before it is known. */
  String selfId();

  /** Requests a graceful close. Returns immediately. */
  void close();

  /** Drops the connection without waiting for in-flight work. */
  void forceClose();

  /**
   * Blocks until the session has fully closed or {@code timeout} elapses.
   *
   * @return true if the session closed in time
   */
  boolean awaitClosed(Duration timeout) throws InterruptedException;
}
