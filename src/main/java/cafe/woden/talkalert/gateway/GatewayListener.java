package cafe.woden.talkalert.gateway;

/** Callbacks from a {@link GatewaySession}, invoked on gateway threads. */
public interface GatewayListener {

  void onReady(String selfId, String selfTag);

  void onDisconnect(String reason);

  /** The library re-established the session on its own after a drop. */
  void onResumed();

  void onMessage(InboundMessage message);

  /** The session is gone for good; no further callbacks follow. */
  void onClosed();
}
