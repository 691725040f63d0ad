package cafe.woden.talkalert.app;

/** Coarse gateway connection state as shown to the user. */
public enum ConnectionState {
  OFFLINE,
  CONNECTING,
  ONLINE
}
