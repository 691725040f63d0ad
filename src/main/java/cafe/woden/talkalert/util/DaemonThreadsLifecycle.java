package cafe.woden.talkalert.util;

import jakarta.annotation.PreDestroy;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Fallback shutdown hook for any app-owned executors created via {@link DaemonThreads}.
 */
@Component
@Lazy(false)
final class DaemonThreadsLifecycle {

  @PreDestroy
  void shutdown() {
    DaemonThreads.shutdownTrackedExecutorsNow();
  }
}
