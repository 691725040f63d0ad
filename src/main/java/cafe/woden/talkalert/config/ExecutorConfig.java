package cafe.woden.talkalert.config;

import cafe.woden.talkalert.util.DaemonThreads;
import java.util.concurrent.ExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>Each workload keeps its own executor so a stalled push never queues behind a restart, and
 * Spring owns creation and shutdown.
 */
@Configuration
public class ExecutorConfig {
  public static final String PUSH_NOTIFICATION_EXECUTOR = "pushNotificationExecutor";
  public static final String PUSH_TEST_EXECUTOR = "pushTestExecutor";
  public static final String CONNECTION_LIFECYCLE_EXECUTOR = "connectionLifecycleExecutor";

  @Bean(name = PUSH_NOTIFICATION_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService pushNotificationExecutor() {
    return DaemonThreads.newThreadPerTaskExecutor("talkalert-push");
  }

  @Bean(name = PUSH_TEST_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService pushTestExecutor() {
    return DaemonThreads.newSingleThreadExecutor("talkalert-push-test");
  }

  @Bean(name = CONNECTION_LIFECYCLE_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService connectionLifecycleExecutor() {
    return DaemonThreads.newSingleThreadExecutor("talkalert-connection-lifecycle");
  }
}
