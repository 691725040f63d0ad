package cafe.woden.talkalert.util;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating app-owned executors/threads on named daemon threads. */
public final class DaemonThreads {
  private static final Set<ExecutorService> TRACKED_EXECUTORS = ConcurrentHashMap.newKeySet();

  private DaemonThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger counter = new AtomicInteger(1);
    return r -> {
      Thread t = new Thread(r, base + "-" + counter.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  public static ExecutorService newSingleThreadExecutor(String baseName) {
    return track(Executors.newSingleThreadExecutor(namedFactory(baseName)));
  }

  public static ScheduledExecutorService newSingleThreadScheduledExecutor(String baseName) {
    return track(Executors.newSingleThreadScheduledExecutor(namedFactory(baseName)));
  }

  /** Unbounded pool that reuses idle threads; each submitted task runs independently. */
  public static ExecutorService newThreadPerTaskExecutor(String baseName) {
    return track(Executors.newCachedThreadPool(namedFactory(baseName)));
  }

  public static Thread start(String name, Runnable task) {
    Thread t = unstarted(name, task);
    t.start();
    return t;
  }

  public static Thread unstarted(String name, Runnable task) {
    Thread t = new Thread(task, normalize(name));
    t.setDaemon(true);
    return t;
  }

  public static int shutdownTrackedExecutorsNow() {
    int count = 0;
    for (ExecutorService exec : List.copyOf(TRACKED_EXECUTORS)) {
      if (exec == null) continue;
      if (exec.isShutdown() || exec.isTerminated()) continue;
      exec.shutdownNow();
      count++;
    }
    TRACKED_EXECUTORS.clear();
    return count;
  }

  private static <E extends ExecutorService> E track(E exec) {
    TRACKED_EXECUTORS.removeIf(e -> e == null || e.isShutdown() || e.isTerminated());
    TRACKED_EXECUTORS.add(exec);
    return exec;
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "talkalert-thread" : s;
  }
}
