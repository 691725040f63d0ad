package cafe.woden.talkalert.app;

import cafe.woden.talkalert.util.DaemonThreads;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit FIFO queue of callbacks.
 *
 * <p>Either {@link #start()} a dedicated control-loop thread that drains it forever, or leave it
 * unstarted and call {@link #drainPending()} from the thread that should act as the control thread
 * (tests do this to step the queue deterministically).
 */
public final class QueuedEventMarshal implements EventMarshal, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(QueuedEventMarshal.class);

  private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
  private final ThreadLocal<Boolean> draining = ThreadLocal.withInitial(() -> Boolean.FALSE);
  private final Scheduler scheduler = Schedulers.from(this::post);
  private final String threadName;

  private volatile Thread loop;
  private volatile boolean running;

  public QueuedEventMarshal() {
    this("talkalert-control");
  }

  public QueuedEventMarshal(String threadName) {
    this.threadName = threadName;
  }

  @Override
  public void post(Runnable callback) {
    if (callback == null) return;
    queue.add(callback);
  }

  @Override
  public boolean isControlThread() {
    Thread t = loop;
    if (t != null) return Thread.currentThread() == t;
    return draining.get();
  }

  @Override
  public Scheduler scheduler() {
    return scheduler;
  }

  /** Starts the dedicated control thread. Calling it again is a no-op. */
  public synchronized void start() {
    if (loop != null) return;
    running = true;
    loop =
        DaemonThreads.start(
            threadName,
            () -> {
              while (running) {
                Runnable next;
                try {
                  next = queue.poll(200, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                  return;
                }
                if (next != null) runSafely(next);
              }
            });
  }

  /**
   * Runs every callback queued so far, plus any they enqueue, on the calling thread.
   *
   * @return the number of callbacks executed
   */
  public int drainPending() {
    if (loop != null) {
      throw new IllegalStateException("Queue is owned by the control thread " + loop.getName());
    }
    int count = 0;
    draining.set(Boolean.TRUE);
    try {
      Runnable next;
      while ((next = queue.poll()) != null) {
        runSafely(next);
        count++;
      }
    } finally {
      draining.set(Boolean.FALSE);
    }
    return count;
  }

  public int pendingCount() {
    return queue.size();
  }

  @Override
  public synchronized void close() {
    running = false;
    Thread t = loop;
    if (t != null) t.interrupt();
  }

  private static void runSafely(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      log.warn("[talkalert] control-thread callback failed", e);
    }
  }
}
