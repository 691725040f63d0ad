package cafe.woden.talkalert.app;

import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import javax.swing.SwingUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Uses the Swing event dispatch thread as the control thread. */
public final class SwingEventMarshal implements EventMarshal {

  private static final Logger log = LoggerFactory.getLogger(SwingEventMarshal.class);

  private final Scheduler edt = Schedulers.from(this::post);

  @Override
  public void post(Runnable callback) {
    if (callback == null) return;
    SwingUtilities.invokeLater(
        () -> {
          try {
            callback.run();
          } catch (RuntimeException e) {
            log.warn("[talkalert] control-thread callback failed", e);
          }
        });
  }

  @Override
  public boolean isControlThread() {
    return SwingUtilities.isEventDispatchThread();
  }

  @Override
  public Scheduler scheduler() {
    return edt;
  }
}
