package cafe.woden.talkalert.app;

import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;

/**
 * FIFO hand-off of callbacks onto the single control thread.
 *
 * <p>Background workers never touch control-thread state directly; they {@link #post} a callback
 * instead. Callbacks run one at a time, strictly in submission order.
 */
public interface EventMarshal {

  void post(Runnable callback);

  boolean isControlThread();

  /** Runs {@code callback} inline when already on the control thread, otherwise posts it. */
  default void runOrPost(Runnable callback) {
    if (isControlThread()) {
      callback.run();
    } else {
      post(callback);
    }
  }

  /** RxJava view of this marshal, for {@code observeOn}. */
  default Scheduler scheduler() {
    return Schedulers.from(this::post);
  }
}
