package cafe.woden.talkalert.gateway.jda;

import cafe.woden.talkalert.gateway.GatewaySession;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import net.dv8tion.jda.api.JDA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class JdaGatewaySession implements GatewaySession {
  private static final Logger log = LoggerFactory.getLogger(JdaGatewaySession.class);

  private final AtomicReference<JDA> jdaRef = new AtomicReference<>();
  private final CountDownLatch closed = new CountDownLatch(1);
  private volatile String selfId = "";

  void attach(JDA jda) {
    jdaRef.set(jda);
    try {
      rememberSelfId(jda.getSelfUser().getId());
    } catch (IllegalStateException e) {
      // Self user arrives with the ready event instead.
      log.debug("[talkalert] self user not yet known", e);
    }
  }

  void rememberSelfId(String id) {
    if (id != null && !id.isBlank()) selfId = id;
  }

  void markClosed() {
    closed.countDown();
  }

  @Override
  public String selfId() {
    return selfId;
  }

  @Override
  public void close() {
    JDA jda = jdaRef.get();
    if (jda == null) {
      markClosed();
      return;
    }
    jda.shutdown();
  }

  @Override
  public void forceClose() {
    JDA jda = jdaRef.get();
    try {
      if (jda != null) jda.shutdownNow();
    } finally {
      markClosed();
    }
  }

  @Override
  public boolean awaitClosed(Duration timeout) throws InterruptedException {
    return closed.await(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
  }
}
