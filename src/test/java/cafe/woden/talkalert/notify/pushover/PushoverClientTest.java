package cafe.woden.talkalert.notify.pushover;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.talkalert.config.TalkAlertProperties;
import cafe.woden.talkalert.notify.pushover.PushoverClient.PushResult;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PushoverClientTest {

  private HttpServer server;
  private ExecutorService executor;
  private PushoverClient client;

  private final AtomicInteger requests = new AtomicInteger();
  private final CountDownLatch releaseStalled = new CountDownLatch(1);
  private ExecutorService serverThreads;
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private volatile int replyStatus = 200;
  private volatile String replyBody = "{\"status\":1,\"request\":\"abc\"}";

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/1/messages.json",
        exchange -> {
          requests.incrementAndGet();
          lastBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          byte[] out = replyBody.getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(replyStatus, out.length);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write(out);
          }
        });
    server.createContext(
        "/stall",
        exchange -> {
          try {
            releaseStalled.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          exchange.close();
        });
    serverThreads = Executors.newCachedThreadPool();
    server.setExecutor(serverThreads);
    server.start();

    String endpoint =
        "http://127.0.0.1:" + server.getAddress().getPort() + "/1/messages.json";
    TalkAlertProperties props =
        new TalkAlertProperties(
            "",
            null,
            new TalkAlertProperties.Push(endpoint, Duration.ofSeconds(5), null, null),
            null);
    executor = Executors.newSingleThreadExecutor();
    client = new PushoverClient(props, executor);
  }

  @AfterEach
  void tearDown() {
    releaseStalled.countDown();
    server.stop(0);
    serverThreads.shutdownNow();
    executor.shutdownNow();
  }

  @Test
  void statusOneIsDelivered() {
    PushResult r = client.send("app", "user", null, "hello", null, null);

    assertTrue(r.delivered());
    assertEquals(1, requests.get());
  }

  @Test
  void formCarriesDefaultTitleLinkAndSound() {
    client.send("app", "user", " ", "Alice @ DM: hi", "https://x/jump", "siren");

    Map<String, String> form = parseForm(lastBody.get());
    assertEquals("app", form.get("token"));
    assertEquals("user", form.get("user"));
    assertEquals("TalkAlert", form.get("title"));
    assertEquals("Alice @ DM: hi", form.get("message"));
    assertEquals("https://x/jump", form.get("url"));
    assertEquals("Open in Discord", form.get("url_title"));
    assertEquals("siren", form.get("sound"));
  }

  @Test
  void noLinkOrSoundFieldsWhenBlank() {
    client.send("app", "user", "Custom", "msg", "", "");

    Map<String, String> form = parseForm(lastBody.get());
    assertEquals("Custom", form.get("title"));
    assertFalse(form.containsKey("url"));
    assertFalse(form.containsKey("url_title"));
    assertFalse(form.containsKey("sound"));
  }

  @Test
  void rejectedMessageJoinsErrors() {
    replyBody = "{\"status\":0,\"errors\":[\"user key is invalid\",\"token is invalid\"]}";

    PushResult r = client.send("app", "user", null, "msg", null, null);

    assertFalse(r.delivered());
    assertEquals("user key is invalid; token is invalid", r.reason());
  }

  @Test
  void httpErrorWithoutJsonReportsStatus() {
    replyStatus = 500;
    replyBody = "oops";

    PushResult r = client.send("app", "user", null, "msg", null, null);

    assertFalse(r.delivered());
    assertEquals("HTTP 500", r.reason());
  }

  @Test
  void httpErrorWithJsonReportsErrors() {
    replyStatus = 400;
    replyBody = "{\"status\":0,\"errors\":[\"application token is invalid\"]}";

    assertEquals(
        "application token is invalid",
        client.send("app", "user", null, "msg", null, null).reason());
  }

  @Test
  void nonJsonSuccessCountsAsDelivered() {
    replyBody = "OK";

    assertTrue(client.send("app", "user", null, "msg", null, null).delivered());
  }

  @Test
  void missingCredentialsMakeNoRequest() {
    PushResult r = client.send(" ", "user", null, "msg", null, null);

    assertFalse(r.delivered());
    assertEquals("Pushover app token and user key are required.", r.reason());
    assertEquals(0, requests.get());
  }

  @Test
  void unreachableEndpointFailsWithoutThrowing() {
    server.stop(0);

    assertFalse(client.send("app", "user", null, "msg", null, null).delivered());
  }

  @Test
  void stalledServerFailsWithinConfiguredTimeout() {
    String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/stall";
    PushoverClient impatient =
        new PushoverClient(
            new TalkAlertProperties(
                "",
                null,
                new TalkAlertProperties.Push(endpoint, Duration.ofMillis(300), null, null),
                null),
            executor);

    long started = System.nanoTime();
    PushResult r = impatient.send("app", "user", null, "msg", null, null);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertFalse(r.delivered());
    assertFalse(r.reason().isEmpty());
    assertTrue(elapsedMs < 2000, "send took " + elapsedMs + " ms");
  }

  @Test
  void sendAsyncCompletesOnExecutor() throws Exception {
    PushResult r =
        client.sendAsync("app", "user", null, "msg", null, null).get(5, TimeUnit.SECONDS);

    assertTrue(r.delivered());
  }

  private static Map<String, String> parseForm(String body) {
    Map<String, String> out = new LinkedHashMap<>();
    for (String pair : body.split("&")) {
      int eq = pair.indexOf('=');
      out.put(
          URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
          URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
    }
    return out;
  }
}
