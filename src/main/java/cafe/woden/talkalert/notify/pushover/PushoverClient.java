package cafe.woden.talkalert.notify.pushover;

import cafe.woden.talkalert.config.ExecutorConfig;
import cafe.woden.talkalert.config.TalkAlertProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Pushover message API client.
 *
 * <p>One POST per call, bounded by the configured timeout, never retried. Failures come back as a
 * {@link PushResult}; nothing is thrown to callers.
 */
@Component
public class PushoverClient {

  private static final Logger log = LoggerFactory.getLogger(PushoverClient.class);

  private final TalkAlertProperties.Push properties;
  private final ExecutorService executor;
  private final ObjectMapper mapper = new ObjectMapper();
  private final HttpClient http;

  public PushoverClient(
      TalkAlertProperties properties,
      @Qualifier(ExecutorConfig.PUSH_NOTIFICATION_EXECUTOR) ExecutorService executor) {
    this.properties =
        (properties != null ? properties : TalkAlertProperties.defaults()).push();
    this.executor = Objects.requireNonNull(executor, "executor");
    this.http = HttpClient.newBuilder().connectTimeout(this.properties.timeout()).build();
  }

  public PushResult send(
      String appToken, String userKey, String title, String message, String url, String sound) {
    String token = Objects.toString(appToken, "").trim();
    String user = Objects.toString(userKey, "").trim();
    if (token.isEmpty() || user.isEmpty()) {
      return PushResult.failed("Pushover app token and user key are required.");
    }

    Map<String, String> form = new LinkedHashMap<>();
    form.put("token", token);
    form.put("user", user);
    String t = Objects.toString(title, "").trim();
    form.put("title", t.isEmpty() ? properties.title() : t);
    form.put("message", Objects.toString(message, ""));
    String u = Objects.toString(url, "").trim();
    if (!u.isEmpty()) {
      form.put("url", u);
      form.put("url_title", properties.urlTitle());
    }
    String s = Objects.toString(sound, "").trim();
    if (!s.isEmpty()) form.put("sound", s);

    return post(form);
  }

  /** Runs {@link #send} on the push executor. */
  public CompletableFuture<PushResult> sendAsync(
      String appToken, String userKey, String title, String message, String url, String sound) {
    return CompletableFuture.supplyAsync(
        () -> send(appToken, userKey, title, message, url, sound), executor);
  }

  private PushResult post(Map<String, String> form) {
    try {
      HttpRequest request =
          HttpRequest.newBuilder(URI.create(properties.endpoint()))
              .timeout(properties.timeout())
              .header("Content-Type", "application/x-www-form-urlencoded")
              .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form), StandardCharsets.UTF_8))
              .build();

      HttpResponse<String> response =
          http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      return interpret(response.statusCode(), Objects.toString(response.body(), ""));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return PushResult.failed("Interrupted");
    } catch (Exception e) {
      log.debug("[talkalert] Pushover request failed", e);
      String msg = Objects.toString(e.getMessage(), "").trim();
      if (msg.isEmpty()) msg = e.getClass().getSimpleName();
      return PushResult.failed(msg);
    }
  }

  PushResult interpret(int status, String body) {
    JsonNode json;
    try {
      json = body.isBlank() ? null : mapper.readTree(body);
    } catch (JsonProcessingException e) {
      json = null;
    }

    if (status < 200 || status >= 300) {
      String reason = json != null ? joinErrors(json) : "";
      if (reason.isEmpty()) reason = "HTTP " + status;
      log.warn("[talkalert] Pushover request failed: status={} reason={}", status, reason);
      return PushResult.failed(reason);
    }

    // Anything 2xx that is not a JSON object is taken as delivered.
    if (json == null || !json.isObject()) {
      return PushResult.delivered("Push sent (HTTP " + status + ").");
    }
    if (json.path("status").asInt(0) != 1) {
      String reason = joinErrors(json);
      if (reason.isEmpty()) reason = "Pushover rejected the message.";
      log.warn("[talkalert] Pushover rejected message: {}", reason);
      return PushResult.failed(reason);
    }
    return PushResult.delivered("Push sent.");
  }

  private static String joinErrors(JsonNode json) {
    JsonNode errors = json.path("errors");
    List<String> parts = new ArrayList<>();
    if (errors.isArray()) {
      for (JsonNode e : errors) {
        String s = e.asText("").trim();
        if (!s.isEmpty()) parts.add(s);
      }
    } else if (errors.isTextual()) {
      parts.add(errors.asText().trim());
    }
    return String.join("; ", parts);
  }

  private static String encodeForm(Map<String, String> form) {
    StringBuilder sb = new StringBuilder(256);
    for (Map.Entry<String, String> e : form.entrySet()) {
      if (sb.length() > 0) sb.append('&');
      sb.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8));
      sb.append('=');
      sb.append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
    }
    return sb.toString();
  }

  public record PushResult(boolean delivered, String reason) {
    public static PushResult delivered(String reason) {
      return new PushResult(true, Objects.toString(reason, "").trim());
    }

    public static PushResult failed(String reason) {
      return new PushResult(false, Objects.toString(reason, "").trim());
    }
  }
}
