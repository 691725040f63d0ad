package cafe.woden.talkalert.config;

import cafe.woden.talkalert.model.Rule;
import cafe.woden.talkalert.model.Settings;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads and writes the user's runtime state (settings + ordered rule list) as YAML.
 *
 * <p>Loading never fails: unreadable documents load as defaults, unreadable rules are skipped.
 * Documents written by the legacy flat JSON-style layout (schema 1) are migrated on read and
 * rewritten in the current layout on the next save.
 */
@Component
public class RuntimeConfigStore {

  private static final Logger log = LoggerFactory.getLogger(RuntimeConfigStore.class);

  public static final int SCHEMA_VERSION = 2;

  private final Path file;
  private final Yaml yaml;

  @Autowired
  public RuntimeConfigStore(TalkAlertProperties properties) {
    this(properties != null ? properties.runtimeConfig() : TalkAlertProperties.defaults().runtimeConfig());
  }

  public RuntimeConfigStore(String filePath) {
    this.file = Paths.get(Objects.requireNonNullElse(filePath, "").trim());

    DumperOptions opts = new DumperOptions();
    opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    opts.setPrettyFlow(true);
    opts.setIndent(2);
    // SnakeYAML requires indicatorIndent < indent.
    opts.setIndicatorIndent(1);
    opts.setDefaultScalarStyle(DumperOptions.ScalarStyle.PLAIN);
    this.yaml = new Yaml(opts);
  }

  public Path runtimeConfigPath() {
    return file;
  }

  /** Loads the persisted state, falling back to defaults for anything missing or malformed. */
  public synchronized StoredState load() {
    if (file.toString().isBlank() || !Files.exists(file)) {
      return StoredState.empty();
    }

    Map<String, Object> doc;
    try {
      doc = loadFile();
    } catch (Exception e) {
      log.warn("[talkalert] runtime config '{}' is unreadable; starting with defaults", file, e);
      return StoredState.empty();
    }

    try {
      if (schemaVersion(doc) < SCHEMA_VERSION) {
        log.info("[talkalert] migrating legacy runtime config '{}'", file);
        doc = migrateLegacy(doc);
      }
      return new StoredState(readSettings(doc), readRules(doc));
    } catch (Exception e) {
      log.warn("[talkalert] runtime config '{}' is malformed; starting with defaults", file, e);
      return StoredState.empty();
    }
  }

  /** Writes settings and rules together so the file never holds a half-applied change. */
  public synchronized void save(Settings settings, List<Rule> rules) {
    try {
      if (file.toString().isBlank()) return;

      Map<String, Object> doc = new LinkedHashMap<>();
      doc.put("schemaVersion", SCHEMA_VERSION);
      doc.put("settings", toSettingsMap(settings != null ? settings : Settings.defaults()));

      List<Map<String, Object>> out = new ArrayList<>();
      if (rules != null) {
        for (Rule r : rules) {
          if (r == null) continue;
          out.add(toRuleMap(r));
        }
      }
      doc.put("rules", out);

      writeFile(doc);
    } catch (Exception e) {
      log.warn("[talkalert] Could not persist runtime config to '{}'", file, e);
    }
  }

  private static int schemaVersion(Map<String, Object> doc) {
    Object v = doc.get("schemaVersion");
    if (v instanceof Number n) return n.intValue();
    if (v instanceof String s) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException ignored) {
        return 1;
      }
    }
    return 1;
  }

  /**
   * Maps the legacy flat layout onto the current one.
   *
   * <p>Legacy installs stored a single global {@code pushover_sound}; it becomes the push sound of
   * every rule that has none of its own.
   */
  static Map<String, Object> migrateLegacy(Map<String, Object> legacy) {
    Map<String, Object> settings = new LinkedHashMap<>();
    copyIfPresent(legacy, "mute", settings, "muted");
    copyIfPresent(legacy, "token", settings, "authToken");
    copyIfPresent(legacy, "tray_on_minimize", settings, "trayOnMinimize");
    copyIfPresent(legacy, "pushover_enabled", settings, "pushEnabled");
    copyIfPresent(legacy, "pushover_user_key", settings, "pushUserKey");
    copyIfPresent(legacy, "pushover_app_token", settings, "pushAppToken");
    copyIfPresent(legacy, "pushover_push_when_muted", settings, "pushWhenMuted");
    copyIfPresent(legacy, "pushover_include_message", settings, "pushIncludeMessage");

    String legacyPushSound = asString(legacy.get("pushover_sound"));

    List<Map<String, Object>> rules = new ArrayList<>();
    Object rawRules = legacy.get("rules");
    if (rawRules instanceof List<?> list) {
      for (Object o : list) {
        if (!(o instanceof Map<?, ?> m)) continue;
        Map<String, Object> rule = new LinkedHashMap<>();
        rule.put("name", m.get("name"));
        rule.put("senderId", m.get("user_id"));
        rule.put("soundPath", m.get("sound_path"));
        if (m.containsKey("volume")) rule.put("volume", m.get("volume"));
        String pushSound = asString(m.get("pushover_sound"));
        rule.put("pushSound", pushSound.isEmpty() ? legacyPushSound : pushSound);
        rules.add(rule);
      }
    }

    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("schemaVersion", SCHEMA_VERSION);
    doc.put("settings", settings);
    doc.put("rules", rules);
    return doc;
  }

  private static Settings readSettings(Map<String, Object> doc) {
    Settings d = Settings.defaults();
    Object o = doc.get("settings");
    if (!(o instanceof Map<?, ?> s)) return d;

    return new Settings(
        asBoolean(s.get("muted")).orElse(d.muted()),
        asString(s.get("authToken")),
        asBoolean(s.get("trayOnMinimize")).orElse(d.trayOnMinimize()),
        asBoolean(s.get("pushEnabled")).orElse(d.pushEnabled()),
        asString(s.get("pushUserKey")),
        asString(s.get("pushAppToken")),
        asBoolean(s.get("pushWhenMuted")).orElse(d.pushWhenMuted()),
        asBoolean(s.get("pushIncludeMessage")).orElse(d.pushIncludeMessage()));
  }

  private static List<Rule> readRules(Map<String, Object> doc) {
    Object o = doc.get("rules");
    if (o == null) return List.of();
    if (!(o instanceof List<?> list)) {
      log.warn("[talkalert] 'rules' is not a list; ignoring it");
      return List.of();
    }

    List<Rule> out = new ArrayList<>();
    for (Object item : list) {
      if (!(item instanceof Map<?, ?> m)) continue;
      String senderId = asString(m.get("senderId"));
      if (senderId.isEmpty()) continue;
      out.add(
          new Rule(
              asString(m.get("name")),
              senderId,
              asString(m.get("soundPath")),
              asInt(m.get("volume")).orElse(Rule.DEFAULT_VOLUME),
              asString(m.get("pushSound"))));
    }
    return out;
  }

  private static Map<String, Object> toSettingsMap(Settings s) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("muted", s.muted());
    m.put("authToken", s.authToken());
    m.put("trayOnMinimize", s.trayOnMinimize());
    m.put("pushEnabled", s.pushEnabled());
    m.put("pushUserKey", s.pushUserKey());
    m.put("pushAppToken", s.pushAppToken());
    m.put("pushWhenMuted", s.pushWhenMuted());
    m.put("pushIncludeMessage", s.pushIncludeMessage());
    return m;
  }

  private static Map<String, Object> toRuleMap(Rule r) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("name", r.name());
    m.put("senderId", r.senderId());
    m.put("soundPath", r.soundPath());
    m.put("volume", r.volume());
    m.put("pushSound", r.pushSound());
    return m;
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> loadFile() throws IOException {
    try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Object o = yaml.load(r);
      if (o instanceof Map<?, ?> m) {
        return (Map<String, Object>) m;
      }
      return new LinkedHashMap<>();
    }
  }

  private void writeFile(Map<String, Object> doc) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
      yaml.dump(doc, w);
    }
    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
  }

  private static void copyIfPresent(
      Map<?, ?> from, String fromKey, Map<String, Object> to, String toKey) {
    if (from.containsKey(fromKey)) to.put(toKey, from.get(fromKey));
  }

  private static String asString(Object value) {
    return value == null ? "" : value.toString().trim();
  }

  private static Optional<Boolean> asBoolean(Object value) {
    if (value instanceof Boolean b) return Optional.of(b);
    if (value instanceof String s) {
      String t = s.trim();
      if (t.equalsIgnoreCase("true")) return Optional.of(Boolean.TRUE);
      if (t.equalsIgnoreCase("false")) return Optional.of(Boolean.FALSE);
    }
    if (value instanceof Number n) {
      int i = n.intValue();
      if (i == 0) return Optional.of(Boolean.FALSE);
      if (i == 1) return Optional.of(Boolean.TRUE);
    }
    return Optional.empty();
  }

  private static Optional<Integer> asInt(Object value) {
    if (value instanceof Number n) return Optional.of(n.intValue());
    if (value instanceof String s) {
      try {
        return Optional.of(Integer.parseInt(s.trim()));
      } catch (NumberFormatException ignored) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  /** Settings plus the ordered rule list, as persisted. */
  public record StoredState(Settings settings, List<Rule> rules) {
    public StoredState {
      if (settings == null) settings = Settings.defaults();
      rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static StoredState empty() {
      return new StoredState(Settings.defaults(), List.of());
    }
  }
}
