package cafe.woden.talkalert.rules;

import cafe.woden.talkalert.model.Rule;
import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ordered set of alert rules keyed by sender id.
 *
 * <p>Writers (the control thread) build a new immutable {@link Snapshot} under the table lock and
 * publish it through a volatile field. Readers on any thread ({@link #find}, {@link #all}) only ever
 * see a complete snapshot and never take the lock.
 */
@Component
public class RuleTable {

  private static final Logger log = LoggerFactory.getLogger(RuleTable.class);

  public static final String PROP_RULES = "rules";

  private final PropertyChangeSupport pcs = new PropertyChangeSupport(this);
  private final Object lock = new Object();
  private volatile Snapshot snapshot = Snapshot.EMPTY;

  public Optional<Rule> find(String senderId) {
    if (senderId == null) return Optional.empty();
    return Optional.ofNullable(snapshot.byId().get(senderId));
  }

  public List<Rule> all() {
    return snapshot.ordered();
  }

  public int size() {
    return snapshot.ordered().size();
  }

  public void add(Rule rule) {
    Rule r = validate(rule);
    List<Rule> published;
    synchronized (lock) {
      Snapshot cur = snapshot;
      if (cur.byId().containsKey(r.senderId())) {
        throw new DuplicateRuleKeyException(r.senderId());
      }
      List<Rule> next = new ArrayList<>(cur.ordered());
      next.add(r);
      published = publish(next);
    }
    fireChanged(published);
  }

  /**
   * Replaces the rule currently keyed by {@code oldSenderId}, keeping its position.
   *
   * <p>The new sender id may equal the old one; it may not equal any other rule's id.
   */
  public void update(String oldSenderId, Rule rule) {
    Rule r = validate(rule);
    String oldId = Objects.toString(oldSenderId, "").trim();
    List<Rule> published;
    synchronized (lock) {
      Snapshot cur = snapshot;
      if (!cur.byId().containsKey(oldId)) {
        throw new UnknownRuleException(oldId);
      }
      if (!r.senderId().equals(oldId) && cur.byId().containsKey(r.senderId())) {
        throw new DuplicateRuleKeyException(r.senderId());
      }
      List<Rule> next = new ArrayList<>(cur.ordered().size());
      for (Rule existing : cur.ordered()) {
        next.add(existing.senderId().equals(oldId) ? r : existing);
      }
      published = publish(next);
    }
    fireChanged(published);
  }

  public void remove(String senderId) {
    if (senderId == null) return;
    List<Rule> published;
    synchronized (lock) {
      Snapshot cur = snapshot;
      if (!cur.byId().containsKey(senderId)) return;
      List<Rule> next = new ArrayList<>(cur.ordered());
      next.removeIf(r -> r.senderId().equals(senderId));
      published = publish(next);
    }
    fireChanged(published);
  }

  /** Reorders rules to match {@code senderIds}, which must be a permutation of the current ids. */
  public void reorder(List<String> senderIds) {
    List<String> ids = senderIds == null ? List.of() : senderIds;
    List<Rule> published;
    synchronized (lock) {
      Snapshot cur = snapshot;
      if (ids.size() != cur.ordered().size() || !cur.byId().keySet().containsAll(ids)) {
        throw new RuleValidationException("Reorder must list every existing sender id exactly once.");
      }
      List<Rule> next = new ArrayList<>(ids.size());
      Set<String> seen = new HashSet<>();
      for (String id : ids) {
        if (!seen.add(id)) {
          throw new RuleValidationException("Reorder lists sender '" + id + "' twice.");
        }
        next.add(cur.byId().get(id));
      }
      published = publish(next);
    }
    fireChanged(published);
  }

  /**
   * Replaces the whole table, typically with rules loaded from disk.
   *
   * <p>Unlike {@link #add}, bad entries are skipped (and logged) instead of rejected, so a partially
   * damaged config still yields every usable rule.
   */
  public void replaceAll(List<Rule> rules) {
    List<Rule> accepted = new ArrayList<>();
    Set<String> ids = new HashSet<>();
    if (rules != null) {
      for (Rule r : rules) {
        if (r == null || r.senderId().isEmpty()) continue;
        if (!ids.add(r.senderId())) {
          log.warn("[talkalert] skipping duplicate rule for sender {}", r.senderId());
          continue;
        }
        accepted.add(r);
      }
    }
    List<Rule> published;
    synchronized (lock) {
      published = publish(accepted);
    }
    fireChanged(published);
  }

  public void addListener(PropertyChangeListener l) {
    pcs.addPropertyChangeListener(l);
  }

  public void removeListener(PropertyChangeListener l) {
    pcs.removePropertyChangeListener(l);
  }

  private List<Rule> publish(List<Rule> next) {
    Snapshot s = Snapshot.of(next);
    this.snapshot = s;
    return s.ordered();
  }

  private void fireChanged(List<Rule> rules) {
    pcs.firePropertyChange(PROP_RULES, null, rules);
  }

  private static Rule validate(Rule rule) {
    Objects.requireNonNull(rule, "rule");
    if (rule.senderId().isEmpty()) {
      throw new RuleValidationException("Sender id is required.");
    }
    if (!rule.hasAllowedSoundExtension()) {
      throw new InvalidSoundExtensionException(rule.soundPath());
    }
    return rule;
  }

  private record Snapshot(List<Rule> ordered, Map<String, Rule> byId) {
    static final Snapshot EMPTY = new Snapshot(List.of(), Map.of());

    static Snapshot of(List<Rule> rules) {
      Map<String, Rule> index = new LinkedHashMap<>();
      for (Rule r : rules) index.put(r.senderId(), r);
      return new Snapshot(List.copyOf(rules), Collections.unmodifiableMap(index));
    }
  }
}
