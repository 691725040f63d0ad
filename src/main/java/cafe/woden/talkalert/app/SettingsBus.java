package cafe.woden.talkalert.app;

import cafe.woden.talkalert.model.Settings;
import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import org.springframework.stereotype.Component;

/**
 * Holds the current {@link Settings}.
 *
 * <p>Only the control thread calls {@link #set}; any thread may {@link #get} the latest immutable
 * value.
 */
@Component
public class SettingsBus {

  public static final String PROP_SETTINGS = "settings";

  private final PropertyChangeSupport pcs = new PropertyChangeSupport(this);
  private volatile Settings current = Settings.defaults();

  public Settings get() {
    return current;
  }

  public void set(Settings next) {
    Settings safe = next != null ? next : Settings.defaults();
    Settings prev = this.current;
    this.current = safe;
    pcs.firePropertyChange(PROP_SETTINGS, prev, safe);
  }

  public void addListener(PropertyChangeListener l) {
    pcs.addPropertyChangeListener(l);
  }

  public void removeListener(PropertyChangeListener l) {
    pcs.removePropertyChangeListener(l);
  }
}
