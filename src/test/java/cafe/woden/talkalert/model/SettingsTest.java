package cafe.woden.talkalert.model;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SettingsTest {

  @Test
  void pushNeedsSwitchAndBothCredentials() {
    Settings base = Settings.defaults();

    assertFalse(base.pushConfigured());
    assertFalse(base.withPreferences(true, true, "user", "", true, true).pushConfigured());
    assertFalse(base.withPreferences(true, false, "user", "app", true, true).pushConfigured());
    assertTrue(base.withPreferences(true, true, "user", "app", true, true).pushConfigured());
  }

  @Test
  void toStringNeverContainsCredentials() {
    Settings s =
        Settings.defaults()
            .withAuthToken("super-secret-token-value-123")
            .withPreferences(true, true, "user-key-xyz", "app-token-xyz", true, true);

    String text = s.toString();
    assertFalse(text.contains("super-secret-token-value-123"));
    assertFalse(text.contains("user-key-xyz"));
    assertFalse(text.contains("app-token-xyz"));
  }
}
