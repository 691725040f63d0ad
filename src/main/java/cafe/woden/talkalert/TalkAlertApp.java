package cafe.woden.talkalert;

import cafe.woden.talkalert.app.ConnectionManager;
import cafe.woden.talkalert.app.EventMarshal;
import cafe.woden.talkalert.app.QueuedEventMarshal;
import cafe.woden.talkalert.app.SettingsBus;
import cafe.woden.talkalert.app.SwingEventMarshal;
import cafe.woden.talkalert.config.RuntimeConfigStore;
import cafe.woden.talkalert.config.RuntimeConfigStore.StoredState;
import cafe.woden.talkalert.config.TalkAlertProperties;
import cafe.woden.talkalert.rules.RuleTable;
import cafe.woden.talkalert.ui.MainWindow;
import java.awt.GraphicsEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(TalkAlertProperties.class)
public class TalkAlertApp {
  private static final Logger log = LoggerFactory.getLogger(TalkAlertApp.class);

  public static void main(String[] args) {
    new SpringApplicationBuilder(TalkAlertApp.class)
        .headless(GraphicsEnvironment.isHeadless())
        .run(args);
  }

  static boolean runsHeadless(TalkAlertProperties properties) {
    return properties.ui().headless() || GraphicsEnvironment.isHeadless();
  }

  /** The control thread: the EDT with a desktop, a dedicated queue thread without one. */
  @Bean
  public EventMarshal eventMarshal(TalkAlertProperties properties) {
    if (runsHeadless(properties)) {
      QueuedEventMarshal queue = new QueuedEventMarshal();
      queue.start();
      return queue;
    }
    return new SwingEventMarshal();
  }

  @Bean
  public ApplicationRunner run(
      TalkAlertProperties properties,
      RuntimeConfigStore runtimeConfig,
      SettingsBus settingsBus,
      RuleTable rules,
      ConnectionManager connections,
      EventMarshal marshal,
      ObjectProvider<MainWindow> windows) {
    return args -> {
      StoredState state = runtimeConfig.load();
      boolean headless = runsHeadless(properties);
      log.info(
          "[talkalert] loaded {} rule(s) from {}{}",
          state.rules().size(),
          runtimeConfig.runtimeConfigPath(),
          headless ? " (headless)" : "");

      marshal.post(
          () -> {
            settingsBus.set(state.settings());
            rules.replaceAll(state.rules());

            if (!headless) {
              MainWindow window = windows.getObject();
              window.setVisible(true);
            }

            connections.startAsync();
          });
    };
  }
}
