package cafe.woden.talkalert.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import cafe.woden.talkalert.config.RuntimeConfigStore;
import cafe.woden.talkalert.config.TalkAlertProperties;
import cafe.woden.talkalert.gateway.ChatGatewayClient;
import cafe.woden.talkalert.gateway.GatewaySession;
import cafe.woden.talkalert.model.Rule;
import cafe.woden.talkalert.model.Settings;
import cafe.woden.talkalert.notify.pushover.PushoverClient;
import cafe.woden.talkalert.notify.pushover.PushoverClient.PushResult;
import cafe.woden.talkalert.notify.sound.PlaybackController;
import cafe.woden.talkalert.rules.DuplicateRuleKeyException;
import cafe.woden.talkalert.rules.InvalidSoundExtensionException;
import cafe.woden.talkalert.rules.RuleTable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ControlSurfaceTest {

  private static final String TOKEN = "token-aaaaaaaaaaaaaaaaaaaa";

  @TempDir Path tempDir;

  private final RuleTable rules = new RuleTable();
  private final SettingsBus settings = new SettingsBus();
  private final PlaybackController playback = mock(PlaybackController.class);
  private final PushoverClient push = mock(PushoverClient.class);
  private final ConnectionManager connections = mock(ConnectionManager.class);
  private final QueuedEventMarshal marshal = new QueuedEventMarshal();
  private final ExecutorService pushTestExecutor = Executors.newSingleThreadExecutor();

  private RuntimeConfigStore store;
  private ControlSurface control;

  @BeforeEach
  void setUp() {
    store = new RuntimeConfigStore(tempDir.resolve("talkalert.yml").toString());
    control =
        new ControlSurface(
            rules,
            settings,
            store,
            playback,
            push,
            connections,
            marshal,
            TalkAlertProperties.defaults(),
            pushTestExecutor);
  }

  @AfterEach
  void tearDown() {
    pushTestExecutor.shutdownNow();
  }

  @Test
  void addRulePersistsImmediately() {
    control.addRule("Boss", "123", "ding.wav", 80, "siren");

    List<Rule> saved = store.load().rules();
    assertEquals(List.of(new Rule("Boss", "123", "ding.wav", 80, "siren")), saved);
  }

  @Test
  void duplicateRuleIsRejectedAndNothingChanges() {
    control.addRule("", "123", "ding.wav", 80, "");

    assertThrows(
        DuplicateRuleKeyException.class, () -> control.addRule("", "123", "other.mp3", 50, ""));
    assertEquals(1, store.load().rules().size());
  }

  @Test
  void updateAndReorderArePersisted() {
    control.addRule("", "1", "a.wav", 10, "");
    control.addRule("", "2", "b.wav", 20, "");

    control.updateRule("1", "First", "1", "a.mp3", 30, "");
    control.reorderRules(List.of("2", "1"));

    List<Rule> saved = store.load().rules();
    assertEquals("2", saved.get(0).senderId());
    assertEquals("First", saved.get(1).name());
    assertEquals("a.mp3", saved.get(1).soundPath());
  }

  @Test
  void shortTokenIsRejectedWithoutSideEffects() {
    assertThrows(InvalidSettingsException.class, () -> control.saveSettings(update("short")));

    assertFalse(settings.get().hasAuthToken());
    verifyNoInteractions(connections);
  }

  @Test
  void newTokenRestartsConnection() {
    control.saveSettings(update(TOKEN));

    assertEquals(TOKEN, settings.get().authToken());
    assertEquals(TOKEN, store.load().settings().authToken());
    verify(connections).restartAsync();
    verify(connections, never()).startAsync();
  }

  @Test
  void emptyTokenKeepsStoredTokenAndStarts() {
    settings.set(Settings.defaults().withAuthToken(TOKEN));

    control.saveSettings(update(""));

    assertEquals(TOKEN, settings.get().authToken());
    assertTrue(settings.get().pushEnabled());
    verify(connections).startAsync();
    verify(connections, never()).restartAsync();
    verify(connections, never()).start();
  }

  @Test
  void noTokenAtAllStopsAsUnconfigured() {
    control.saveSettings(update(""));

    verify(connections).stopUnconfiguredAsync();
    verify(connections, never()).startAsync();
  }

  @Test
  void savingUnchangedTokenDoesNotWaitForRestartInProgress() throws Exception {
    CountDownLatch opened = new CountDownLatch(1);
    CountDownLatch closed = new CountDownLatch(1);
    ChatGatewayClient ignoresGracefulClose =
        (token, listener) -> {
          opened.countDown();
          return new GatewaySession() {
            @Override
            public String selfId() {
              return "";
            }

            @Override
            public void close() {}

            @Override
            public void forceClose() {
              closed.countDown();
            }

            @Override
            public boolean awaitClosed(Duration timeout) throws InterruptedException {
              return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
          };
        };
    TalkAlertProperties props =
        new TalkAlertProperties(
            "",
            new TalkAlertProperties.Connection(Duration.ofSeconds(2), Duration.ZERO, null),
            null,
            null);
    ExecutorService lifecycle = Executors.newSingleThreadExecutor();
    ConnectionManager real =
        new ConnectionManager(
            ignoresGracefulClose,
            settings,
            mock(NotificationDispatcher.class),
            marshal,
            props,
            lifecycle);
    ControlSurface surface =
        new ControlSurface(
            rules, settings, store, playback, push, real, marshal, props, pushTestExecutor);
    settings.set(Settings.defaults().withAuthToken(TOKEN));

    try {
      real.start();
      assertTrue(opened.await(5, TimeUnit.SECONDS));
      real.restartAsync();
      // Give the restart time to take the lifecycle guard and begin its bounded stop.
      Thread.sleep(50);

      long started = System.nanoTime();
      surface.saveSettings(update(""));
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

      assertTrue(elapsedMs < 100, "saveSettings blocked for " + elapsedMs + " ms");
    } finally {
      closed.countDown();
      lifecycle.shutdownNow();
    }
  }

  @Test
  void clearTokenForgetsTokenAndStops() {
    settings.set(Settings.defaults().withAuthToken(TOKEN));

    control.clearToken(update(""));

    assertFalse(settings.get().hasAuthToken());
    assertFalse(store.load().settings().hasAuthToken());
    verify(connections).stopUnconfiguredAsync();
  }

  @Test
  void toggleMuteStopsPlaybackAndPersists() {
    assertTrue(control.toggleMute());
    assertTrue(store.load().settings().muted());
    assertFalse(control.toggleMute());
    assertFalse(store.load().settings().muted());

    verify(playback, times(2)).stop();
  }

  @Test
  void testPlaybackWhileMutedPlaysNothing() throws Exception {
    settings.set(Settings.defaults().withMuted(true));

    assertFalse(control.testPlayback("ding.wav", 50, ""));
    verify(playback, never()).play(anyString(), anyInt(), anyString());
  }

  @Test
  void testPlaybackRejectsUnsupportedExtension() {
    assertThrows(
        InvalidSoundExtensionException.class, () -> control.testPlayback("song.ogg", 50, ""));
  }

  @Test
  void testPlaybackWithoutRuleUsesTestId() throws Exception {
    assertTrue(control.testPlayback("ding.wav", 50, " "));
    verify(playback).play("ding.wav", 50, ControlSurface.TEST_RULE_ID);

    control.testPlayback("ding.wav", 60, "123");
    verify(playback).play("ding.wav", 60, "123");
  }

  @Test
  void liveVolumeIgnoredWhileMuted() {
    settings.set(Settings.defaults().withMuted(true));
    control.adjustLiveVolume("123", 10);
    verify(playback, never()).setLiveVolume(anyString(), anyInt());

    settings.set(Settings.defaults());
    control.adjustLiveVolume("123", 10);
    verify(playback).setLiveVolume("123", 10);
  }

  @Test
  void testPushResultArrivesOnControlThread() throws Exception {
    when(push.send(any(), any(), isNull(), any(), isNull(), isNull()))
        .thenReturn(PushResult.delivered("ok"));
    AtomicReference<PushResult> got = new AtomicReference<>();
    AtomicReference<Boolean> onControl = new AtomicReference<>();

    control.testPush(
        "app",
        "user",
        r -> {
          got.set(r);
          onControl.set(marshal.isControlThread());
        });

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (got.get() == null && System.nanoTime() < deadline) {
      marshal.drainPending();
      Thread.sleep(5);
    }

    assertTrue(got.get().delivered());
    assertTrue(onControl.get());
    verify(push)
        .send("app", "user", null, ControlSurface.TEST_PUSH_MESSAGE, null, null);
  }

  private static SettingsUpdate update(String token) {
    return new SettingsUpdate(token, true, true, "user-key", "app-token", true, true);
  }
}
