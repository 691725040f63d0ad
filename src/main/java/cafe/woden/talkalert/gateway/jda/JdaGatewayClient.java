package cafe.woden.talkalert.gateway.jda;

import cafe.woden.talkalert.gateway.ChatGatewayClient;
import cafe.woden.talkalert.gateway.GatewayException;
import cafe.woden.talkalert.gateway.GatewayListener;
import cafe.woden.talkalert.gateway.GatewaySession;
import java.util.Objects;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.exceptions.InvalidTokenException;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Discord gateway access through JDA.
 *
 * <p>Sessions are built light: no member or user caches, only the intents needed to read message
 * content in guilds and DMs. JDA's own reconnect stays on; drops and resumes surface as listener
 * callbacks.
 */
@Component
public class JdaGatewayClient implements ChatGatewayClient {
  private static final Logger log = LoggerFactory.getLogger(JdaGatewayClient.class);

  @Override
  public GatewaySession open(String token, GatewayListener listener) throws GatewayException {
    Objects.requireNonNull(listener, "listener");
    String t = Objects.toString(token, "").trim();
    if (t.isEmpty()) {
      throw new GatewayException("No bot token configured");
    }

    JdaGatewaySession session = new JdaGatewaySession();
    JdaBridgeListener bridge = new JdaBridgeListener(listener, session);
    try {
      JDA jda =
          JDABuilder.createLight(
                  t,
                  GatewayIntent.GUILD_MESSAGES,
                  GatewayIntent.DIRECT_MESSAGES,
                  GatewayIntent.MESSAGE_CONTENT)
              .setAutoReconnect(true)
              .addEventListeners(bridge)
              .build();
      session.attach(jda);
      log.debug("[talkalert] JDA session created");
      return session;
    } catch (InvalidTokenException e) {
      session.markClosed();
      throw new GatewayException("Login failed: the bot token was rejected", e);
    } catch (RuntimeException e) {
      session.markClosed();
      throw new GatewayException("Login failed: " + e.getMessage(), e);
    }
  }
}
