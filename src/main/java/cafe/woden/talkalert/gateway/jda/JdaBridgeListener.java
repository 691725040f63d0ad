package cafe.woden.talkalert.gateway.jda;

import cafe.woden.talkalert.gateway.GatewayListener;
import cafe.woden.talkalert.gateway.InboundMessage;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.SelfUser;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.events.session.SessionDisconnectEvent;
import net.dv8tion.jda.api.events.session.SessionRecreateEvent;
import net.dv8tion.jda.api.events.session.SessionResumeEvent;
import net.dv8tion.jda.api.events.session.ShutdownEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.requests.CloseCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Translates JDA events into {@link GatewayListener} callbacks. */
final class JdaBridgeListener extends ListenerAdapter {
  private static final Logger log = LoggerFactory.getLogger(JdaBridgeListener.class);

  private final GatewayListener listener;
  private final JdaGatewaySession session;

  JdaBridgeListener(GatewayListener listener, JdaGatewaySession session) {
    this.listener = listener;
    this.session = session;
  }

  @Override
  public void onReady(ReadyEvent event) {
    SelfUser self = event.getJDA().getSelfUser();
    session.rememberSelfId(self.getId());
    listener.onReady(self.getId(), self.getName());
  }

  @Override
  public void onSessionDisconnect(SessionDisconnectEvent event) {
    CloseCode code = event.getCloseCode();
    String reason = code != null ? code.getMeaning() : "disconnected";
    log.debug("[talkalert] gateway disconnected: {}", reason);
    listener.onDisconnect(reason);
  }

  @Override
  public void onSessionResume(SessionResumeEvent event) {
    listener.onResumed();
  }

  @Override
  public void onSessionRecreate(SessionRecreateEvent event) {
    listener.onResumed();
  }

  @Override
  public void onShutdown(ShutdownEvent event) {
    try {
      listener.onClosed();
    } finally {
      session.markClosed();
    }
  }

  @Override
  public void onMessageReceived(MessageReceivedEvent event) {
    listener.onMessage(toInbound(event));
  }

  static InboundMessage toInbound(MessageReceivedEvent event) {
    User author = event.getAuthor();
    boolean automated = author.isBot() || author.isSystem() || event.isWebhookMessage();

    Member member = event.getMember();
    String displayName = member != null ? member.getEffectiveName() : author.getEffectiveName();

    String where = "DM";
    if (event.isFromGuild()) {
      where = event.getGuild().getName() + " / #" + event.getChannel().getName();
    }

    return new InboundMessage(
        author.getId(),
        displayName,
        automated,
        where,
        event.getMessage().getContentDisplay(),
        event.getMessage().getJumpUrl());
  }
}
