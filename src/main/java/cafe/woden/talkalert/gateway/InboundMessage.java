package cafe.woden.talkalert.gateway;

import java.util.Objects;
import java.util.Optional;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A message as seen on the gateway.
 *
 * @param automated true for bot, system and webhook authors
 * @param locationLabel {@code "Guild / #channel"} or {@code "DM"}
 * @param jumpUrl link back to the message, may be empty
 */
@ValueObject
public record InboundMessage(
    String senderId,
    String senderDisplayName,
    boolean automated,
    String locationLabel,
    String text,
    String jumpUrl) {

  public InboundMessage {
    senderId = Objects.toString(senderId, "");
    senderDisplayName = Objects.toString(senderDisplayName, "").trim();
    locationLabel = Objects.toString(locationLabel, "").trim();
    text = Objects.toString(text, "");
    jumpUrl = Objects.toString(jumpUrl, "").trim();
  }

  public Optional<String> jumpLink() {
    return jumpUrl.isEmpty() ? Optional.empty() : Optional.of(jumpUrl);
  }
}
