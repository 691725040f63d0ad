package cafe.woden.talkalert.rules;

public class DuplicateRuleKeyException extends RuleValidationException {

  private final String senderId;

  public DuplicateRuleKeyException(String senderId) {
    super("A rule for sender '" + senderId + "' already exists.");
    this.senderId = senderId;
  }

  public String senderId() {
    return senderId;
  }
}
