package cafe.woden.talkalert.rules;

public class UnknownRuleException extends RuleValidationException {

  public UnknownRuleException(String senderId) {
    super("No rule for sender '" + senderId + "'.");
  }
}
