package cafe.woden.talkalert.rules;

/** Raised before any mutation when a rule add/update/reorder is rejected. */
public class RuleValidationException extends RuntimeException {

  public RuleValidationException(String message) {
    super(message);
  }
}
