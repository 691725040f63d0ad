package cafe.woden.talkalert.rules;

import cafe.woden.talkalert.model.Rule;

public class InvalidSoundExtensionException extends RuleValidationException {

  public InvalidSoundExtensionException(String soundPath) {
    super(
        "Sound must be one of "
            + String.join(", ", Rule.ALLOWED_SOUND_EXTENSIONS)
            + " (got '"
            + soundPath
            + "').");
  }
}
