package cafe.woden.talkalert.notify.sound;

import org.jmolecules.ddd.annotation.ValueObject;

/** The rule currently sounding and the volume it plays at. */
@ValueObject
public record NowPlaying(String ruleId, int volume) {}
