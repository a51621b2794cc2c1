package in.questkeeper.domain.character;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Spell(
    String name,
    int level,          // 0 = cantrip
    String school,
    String castingTime,
    String range,
    String components,
    String duration,
    String description,
    @JsonProperty("isPrepared") boolean isPrepared
) {
}
