package in.questkeeper.domain.character;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One class entry of a (possibly multiclassed) character.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CharacterClass(
    @JsonProperty("class") String className,
    int level,          // 1..20
    String subclass,
    int hitDie          // 4..12
) {
}
