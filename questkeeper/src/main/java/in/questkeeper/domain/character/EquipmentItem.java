package in.questkeeper.domain.character;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EquipmentItem(
    String name,
    int quantity,
    double weight,
    int value,
    String description,
    boolean equipped,
    boolean magical
) {
}
