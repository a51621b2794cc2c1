package in.questkeeper.domain.character;

public record HitPoints(int maximum, int current, int temporary) {
}
