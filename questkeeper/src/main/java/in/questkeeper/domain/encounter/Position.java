package in.questkeeper.domain.encounter;

/**
 * Grid position. Coordinates are non-negative.
 */
public record Position(int x, int y) {
}
