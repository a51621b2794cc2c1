package in.questkeeper.application.port.output;

/**
 * Source of new identifiers.
 */
@FunctionalInterface
public interface IdGenerator {

    String newId();
}
