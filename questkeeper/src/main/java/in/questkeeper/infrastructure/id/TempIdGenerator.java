package in.questkeeper.infrastructure.id;

import in.questkeeper.application.port.output.IdGenerator;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Throwaway ids for exports that must not reveal real ids: {@code temp_<millis>_<9 base36 chars>}.
 */
public final class TempIdGenerator implements IdGenerator {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 9;

    private final Clock clock;
    private final Random random;

    public TempIdGenerator(Clock clock) {
        this(clock, new SecureRandom());
    }

    public TempIdGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    @Override
    public String newId() {
        StringBuilder sb = new StringBuilder("temp_").append(clock.millis()).append('_');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
