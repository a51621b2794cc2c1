package in.questkeeper.infrastructure.id;

import in.questkeeper.application.port.output.IdGenerator;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 24-hex identifiers: 4 bytes epoch seconds, 5 random bytes, 3 byte counter.
 */
public final class ObjectIdGenerator implements IdGenerator {

    private final Clock clock;
    private final long processPart;
    private final AtomicInteger counter;

    public ObjectIdGenerator(Clock clock) {
        this(clock, new SecureRandom());
    }

    public ObjectIdGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.processPart = random.nextLong() & 0xFF_FFFF_FFFFL;
        this.counter = new AtomicInteger(random.nextInt(0x100_0000));
    }

    @Override
    public String newId() {
        long seconds = clock.instant().getEpochSecond() & 0xFFFF_FFFFL;
        int count = counter.getAndIncrement() & 0xFF_FFFF;
        return String.format("%08x%010x%06x", seconds, processPart, count);
    }
}
