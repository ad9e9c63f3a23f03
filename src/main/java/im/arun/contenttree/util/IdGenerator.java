package im.arun.contenttree.util;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates node ids of the form {@code <prefix>-<epochMillis>-<0..9999>}.
 * Callers that need fully deterministic ids supply their own implementation.
 */
public interface IdGenerator {

    String nextId(String prefix);

    static IdGenerator timestamped(Clock clock) {
        return prefix -> String.format("%s-%d-%d",
            prefix == null || prefix.isEmpty() ? "node" : prefix,
            clock.millis(),
            ThreadLocalRandom.current().nextInt(10000));
    }

    static IdGenerator timestamped() {
        return timestamped(Clock.systemUTC());
    }
}
