package net.amphora.util;

import java.security.SecureRandom;
import java.time.Clock;
import net.amphora.service.IdentifierGenerator;
import org.springframework.stereotype.Component;

/**
 * Flake-style identifier generator.
 * - 64-bit ids: 42-bit millis since 2015-01-01 | 10-bit worker | 12-bit sequence
 * - Encoded as 11 URL-safe chars whose lexicographic order matches id order
 */
@Component
public class FlakeIdGenerator implements IdentifierGenerator {

    // URL-safe alphabet sorted by ASCII value, so fixed-width strings sort like the numbers they encode
    private static final char[] ALPHABET =
            "-0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ_abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int ENCODED_LENGTH = 11;
    private static final long EPOCH_MILLIS = 1420070400000L;
    private static final int WORKER_BITS = 10;
    private static final int SEQUENCE_BITS = 12;
    private static final long MAX_WORKER = (1L << WORKER_BITS) - 1;
    private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Clock clock;
    private final long workerId;
    private long lastTimestamp = -1L;
    private long sequence;

    public FlakeIdGenerator() {
        this(Clock.systemUTC(), RANDOM.nextInt((int) MAX_WORKER + 1));
    }

    FlakeIdGenerator(Clock clock, long workerId) {
        if (workerId < 0 || workerId > MAX_WORKER) {
            throw new IllegalArgumentException("workerId must be between 0 and " + MAX_WORKER);
        }
        this.clock = clock;
        this.workerId = workerId;
    }

    @Override
    public String next() {
        return encode(nextId());
    }

    /**
     * Next raw id. The timestamp never moves backwards: a clock step back or an
     * exhausted sequence borrows the following millisecond instead.
     */
    synchronized long nextId() {
        long now = clock.millis();
        if (now <= lastTimestamp) {
            sequence = (sequence + 1) & SEQUENCE_MASK;
            if (sequence == 0) {
                lastTimestamp++;
            }
        } else {
            lastTimestamp = now;
            sequence = 0;
        }
        return ((lastTimestamp - EPOCH_MILLIS) << (WORKER_BITS + SEQUENCE_BITS))
                | (workerId << SEQUENCE_BITS)
                | sequence;
    }

    static String encode(long id) {
        char[] encoded = new char[ENCODED_LENGTH];
        long remaining = id;
        for (int i = ENCODED_LENGTH - 1; i >= 0; i--) {
            encoded[i] = ALPHABET[(int) (remaining & 0x3F)];
            remaining >>>= 6;
        }
        return new String(encoded);
    }
}
