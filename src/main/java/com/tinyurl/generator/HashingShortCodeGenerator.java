package com.tinyurl.generator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Random;

/**
 * Derives codes from a SHA-256 digest of the seed, the current epoch second and a random nonce.
 *
 * <p>The first eight digest bytes are folded little-endian into a 64-bit accumulator which is
 * then written out in Base62. If the accumulator is exhausted before {@code length} characters
 * are emitted it is reseeded from the random source.
 */
public class HashingShortCodeGenerator implements ShortCodeGenerator {

    private static final int FOLDED_BYTES = 8;

    private final Clock clock;
    private final Random random;

    public HashingShortCodeGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    @Override
    public String generate(String seed, int length) {
        MessageDigest digest = sha256();
        digest.update(seed.getBytes(StandardCharsets.UTF_8));
        digest.update(Long.toString(clock.instant().getEpochSecond()).getBytes(StandardCharsets.UTF_8));
        digest.update(Long.toUnsignedString(random.nextLong()).getBytes(StandardCharsets.UTF_8));
        byte[] hash = digest.digest();

        long value = 0L;
        for (int i = 0; i < FOLDED_BYTES; i++) {
            value += (hash[i] & 0xFFL) << (i * 8);
        }

        StringBuilder code = new StringBuilder(length);
        while (code.length() < length) {
            code.append(Base62.ALPHABET.charAt((int) Long.remainderUnsigned(value, Base62.BASE)));
            value = Long.divideUnsigned(value, Base62.BASE);
            if (value == 0L) {
                value = random.nextLong();
            }
        }
        return code.toString();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
