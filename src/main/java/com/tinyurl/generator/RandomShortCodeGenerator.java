package com.tinyurl.generator;

import java.util.Random;

/**
 * Draws every character independently from the Base62 alphabet; the seed is ignored.
 */
public class RandomShortCodeGenerator implements ShortCodeGenerator {

    private final Random random;

    public RandomShortCodeGenerator(Random random) {
        this.random = random;
    }

    @Override
    public String generate(String seed, int length) {
        char[] code = new char[length];
        for (int i = 0; i < length; i++) {
            code[i] = Base62.ALPHABET.charAt(random.nextInt(Base62.BASE));
        }
        return new String(code);
    }
}
