package com.tinyurl.generator;

import com.tinyurl.exception.ValidationException;

/**
 * Strategy for producing short codes.
 *
 * <p>Implementations do not guarantee uniqueness; callers check the store and retry.
 */
public interface ShortCodeGenerator {

    int MAX_CUSTOM_CODE_LENGTH = 20;

    /**
     * Produces a code of exactly {@code length} Base62 characters.
     *
     * @param seed   input mixed into the code, usually the long URL
     * @param length number of characters to produce
     * @return the generated code
     */
    String generate(String seed, int length);

    /**
     * Validates a caller-supplied code.
     *
     * @param customCode the requested code
     * @return the code unchanged when it is 1-20 letters, digits or hyphens
     * @throws ValidationException when the code has the wrong length or characters
     */
    default String generateCustom(String customCode) {
        if (customCode == null || customCode.isEmpty() || customCode.length() > MAX_CUSTOM_CODE_LENGTH) {
            throw new ValidationException("Custom code must be between 1 and " + MAX_CUSTOM_CODE_LENGTH + " characters");
        }
        for (int i = 0; i < customCode.length(); i++) {
            char c = customCode.charAt(i);
            if (!Base62.isAlphanumeric(c) && c != '-') {
                throw new ValidationException("Custom code can only contain alphanumeric characters and hyphens");
            }
        }
        return customCode;
    }
}
