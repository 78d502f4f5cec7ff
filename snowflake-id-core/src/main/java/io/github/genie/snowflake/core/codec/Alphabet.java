package io.github.genie.snowflake.core.codec;

/**
 * The 32 symbols of the text form, indexed by digit value, and the reverse
 * table from byte value to digit. Ambiguous glyphs such as {@code 0 O l I v}
 * are left out.
 */
final class Alphabet {

    static final int RADIX = 32;
    static final int BITS_PER_DIGIT = 5;
    static final int DIGIT_MASK = RADIX - 1;
    static final byte INVALID = (byte) 0xFF;

    private static final byte[] SYMBOLS = {
            'y', 'b', 'n', 'd', 'r', 'f', 'g', '8',
            'e', 'j', 'k', 'm', 'c', 'p', 'q', 'x',
            'o', 't', '1', 'u', 'w', 'i', 's', 'z',
            'a', '3', '4', '5', 'h', '7', '6', '9'
    };

    private static final byte[] DIGITS = new byte[256];

    static {
        for (int i = 0; i < DIGITS.length; i++) {
            DIGITS[i] = INVALID;
        }
        for (int digit = 0; digit < SYMBOLS.length; digit++) {
            DIGITS[SYMBOLS[digit]] = (byte) digit;
        }
    }

    private Alphabet() {
    }

    static byte symbol(int digit) {
        return SYMBOLS[digit];
    }

    /**
     * @return digit value of the symbol, or -1 if it is not part of the alphabet
     */
    static int digit(int symbol) {
        if (symbol < 0 || symbol >= DIGITS.length) {
            return -1;
        }
        byte digit = DIGITS[symbol];
        return digit == INVALID ? -1 : digit;
    }

}
