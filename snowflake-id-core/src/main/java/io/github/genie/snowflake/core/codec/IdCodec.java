package io.github.genie.snowflake.core.codec;

import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.OptionalLong;

import static io.github.genie.snowflake.core.codec.Alphabet.BITS_PER_DIGIT;
import static io.github.genie.snowflake.core.codec.Alphabet.DIGIT_MASK;

/**
 * Fixed-width text form of a 64-bit id: 13 symbols of a custom base-32
 * alphabet, most significant digit first, left-padded with the zero digit
 * {@code 'y'}. The id is read as an unsigned value, so every {@code long}
 * has exactly one encoding.
 */
public final class IdCodec {

    public static final int LENGTH = 13;

    // 13 digits carry 65 bits; the leading digit only holds the top 4 bits of the id
    private static final int MAX_LEADING_DIGIT = (1 << (Long.SIZE - BITS_PER_DIGIT * (LENGTH - 1))) - 1;

    private IdCodec() {
    }

    public static byte[] encode(long id) {
        byte[] text = new byte[LENGTH];
        long remaining = id;
        for (int i = LENGTH - 1; i >= 0; i--) {
            text[i] = Alphabet.symbol((int) (remaining & DIGIT_MASK));
            remaining >>>= BITS_PER_DIGIT;
        }
        return text;
    }

    public static String encodeToString(long id) {
        return new String(encode(id), StandardCharsets.US_ASCII);
    }

    /**
     * @return the decoded id, or empty if the input is not exactly {@value #LENGTH}
     * alphabet symbols or does not fit in 64 bits
     */
    public static OptionalLong decode(@Nullable byte[] text) {
        if (text == null || text.length != LENGTH) {
            return OptionalLong.empty();
        }
        long id = 0;
        for (int i = 0; i < LENGTH; i++) {
            int digit = Alphabet.digit(text[i] & 0xFF);
            if (digit < 0 || (i == 0 && digit > MAX_LEADING_DIGIT)) {
                return OptionalLong.empty();
            }
            id = id << BITS_PER_DIGIT | digit;
        }
        return OptionalLong.of(id);
    }

    public static OptionalLong decode(@Nullable CharSequence text) {
        if (text == null || text.length() != LENGTH) {
            return OptionalLong.empty();
        }
        byte[] bytes = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            char c = text.charAt(i);
            if (c > 0x7F) {
                return OptionalLong.empty();
            }
            bytes[i] = (byte) c;
        }
        return decode(bytes);
    }

}
