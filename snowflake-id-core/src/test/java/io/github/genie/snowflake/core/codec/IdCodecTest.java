package io.github.genie.snowflake.core.codec;

import io.github.genie.snowflake.core.SnowflakeId;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.OptionalLong;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class IdCodecTest {

    @Test
    void smallIdsArePaddedWithZeroDigit() {
        assertEquals("yyyyyyyyyyyyy", IdCodec.encodeToString(0));
        assertEquals("yyyyyyyyyyyyb", IdCodec.encodeToString(1));
        assertEquals("yyyyyyyyyyyy9", IdCodec.encodeToString(31));
        assertEquals("yyyyyyyyyyyby", IdCodec.encodeToString(32));
    }

    @Test
    void negativeIdsEncodeAsUnsigned() {
        assertEquals("x999999999999", IdCodec.encodeToString(-1));
        assertEquals("eyyyyyyyyyyyy", IdCodec.encodeToString(Long.MIN_VALUE));
        assertEquals(OptionalLong.of(-1), IdCodec.decode("x999999999999"));
        assertEquals(OptionalLong.of(Long.MIN_VALUE), IdCodec.decode("eyyyyyyyyyyyy"));
    }

    @Test
    void decodeReversesEncode() {
        long[] ids = {0, 1, 31, 32, 1023, SnowflakeId.compose(SnowflakeId.MAX_TIMESTAMP, 1023, 4095),
                SnowflakeId.compose(411_000_000_000L, 5, 0), Long.MAX_VALUE};
        for (long id : ids) {
            assertEquals(OptionalLong.of(id), IdCodec.decode(IdCodec.encode(id)), "id " + id);
            assertEquals(OptionalLong.of(id), IdCodec.decode(IdCodec.encodeToString(id)), "id " + id);
        }
        Random random = new Random(20101104L);
        for (int i = 0; i < 1000; i++) {
            long id = random.nextLong();
            assertEquals(OptionalLong.of(id), IdCodec.decode(IdCodec.encode(id)));
        }
    }

    @Test
    void encodingUsesOnlyAlphabetSymbols() {
        String symbols = "ybndrfg8ejkmcpqxot1uwisza345h769";
        byte[] text = IdCodec.encode(0x0123456789ABCDEFL);
        assertEquals(IdCodec.LENGTH, text.length);
        for (byte b : text) {
            assertTrue(symbols.indexOf(b) >= 0, "unexpected symbol " + (char) b);
        }
    }

    @Test
    void rejectsSymbolsOutsideAlphabet() {
        byte[] valid = IdCodec.encode(123456789L);
        for (String bad : new String[]{"0", "O", "l", "I", "v", "2", "Y", " ", "-"}) {
            byte[] text = valid.clone();
            text[6] = bad.getBytes(StandardCharsets.US_ASCII)[0];
            assertFalse(IdCodec.decode(text).isPresent(), "symbol " + bad);
        }
        byte[] text = valid.clone();
        text[12] = (byte) 0xC3;
        assertFalse(IdCodec.decode(text).isPresent());
        assertFalse(IdCodec.decode("yyyyyyyyyyyyé").isPresent());
        assertFalse(IdCodec.decode(new byte[IdCodec.LENGTH]).isPresent());
    }

    @Test
    void rejectsWrongLength() {
        assertFalse(IdCodec.decode("yyyyyyyyyyyy").isPresent());
        assertFalse(IdCodec.decode("yyyyyyyyyyyyyy").isPresent());
        assertFalse(IdCodec.decode("").isPresent());
        assertFalse(IdCodec.decode((String) null).isPresent());
        assertFalse(IdCodec.decode((byte[]) null).isPresent());
    }

    @Test
    void rejectsValuesBeyondSixtyFourBits() {
        assertFalse(IdCodec.decode("oyyyyyyyyyyyy").isPresent());
        assertFalse(IdCodec.decode("9999999999999").isPresent());
    }

}
