import io.github.flameyossnowy.simpledb.api.codec.BooleanCodec;
import io.github.flameyossnowy.simpledb.api.codec.NumberCodec;
import io.github.flameyossnowy.simpledb.api.codec.OpaqueCodec;
import io.github.flameyossnowy.simpledb.api.codec.TimestampCodec;
import io.github.flameyossnowy.simpledb.api.exceptions.DecodeException;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class AttributeCodecTest {

    @Test
    void number_encodesNegativeWithOffset() {
        NumberCodec codec = new NumberCodec(6, 10000, 0);

        assertEquals("009958", codec.encode(-42));
        assertEquals(-42.0, codec.decode("009958").doubleValue());
        assertEquals(-42.0, codec.decode(codec.encode(-42)).doubleValue());
    }

    @Test
    void number_preservesOrderWithinRange() {
        NumberCodec codec = new NumberCodec(6, 10000, 0);

        String previous = codec.encode(-9999);
        for (int value = -9998; value <= 9999; value += 7) {
            String current = codec.encode(value);
            assertTrue(previous.compareTo(current) < 0, previous + " should sort before " + current);
            assertEquals(6, current.length());
            previous = current;
        }
    }

    @Test
    void number_precisionWidensField() {
        NumberCodec codec = new NumberCodec(6, 100, 2);

        assertEquals(9, codec.width());
        assertEquals("000103.50", codec.encode(3.5));
        assertEquals(3.5, codec.decode("000103.50").doubleValue(), 1e-9);
    }

    @Test
    void number_roundsHalfEven() {
        NumberCodec codec = new NumberCodec(3, 0, 0);

        assertEquals("002", codec.encode(2.5));
        assertEquals("004", codec.encode(3.5));
    }

    @Test
    void number_outOfRangeNegativeKeepsSignFirst() {
        NumberCodec codec = new NumberCodec(4, 10, 0);

        assertEquals("-040", codec.encode(-50));
    }

    @Test
    void number_rejectsGarbage() {
        NumberCodec codec = new NumberCodec(6, 10000);

        DecodeException e = assertThrows(DecodeException.class, () -> codec.decode("abc"));
        assertEquals("abc", e.getValue());
    }

    @Test
    void number_decodesAsDoubleBeyondExactIntegerRange() {
        NumberCodec codec = new NumberCodec(20, 0);

        assertEquals("00009007199254740993", codec.encode(9007199254740993L));
        assertEquals(9007199254740992.0, codec.decode(codec.encode(9007199254740992L)).doubleValue());
        assertEquals(9007199254740992.0, codec.decode(codec.encode(9007199254740993L)).doubleValue());
        assertInstanceOf(Double.class, codec.decode("00000000000000000001"));
    }

    @Test
    void number_passesEncodedStringsThrough() {
        NumberCodec codec = new NumberCodec(6, 10000);

        assertEquals("010025", codec.encodeValue(25));
        assertEquals("010025", codec.encodeValue("010025"));
        assertThrows(ValidationException.class, () -> codec.encodeValue(true));
    }

    @Test
    void boolean_isBijection() {
        BooleanCodec codec = BooleanCodec.INSTANCE;

        assertEquals("1", codec.encode(true));
        assertEquals("0", codec.encode(false));
        assertTrue(codec.decode("1"));
        assertFalse(codec.decode("0"));
        assertThrows(DecodeException.class, () -> codec.decode("2"));
    }

    @Test
    void timestamp_roundTripsWholeSeconds() {
        TimestampCodec codec = new TimestampCodec();
        LocalDateTime value = LocalDateTime.of(2010, 1, 25, 15, 1, 28);

        assertEquals("2010-01-25T15:01:28", codec.encode(value));
        assertEquals(value, codec.decode(codec.encode(value)));
    }

    @Test
    void timestamp_sortsChronologically() {
        TimestampCodec codec = new TimestampCodec();

        String earlier = codec.encode(LocalDateTime.of(2009, 12, 31, 23, 59, 59));
        String later = codec.encode(LocalDateTime.of(2010, 1, 1, 0, 0, 0));
        assertTrue(earlier.compareTo(later) < 0);
    }

    @Test
    void timestamp_rejectsMismatchedInput() {
        TimestampCodec codec = new TimestampCodec();

        assertThrows(DecodeException.class, () -> codec.decode("25/01/2010"));
        assertThrows(ValidationException.class, () -> new TimestampCodec("yyyy-MM-dd'T"));
    }

    @Test
    void opaque_isIdentity() {
        assertEquals("x y", OpaqueCodec.INSTANCE.encode("x y"));
        assertEquals("x y", OpaqueCodec.INSTANCE.decode("x y"));
        assertEquals("12", OpaqueCodec.INSTANCE.encodeValue(12));
    }
}
