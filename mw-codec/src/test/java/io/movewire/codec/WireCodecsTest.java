package io.movewire.codec;

import io.movewire.core.AccountAddress;
import io.movewire.core.Event;
import io.movewire.core.Guid;
import io.movewire.core.Hash;
import io.movewire.core.HexBytes;
import io.movewire.core.U64;
import io.movewire.core.json.DecodeError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class WireCodecsTest {

    private WireCodecs codecs;

    @BeforeEach
    void setUp() {
        codecs = new WireCodecs();
    }

    /* ---------- u64 ---------- */

    @Test
    void u64_roundTripsAcrossTheRange() {
        var rnd = new Random(42);
        var samples = new long[]{0L, 1L, 42L, Long.MAX_VALUE, Long.MIN_VALUE, -1L, rnd.nextLong(), rnd.nextLong()};
        for (long bits : samples) {
            var v = U64.valueOf(bits);
            assertThat(codecs.u64().decode(codecs.u64().encode(v))).isEqualTo(v);
        }
    }

    @Test
    void u64_maxDecodesAndOneMoreFails() {
        assertThat(codecs.u64().decode("\"18446744073709551615\"")).isEqualTo(U64.MAX);

        var e = catchThrowableOfType(() -> codecs.u64().decode("\"18446744073709551616\""), DecodeException.class);
        assertThat(e.error()).isEqualTo(DecodeError.MALFORMED_NUMBER);
        assertThat(e.value()).isEqualTo("18446744073709551616");
        assertThat(e.path()).isEmpty();
    }

    @Test
    void u64_bareNumberAndStringAgree() {
        assertThat(codecs.u64().decode("7")).isEqualTo(codecs.u64().decode("\"7\"")).isEqualTo(U64.valueOf(7));
        assertThat(codecs.u64().decode("\"123456789012345\"").longValue()).isEqualTo(123456789012345L);
    }

    @Test
    void u64_alwaysEncodesQuoted() {
        assertThat(codecs.u64().encodeToString(codecs.u64().decode("42"))).isEqualTo("\"42\"");
        assertThat(codecs.u64().encodeToString(U64.MAX)).isEqualTo("\"18446744073709551615\"");
    }

    @Test
    void u64_malformedInputs() {
        for (var bad : new String[]{"\"\"", "\" 7\"", "\"7 \"", "\"+7\"", "\"x\"", "-7", "7.5", "null", "true", "7 8", "", "\"7"}) {
            var e = catchThrowableOfType(() -> codecs.u64().decode(bad), DecodeException.class);
            assertThat(e).as("input [%s]", bad).isNotNull();
            assertThat(e.error()).as("input [%s]", bad).isEqualTo(DecodeError.MALFORMED_NUMBER);
        }
    }

    /* ---------- bytes ---------- */

    @Test
    void bytes_roundTripsRandomContent() {
        var rnd = new Random(7);
        for (int len : new int[]{0, 1, 2, 31, 32, 33, 1000}) {
            var raw = new byte[len];
            rnd.nextBytes(raw);
            var b = HexBytes.of(raw);
            assertThat(codecs.bytes().decode(codecs.bytes().encode(b))).isEqualTo(b);
        }
    }

    @Test
    void bytes_hexAndBase64DecodeToTheSameBytes() {
        assertThat(codecs.bytes().decode("\"0x12\"")).isEqualTo(codecs.bytes().decode("\"Eg==\""));
        assertThat(codecs.bytes().decode("\"0x12\"").toByteArray()).containsExactly(0x12);
    }

    @Test
    void bytes_encodeNormalizesToPrefixedLowercaseHex() {
        assertThat(codecs.bytes().encodeToString(codecs.bytes().decode("\"EjRW\""))).isEqualTo("\"0x123456\"");
        assertThat(codecs.bytes().encodeToString(codecs.bytes().decode("\"0xABCD\""))).isEqualTo("\"0xabcd\"");
        assertThat(codecs.bytes().encodeToString(HexBytes.EMPTY)).isEqualTo("\"0x\"");
    }

    @Test
    void bytes_emptyPrefixIsEmptyButEmptyStringFails() {
        assertThat(codecs.bytes().decode("\"0x\"").isEmpty()).isTrue();

        var e = catchThrowableOfType(() -> codecs.bytes().decode("\"\""), DecodeException.class);
        assertThat(e.error()).isEqualTo(DecodeError.MALFORMED_BYTES);
        assertThat(e.value()).isEmpty();
    }

    @Test
    void bytes_malformedInputs() {
        for (var bad : new String[]{"\"0xzz\"", "\"abc\"", "\"!!!!\"", "12", "null", "{}"}) {
            var e = catchThrowableOfType(() -> codecs.bytes().decode(bad), DecodeException.class);
            assertThat(e).as("input [%s]", bad).isNotNull();
            assertThat(e.error()).as("input [%s]", bad).isEqualTo(DecodeError.MALFORMED_BYTES);
        }
    }

    /* ---------- guid ---------- */

    @Test
    void guid_decodesBothFields() {
        var guid = codecs.guid().decode("{\"creation_number\": \"3\", \"account_address\": \"0x1\"}");

        assertThat(guid.creationNumber()).isEqualTo(U64.valueOf(3));
        assertThat(guid.accountAddress()).isEqualTo(codecs.address().decode("\"0x1\""));
    }

    @Test
    void guid_missingFieldIsMalformedObject() {
        var noNumber = catchThrowableOfType(
                () -> codecs.guid().decode("{\"account_address\": \"0x1\"}"), DecodeException.class);
        assertThat(noNumber.error()).isEqualTo(DecodeError.MALFORMED_OBJECT);
        assertThat(noNumber.path()).isEqualTo("creation_number");

        var noAddress = catchThrowableOfType(
                () -> codecs.guid().decode("{\"creation_number\": \"3\"}"), DecodeException.class);
        assertThat(noAddress.error()).isEqualTo(DecodeError.MALFORMED_OBJECT);
        assertThat(noAddress.path()).isEqualTo("account_address");
    }

    @Test
    void guid_fieldErrorsNameTheField() {
        var badNumber = catchThrowableOfType(
                () -> codecs.guid().decode("{\"creation_number\": \"three\", \"account_address\": \"0x1\"}"),
                DecodeException.class);
        assertThat(badNumber.error()).isEqualTo(DecodeError.MALFORMED_NUMBER);
        assertThat(badNumber.path()).isEqualTo("creation_number");
        assertThat(badNumber.value()).isEqualTo("three");
        assertThat(badNumber).hasMessageContaining("creation_number");

        var badAddress = catchThrowableOfType(
                () -> codecs.guid().decode("{\"creation_number\": \"3\", \"account_address\": \"0xnope\"}"),
                DecodeException.class);
        assertThat(badAddress.error()).isEqualTo(DecodeError.MALFORMED_OBJECT);
        assertThat(badAddress.path()).isEqualTo("account_address");
    }

    @Test
    void guid_reencodesBareNumberAsString() {
        var guid = codecs.guid().decode("{\"creation_number\": 5, \"account_address\": \"0x1\"}");

        assertThat(codecs.guid().encodeToString(guid))
                .isEqualTo("{\"creation_number\":\"5\",\"account_address\":\"0x1\"}");
    }

    @Test
    void guid_notAnObject() {
        for (var bad : new String[]{"\"guid\"", "42", "null", "[]", "{"}) {
            var e = catchThrowableOfType(() -> codecs.guid().decode(bad), DecodeException.class);
            assertThat(e).as("input [%s]", bad).isNotNull();
            assertThat(e.error()).as("input [%s]", bad).isEqualTo(DecodeError.MALFORMED_OBJECT);
        }
    }

    /* ---------- hash / event ---------- */

    @Test
    void hash_passesThrough() {
        var text = "\"0xf4d07fdb8b5151971886a910e516d418a790dd5f6e068b0588066518a395a6\"";

        assertThat(codecs.hash().encodeToString(codecs.hash().decode(text))).isEqualTo(text);
    }

    @Test
    void event_nestedFailureCarriesFullPath() {
        var e = catchThrowableOfType(() -> codecs.event().decode("""
                {"guid": {"creation_number": "x", "account_address": "0x1"},
                 "sequence_number": "0", "type": "0x1::m::E", "data": {}}
                """), DecodeException.class);

        assertThat(e.error()).isEqualTo(DecodeError.MALFORMED_NUMBER);
        assertThat(e.path()).isEqualTo("guid.creation_number");
    }

    @Test
    void event_missingGuidIsMalformedObject() {
        var e = catchThrowableOfType(() -> codecs.event().decode("""
                {"sequence_number": "0", "type": "0x1::m::E", "data": {}}
                """), DecodeException.class);

        assertThat(e.error()).isEqualTo(DecodeError.MALFORMED_OBJECT);
        assertThat(e).hasMessageContaining("guid");
    }

    @Test
    void event_missingSequenceNumberIsMalformedObject() {
        var e = catchThrowableOfType(() -> codecs.event().decode("""
                {"guid": {"creation_number": "0", "account_address": "0x1"}, "type": "0x1::m::E", "data": {}}
                """), DecodeException.class);

        assertThat(e.error()).isEqualTo(DecodeError.MALFORMED_OBJECT);
        assertThat(e).hasMessageContaining("sequence_number");
    }

    @Test
    void event_missingTypeIsMalformedObject() {
        var e = catchThrowableOfType(() -> codecs.event().decode("""
                {"guid": {"creation_number": "0", "account_address": "0x1"}, "sequence_number": "1", "data": {}}
                """), DecodeException.class);

        assertThat(e.error()).isEqualTo(DecodeError.MALFORMED_OBJECT);
        assertThat(e).hasMessageContaining("type");
    }

    @Test
    void event_missingDataIsEmpty() {
        var event = codecs.event().decode("""
                {"guid": {"creation_number": "0", "account_address": "0x1"}, "sequence_number": "1", "type": "0x1::m::E"}
                """);

        assertThat(event.data()).isEmpty();
    }

    @Test
    void event_typeMustBeAString() {
        for (var badType : new String[]{"5", "1.5", "true"}) {
            var e = catchThrowableOfType(() -> codecs.event().decode(
                    "{\"guid\": {\"creation_number\": \"0\", \"account_address\": \"0x1\"},"
                            + " \"sequence_number\": \"1\", \"type\": " + badType + ", \"data\": {}}"),
                    DecodeException.class);
            assertThat(e).as("type %s", badType).isNotNull();
            assertThat(e.error()).as("type %s", badType).isEqualTo(DecodeError.MALFORMED_OBJECT);
            assertThat(e.path()).as("type %s", badType).isEqualTo("type");
        }
    }

    @Test
    void hash_mustBeAString() {
        for (var bad : new String[]{"42", "true", "null"}) {
            var e = catchThrowableOfType(() -> codecs.hash().decode(bad), DecodeException.class);
            assertThat(e).as("input [%s]", bad).isNotNull();
            assertThat(e.error()).as("input [%s]", bad).isEqualTo(DecodeError.MALFORMED_OBJECT);
        }
    }

    @Test
    void event_roundTrip() {
        var event = codecs.event().decode("""
                {"guid": {"creation_number": 4, "account_address": "0x1"},
                 "sequence_number": 12, "type": "0x1::coin::WithdrawEvent", "data": {"amount": "10"}}
                """);

        assertThat(codecs.event().decode(codecs.event().encode(event))).isEqualTo(event);
        assertThat(event.guid()).isEqualTo(new Guid(U64.valueOf(4), AccountAddress.ONE));
    }

    @Test
    void encodeRejectsNull() {
        assertThatThrownBy(() -> codecs.hash().encode((Hash) null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> codecs.event().encode((Event) null)).isInstanceOf(NullPointerException.class);
    }
}
