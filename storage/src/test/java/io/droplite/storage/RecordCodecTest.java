package io.droplite.storage;

import io.droplite.core.Category;
import io.droplite.core.ClaimRecord;
import io.droplite.core.DistributionRecord;
import io.droplite.core.SlotKey;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static io.droplite.storage.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    @Test
    void finalized_event_keeps_uint256_sized_values() {
        BigInteger huge = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);
        var rec = new DistributionRecord(new SlotKey(19_000, Category.REFERRALS, 0xFFFF),
                record(1, Category.CREATE, 1).root(), 500, huge, true, 1_641_600_000L, RELAYER);
        var event = new LedgerEvent.Finalized(rec, huge);

        byte[] framed = RecordCodec.encode(event);
        byte[] payload = Arrays.copyOfRange(framed, RecordCodec.HEADER_BYTES, framed.length);

        assertEquals(event, RecordCodec.decode(payload));
    }

    @Test
    void claimed_event_round_trips_and_header_carries_crc_of_payload() {
        var event = new LedgerEvent.Claimed(new ClaimRecord(SlotKey.of(100, Category.CREATE), ALICE,
                new BigInteger("500000000000000000"), 8_640_042L));

        byte[] framed = RecordCodec.encode(event);
        byte[] payload = Arrays.copyOfRange(framed, RecordCodec.HEADER_BYTES, framed.length);
        int headerCrc = (framed[7] & 0xFF) | (framed[8] & 0xFF) << 8 | (framed[9] & 0xFF) << 16 | (framed[10] & 0xFF) << 24;

        assertEquals(RecordCodec.crc32(payload), headerCrc);
        assertEquals(event, RecordCodec.decode(payload));
    }

    @Test
    void unsigned_strips_the_sign_byte() {
        assertArrayEquals(new byte[]{(byte) 0xFF}, RecordCodec.unsigned(BigInteger.valueOf(255)));
        assertArrayEquals(new byte[]{0}, RecordCodec.unsigned(BigInteger.ZERO));
    }
}
