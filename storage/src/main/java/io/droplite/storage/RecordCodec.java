package io.droplite.storage;

import io.droplite.core.Bytes32;
import io.droplite.core.Category;
import io.droplite.core.ClaimRecord;
import io.droplite.core.DistributionRecord;
import io.droplite.core.SlotKey;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD17E   (helps detect garbage)
 *     - version (1B)  = 1       (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - type: byte (1 = FINALIZED, 2 = CLAIMED)
 *     - slot: int64 day, byte category code, int32 subBatch
 *   FINALIZED:
 *     - root:        32 bytes
 *     - userCount:   int32
 *     - totalReward: int32 len + unsigned big-endian magnitude
 *     - createdAt:   int64
 *     - relayer:     int32 len + UTF-8 bytes
 *     - nonce:       int32 len + unsigned big-endian magnitude
 *   CLAIMED:
 *     - user:        int32 len + UTF-8 bytes
 *     - amount:      int32 len + unsigned big-endian magnitude
 *     - claimedAt:   int64
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xD17E;
    static final byte  VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private static final byte FINALIZED = 1;
    private static final byte CLAIMED = 2;

    private RecordCodec() {}

    /** Encode a ledger event into header+payload bytes ready for append. */
    static byte[] encode(LedgerEvent event) {
        byte[] payload = encodePayload(event);
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        header.flip();

        byte[] out = new byte[HEADER_BYTES + payload.length];
        header.get(out, 0, HEADER_BYTES);
        System.arraycopy(payload, 0, out, HEADER_BYTES, payload.length);
        return out;
    }

    /** Decode a full payload (not including header). */
    static LedgerEvent decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        byte type = b.get();
        SlotKey slot = readSlot(b);
        switch (type) {
            case FINALIZED -> {
                byte[] root = new byte[32];
                b.get(root);
                int userCount = b.getInt();
                BigInteger total = readUnsigned(b);
                long createdAt = b.getLong();
                String relayer = readString(b);
                BigInteger nonce = readUnsigned(b);
                var record = new DistributionRecord(slot, Bytes32.wrap(root), userCount, total, true, createdAt, relayer);
                return new LedgerEvent.Finalized(record, nonce);
            }
            case CLAIMED -> {
                String user = readString(b);
                BigInteger amount = readUnsigned(b);
                long claimedAt = b.getLong();
                return new LedgerEvent.Claimed(new ClaimRecord(slot, user, amount, claimedAt));
            }
            default -> throw new IllegalStateException("Unknown WAL record type: " + type);
        }
    }

    // ----------------- helpers -----------------

    /** Payload bytes only; snapshots reuse this encoding without the WAL header. */
    static byte[] encodePayload(LedgerEvent event) {
        if (event instanceof LedgerEvent.Finalized f) {
            DistributionRecord r = f.record();
            byte[] total = unsigned(r.totalReward());
            byte[] relayer = r.relayer().getBytes(StandardCharsets.UTF_8);
            byte[] nonce = unsigned(f.nonce());

            int size = 1 + SLOT_BYTES;
            size += 32;                   // root
            size += 4;                    // userCount
            size += 4 + total.length;     // totalReward
            size += 8;                    // createdAt
            size += 4 + relayer.length;   // relayer
            size += 4 + nonce.length;     // nonce

            ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
            b.put(FINALIZED);
            writeSlot(b, r.slot());
            b.put(r.root().toArray());
            b.putInt(r.userCount());
            writeBytes(b, total);
            b.putLong(r.createdAt());
            writeBytes(b, relayer);
            writeBytes(b, nonce);
            return b.array();
        }
        if (event instanceof LedgerEvent.Claimed c) {
            ClaimRecord claim = c.claim();
            byte[] user = claim.user().getBytes(StandardCharsets.UTF_8);
            byte[] amount = unsigned(claim.amount());

            int size = 1 + SLOT_BYTES + 4 + user.length + 4 + amount.length + 8;
            ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
            b.put(CLAIMED);
            writeSlot(b, claim.slot());
            writeBytes(b, user);
            writeBytes(b, amount);
            b.putLong(claim.claimedAt());
            return b.array();
        }
        throw new IllegalArgumentException("Unknown ledger event: " + event);
    }

    private static final int SLOT_BYTES = 8 + 1 + 4;

    private static void writeSlot(ByteBuffer b, SlotKey slot) {
        b.putLong(slot.day());
        b.put((byte) slot.category().code());
        b.putInt(slot.subBatch());
    }

    private static SlotKey readSlot(ByteBuffer b) {
        long day = b.getLong();
        Category category = Category.fromCode(b.get());
        int subBatch = b.getInt();
        return new SlotKey(day, category, subBatch);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // unsigned CRC fits in an int for comparison
    }

    /** Unsigned big-endian magnitude, without the sign byte BigInteger.toByteArray() may add. */
    static byte[] unsigned(BigInteger v) {
        byte[] raw = v.toByteArray();
        if (raw.length > 1 && raw[0] == 0) {
            byte[] out = new byte[raw.length - 1];
            System.arraycopy(raw, 1, out, 0, out.length);
            return out;
        }
        return raw;
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static BigInteger readUnsigned(ByteBuffer b) {
        return new BigInteger(1, readBytes(b));
    }

    private static String readString(ByteBuffer b) {
        return new String(readBytes(b), StandardCharsets.UTF_8);
    }
}
