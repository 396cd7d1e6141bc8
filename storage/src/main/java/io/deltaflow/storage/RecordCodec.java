package io.deltaflow.storage;

import io.deltaflow.core.Row;
import io.deltaflow.core.Value;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xDF10   (helps detect garbage)
 *     - version (1B)  = 1        (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - type:     byte (1 = batch, 2 = epoch end)
 *     - sequence: int64
 *     - epoch:    int64
 *     batch only:
 *     - sourceId: int32 len + UTF-8 bytes
 *     - rowCount: int32
 *         repeated rowCount times:
 *           - key:   int32 len + UTF-8 bytes
 *           - value: see {@link ValueCodec}
 *           - diff:  int64
 * <p>
 * Rows inherit the record's epoch on decode.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xDF10;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 11;

    private static final byte TYPE_BATCH = 1;
    private static final byte TYPE_EPOCH_END = 2;

    private RecordCodec() {
        // utility
    }

    /** Encode a record into header+payload bytes ready for append. */
    static byte[] encode(WalRecord record) {
        byte[] payload = encodePayload(record);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static WalRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        byte type = b.get();
        long sequence = b.getLong();
        long epoch = b.getLong();
        if (type == TYPE_EPOCH_END) {
            return new WalRecord.EpochEnd(sequence, epoch);
        }
        if (type != TYPE_BATCH) {
            throw new IllegalArgumentException("unknown WAL record type " + type);
        }
        String sourceId = readString(b);
        int count = b.getInt();
        List<Row> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String key = readString(b);
            Value value = ValueCodec.read(b);
            long diff = b.getLong();
            rows.add(new Row(key, value, epoch, diff));
        }
        return new WalRecord.Batch(sequence, epoch, sourceId, rows);
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(WalRecord record) {
        int size = 1 + 8 + 8;
        if (record instanceof WalRecord.Batch batch) {
            size += 4 + utf8(batch.sourceId()).length;
            size += 4;
            for (Row r : batch.rows()) {
                size += 4 + utf8(r.key()).length;
                size += ValueCodec.sizeOf(r.value());
                size += 8;
            }
        }

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(record instanceof WalRecord.Batch ? TYPE_BATCH : TYPE_EPOCH_END);
        b.putLong(record.sequence());
        b.putLong(record.epoch());
        if (record instanceof WalRecord.Batch batch) {
            writeString(b, batch.sourceId());
            b.putInt(batch.rows().size());
            for (Row r : batch.rows()) {
                writeString(b, r.key());
                ValueCodec.write(b, r.value());
                b.putLong(r.diff());
            }
        }
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // CRC32 fits in unsigned int; Java int is fine for compare
    }

    private static void writeString(ByteBuffer b, String s) {
        byte[] bytes = utf8(s);
        b.putInt(bytes.length).put(bytes);
    }

    private static String readString(ByteBuffer b) {
        byte[] s = new byte[b.getInt()];
        b.get(s);
        return new String(s, StandardCharsets.UTF_8);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
