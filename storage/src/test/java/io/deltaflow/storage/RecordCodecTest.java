package io.deltaflow.storage;

import io.deltaflow.core.Row;
import io.deltaflow.core.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    @TempDir Path walDir;

    @Test
    void batch_with_nested_values_survives_encoding() {
        List<Row> rows = List.of(
                Row.insert("user:1", Value.tuple(Value.of("alice"), Value.of(3.5), Value.NULL), 7),
                Row.retract("user:2", Value.of(true), 7),
                new Row("user:3", Value.of(-42L), 7, 3));
        var batch = new WalRecord.Batch(99, 7, "orders", rows);

        byte[] framed = RecordCodec.encode(batch);
        byte[] payload = new byte[framed.length - RecordCodec.HEADER_BYTES];
        System.arraycopy(framed, RecordCodec.HEADER_BYTES, payload, 0, payload.length);

        assertEquals(batch, RecordCodec.decode(payload));
    }

    @Test
    void header_carries_magic_version_length_and_crc() {
        byte[] framed = RecordCodec.encode(new WalRecord.EpochEnd(5, 2));
        ByteBuffer hdr = ByteBuffer.wrap(framed).order(ByteOrder.LITTLE_ENDIAN);

        assertEquals(RecordCodec.MAGIC, hdr.getShort());
        assertEquals(RecordCodec.VERSION, hdr.get());
        int len = hdr.getInt();
        assertEquals(framed.length - RecordCodec.HEADER_BYTES, len);
        byte[] payload = new byte[len];
        System.arraycopy(framed, RecordCodec.HEADER_BYTES, payload, 0, len);
        assertEquals(RecordCodec.crc32(payload), hdr.getInt());
    }

    @Test
    void reader_stops_at_record_with_bad_crc() {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(RecordCodec.encode(new WalRecord.EpochEnd(0, 0)));
        byte[] bad = RecordCodec.encode(new WalRecord.EpochEnd(1, 1));
        bad[bad.length - 1] ^= 0x55;
        wal.append(bad);
        wal.append(RecordCodec.encode(new WalRecord.EpochEnd(2, 2)));

        int count = 0;
        try (Wal.WalReader r = wal.openReader()) {
            while (r.next() != null) count++;
        }
        assertEquals(1, count, "nothing after a corrupt record is trusted");
        wal.close();
    }
}
