package io.deltaflow.storage;

import io.deltaflow.core.Value;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary encoding of {@link Value}s shared by WAL records and snapshot images.
 * <p>
 * Layout: tag byte (= {@link Value#rank()}) followed by
 *   - NULL:  nothing
 *   - BOOL:  byte (0 or 1)
 *   - INT:   int64
 *   - REAL:  float64
 *   - STR:   int32 len + UTF-8 bytes
 *   - TUPLE: int32 count + count nested values
 * ByteBuffer variants use the buffer's byte order (WAL: little-endian);
 * stream variants are big-endian as {@link DataOutputStream} writes them.
 */
final class ValueCodec {
    static final byte NULL = 0, BOOL = 1, INT = 2, REAL = 3, STR = 4, TUPLE = 5;

    private ValueCodec() {
        // utility
    }

    /** Encoded size in bytes. */
    static int sizeOf(Value v) {
        if (v instanceof Value.Null) return 1;
        if (v instanceof Value.Bool) return 2;
        if (v instanceof Value.Int || v instanceof Value.Real) return 9;
        if (v instanceof Value.Str s) return 1 + 4 + utf8(s.v()).length;
        Value.Tuple t = (Value.Tuple) v;
        int size = 1 + 4;
        for (Value item : t.items()) size += sizeOf(item);
        return size;
    }

    static void write(ByteBuffer b, Value v) {
        b.put((byte) v.rank());
        if (v instanceof Value.Bool x) {
            b.put((byte) (x.v() ? 1 : 0));
        } else if (v instanceof Value.Int x) {
            b.putLong(x.v());
        } else if (v instanceof Value.Real x) {
            b.putDouble(x.v());
        } else if (v instanceof Value.Str x) {
            byte[] s = utf8(x.v());
            b.putInt(s.length).put(s);
        } else if (v instanceof Value.Tuple x) {
            b.putInt(x.size());
            for (Value item : x.items()) write(b, item);
        }
    }

    static Value read(ByteBuffer b) {
        byte tag = b.get();
        switch (tag) {
            case NULL:
                return Value.NULL;
            case BOOL:
                return Value.of(b.get() != 0);
            case INT:
                return Value.of(b.getLong());
            case REAL:
                return Value.of(b.getDouble());
            case STR: {
                byte[] s = new byte[b.getInt()];
                b.get(s);
                return Value.of(new String(s, StandardCharsets.UTF_8));
            }
            case TUPLE: {
                int n = b.getInt();
                List<Value> items = new ArrayList<>(n);
                for (int i = 0; i < n; i++) items.add(read(b));
                return Value.tuple(items);
            }
            default:
                throw new IllegalArgumentException("unknown value tag " + tag);
        }
    }

    static void write(DataOutputStream out, Value v) throws IOException {
        out.writeByte(v.rank());
        if (v instanceof Value.Bool x) {
            out.writeBoolean(x.v());
        } else if (v instanceof Value.Int x) {
            out.writeLong(x.v());
        } else if (v instanceof Value.Real x) {
            out.writeDouble(x.v());
        } else if (v instanceof Value.Str x) {
            byte[] s = utf8(x.v());
            out.writeInt(s.length);
            out.write(s);
        } else if (v instanceof Value.Tuple x) {
            out.writeInt(x.size());
            for (Value item : x.items()) write(out, item);
        }
    }

    static Value read(DataInputStream in) throws IOException {
        byte tag = in.readByte();
        switch (tag) {
            case NULL:
                return Value.NULL;
            case BOOL:
                return Value.of(in.readBoolean());
            case INT:
                return Value.of(in.readLong());
            case REAL:
                return Value.of(in.readDouble());
            case STR:
                return Value.of(new String(in.readNBytes(in.readInt()), StandardCharsets.UTF_8));
            case TUPLE: {
                int n = in.readInt();
                List<Value> items = new ArrayList<>(n);
                for (int i = 0; i < n; i++) items.add(read(in));
                return Value.tuple(items);
            }
            default:
                throw new IOException("unknown value tag " + tag);
        }
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
