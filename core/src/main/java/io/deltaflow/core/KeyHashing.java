package io.deltaflow.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Key-hash partitioning of row keys onto shards.
 *
 * Properties:
 *  - Deterministic across processes and restarts: the token of a key is the
 *    first 8 bytes (big-endian) of SHA-256(key), so a recovered engine routes
 *    every key to the shard whose snapshot holds its state.
 *  - Balanced: with the shard chosen as token mod shards (unsigned), keys
 *    spread approximately uniformly.
 */
public final class KeyHashing {

    private static final ThreadLocal<MessageDigest> SHA256 = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    });

    private KeyHashing() {
        // utility
    }

    /** 64-bit token of a key; compare with {@link Long#compareUnsigned}. */
    public static long tokenForKey(String key) {
        MessageDigest md = SHA256.get();
        md.reset();
        md.update(key.getBytes(StandardCharsets.UTF_8));
        byte[] h = md.digest();
        return ByteBuffer.wrap(h, 0, 8).order(ByteOrder.BIG_ENDIAN).getLong();
    }

    /**
     * Shard owning a key.
     *
     * @param key    row key
     * @param shards number of shards (must be > 0)
     * @return shard index in [0, shards)
     */
    public static int shardFor(String key, int shards) {
        if (shards <= 0) throw new IllegalArgumentException("shards must be > 0");
        if (shards == 1) return 0;
        return (int) Long.remainderUnsigned(tokenForKey(key), shards);
    }
}
