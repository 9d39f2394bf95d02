package io.validator.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Identifier of an accumulator object (one per owner x coin type).
 * Ordered by unsigned byte comparison so that maps keyed by ObjectId iterate
 * identically on every replica.
 */
public final class ObjectId implements Comparable<ObjectId> {
    public static final int LENGTH = 32;
    private static final byte[] BALANCE_DOMAIN = "accumulator::balance".getBytes(StandardCharsets.UTF_8);

    private final byte[] bytes;

    public ObjectId(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("ObjectId must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    /** Id of the balance accumulator for {@code owner} holding {@code coinType}. */
    public static ObjectId forBalance(String owner, String coinType) {
        if (owner == null || owner.isBlank()) throw new IllegalArgumentException("Missing owner");
        if (coinType == null || coinType.isBlank()) throw new IllegalArgumentException("Missing coin type");
        byte[] o = owner.getBytes(StandardCharsets.UTF_8);
        byte[] c = coinType.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(BALANCE_DOMAIN.length + 4 + o.length + 4 + c.length);
        buf.put(BALANCE_DOMAIN);
        buf.putInt(o.length).put(o);
        buf.putInt(c.length).put(c);
        return new ObjectId(Hashes.sha256(buf.array()));
    }

    public static ObjectId fromHex(String hex) {
        return new ObjectId(Hashes.fromHex(hex, LENGTH));
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hashes.toHex(bytes); }

    @Override
    public int compareTo(ObjectId other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override public boolean equals(Object o){ return o instanceof ObjectId && Arrays.equals(bytes, ((ObjectId)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "0x" + hex(); }
}
