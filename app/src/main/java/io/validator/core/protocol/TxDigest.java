package io.validator.core.protocol;

import java.util.Arrays;

public final class TxDigest {
    public static final int LENGTH = 32;
    private final byte[] bytes;

    public TxDigest(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("TxDigest must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    /** Digest of arbitrary transaction bytes. */
    public static TxDigest of(byte[] txBytes) {
        return new TxDigest(Hashes.sha256(txBytes));
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hashes.toHex(bytes); }

    @Override public boolean equals(Object o){ return o instanceof TxDigest && Arrays.equals(bytes, ((TxDigest)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "TxDigest("+hex().substring(0,8)+"…)"; }
}
