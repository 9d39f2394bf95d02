package io.validator.core.state;

import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.ObjectId;
import org.rocksdb.*;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Persistent AccumulatorStore using RocksDB.
 *
 * Layout (column families):
 *  - "balances" : key = objectId(32) || version(8, big-endian), val = balance(16, big-endian u128)
 *  - "meta"     : key = "root_version", val = version(8, big-endian)
 *
 * A balance is only written at versions where it changed; reads at version v
 * take the newest entry at or below v.
 */
public final class RocksDBAccumulatorStore implements AccumulatorStore, AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] ROOT_VERSION_KEY = "root_version".getBytes(StandardCharsets.UTF_8);
    private static final int BALANCE_BYTES = 16;
    private static final BigInteger U128_MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private final RocksDB db;
    private final ColumnFamilyHandle cfBalances;
    private final ColumnFamilyHandle cfMeta;
    private final DBOptions dbOptions;
    private final java.util.List<ColumnFamilyHandle> handles;

    private volatile long rootVersion;

    private RocksDBAccumulatorStore(RocksDB db,
                                    ColumnFamilyHandle cfBalances,
                                    ColumnFamilyHandle cfMeta,
                                    DBOptions dbOptions,
                                    java.util.List<ColumnFamilyHandle> handles,
                                    long rootVersion) {
        this.db = db;
        this.cfBalances = cfBalances;
        this.cfMeta = cfMeta;
        this.dbOptions = dbOptions;
        this.handles = handles;
        this.rootVersion = rootVersion;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBAccumulatorStore open(String dataDir) {
        return open(dataDir, false);
    }

    /**
     * Open an existing store without write access, e.g. to inspect balances
     * while a node owns the directory. Writes fail with IllegalStateException.
     */
    public static RocksDBAccumulatorStore openReadOnly(String dataDir) {
        return open(dataDir, true);
    }

    private static RocksDBAccumulatorStore open(String dataDir, boolean readOnly) {
        try {
            DBOptions dbOpts = new DBOptions()
                    .setCreateIfMissing(!readOnly)
                    .setCreateMissingColumnFamilies(!readOnly);

            java.util.List<ColumnFamilyDescriptor> cfDescs = java.util.Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("balances".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
            );
            java.util.List<ColumnFamilyHandle> cfHandles = new java.util.ArrayList<>();

            RocksDB db = readOnly
                    ? RocksDB.openReadOnly(dbOpts, dataDir, cfDescs, cfHandles)
                    : RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            ColumnFamilyHandle cfBalances = cfHandles.get(1);
            ColumnFamilyHandle cfMeta = cfHandles.get(2);

            byte[] storedRoot = db.get(cfMeta, ROOT_VERSION_KEY);
            long root = storedRoot == null ? 0L : bytesToLong(storedRoot);
            if (root < 0) {
                throw new IllegalStateException("Corrupt root version " + root + " in " + dataDir);
            }
            return new RocksDBAccumulatorStore(db, cfBalances, cfMeta, dbOpts, cfHandles, root);
        } catch (RocksDBException e) {
            throw new RuntimeException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- AccumulatorStore API ----------------

    @Override
    public long rootVersion() {
        return rootVersion;
    }

    @Override
    public AccountAmount latestAccountAmount(ObjectId account) {
        long root = rootVersion;
        return new AccountAmount(readAtOrBelow(account, root), root);
    }

    @Override
    public BigInteger accountAmountAtVersion(ObjectId account, long version) {
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
        if (version > rootVersion) {
            throw new FundsReadException("Version " + version + " not committed yet (root at " + rootVersion + ")");
        }
        return readAtOrBelow(account, version);
    }

    @Override
    public synchronized void setBalance(ObjectId account, BigInteger balance) {
        if (balance == null || balance.signum() < 0) {
            throw new IllegalArgumentException("balance must be >= 0");
        }
        try {
            db.put(cfBalances, balanceKey(account, rootVersion), encodeBalance(balance));
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to write balance of " + account, e);
        }
    }

    @Override
    public synchronized void applyBalanceChanges(BalanceSettlement settlement) {
        long next = settlement.nextAccumulatorVersion();
        if (next <= rootVersion) {
            throw new IllegalArgumentException("Settlement version " + next + " does not advance root " + rootVersion);
        }
        Map<ObjectId, BigInteger> updated = new HashMap<>();
        for (Map.Entry<ObjectId, BigInteger> e : settlement.balanceChanges().entrySet()) {
            BigInteger current = readAtOrBelow(e.getKey(), rootVersion);
            BigInteger after = current.add(e.getValue());
            if (after.signum() < 0) {
                throw new IllegalStateException("Settlement overdraws " + e.getKey() + ": " + current + " + " + e.getValue());
            }
            updated.put(e.getKey(), after);
        }
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            for (Map.Entry<ObjectId, BigInteger> e : updated.entrySet()) {
                batch.put(cfBalances, balanceKey(e.getKey(), next), encodeBalance(e.getValue()));
            }
            batch.put(cfMeta, ROOT_VERSION_KEY, longToBytes(next));
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to commit settlement " + settlement, e);
        }
        rootVersion = next;
    }

    @Override
    public synchronized void close() {
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private BigInteger readAtOrBelow(ObjectId account, long version) {
        byte[] prefix = account.bytes();
        try (RocksIterator it = db.newIterator(cfBalances)) {
            it.seekForPrev(balanceKey(account, version));
            if (!it.isValid()) {
                it.status();
                return BigInteger.ZERO;
            }
            byte[] key = it.key();
            if (!Arrays.equals(key, 0, ObjectId.LENGTH, prefix, 0, ObjectId.LENGTH)) {
                return BigInteger.ZERO;
            }
            return new BigInteger(1, it.value());
        } catch (RocksDBException e) {
            throw new FundsReadException("Failed to read balance of " + account + " at version " + version, e);
        }
    }

    private static byte[] balanceKey(ObjectId account, long version) {
        return ByteBuffer.allocate(ObjectId.LENGTH + 8)
                .put(account.bytes())
                .putLong(version)
                .array();
    }

    static byte[] encodeBalance(BigInteger balance) {
        if (balance.compareTo(U128_MAX) > 0) {
            throw new IllegalArgumentException("balance exceeds u128: " + balance);
        }
        byte[] raw = balance.toByteArray();
        byte[] out = new byte[BALANCE_BYTES];
        int copy = Math.min(raw.length, BALANCE_BYTES);
        System.arraycopy(raw, raw.length - copy, out, BALANCE_BYTES - copy, copy);
        return out;
    }

    private static byte[] longToBytes(long v) {
        return ByteBuffer.allocate(8).putLong(v).array();
    }

    private static long bytesToLong(byte[] b) {
        return ByteBuffer.wrap(b).getLong();
    }
}
