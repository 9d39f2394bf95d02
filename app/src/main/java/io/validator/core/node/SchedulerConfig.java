package io.validator.core.node;

import java.util.LinkedHashMap;
import java.util.Map;

/** Simple config holder for the withdraw scheduler of a local node. */
public final class SchedulerConfig {
    public final SchedulerMode mode;
    public final int readerThreads;
    public final int maxCachedAccounts;
    public final boolean applySettlementDeltas;
    /** "owner/coinType" or a hex object id -> initial balance */
    public final Map<String, Long> genesisAllocations;

    public SchedulerConfig(SchedulerMode mode, int readerThreads, int maxCachedAccounts,
                           boolean applySettlementDeltas, Map<String, Long> genesisAllocations) {
        if (mode == null) {
            throw new IllegalArgumentException("mode required");
        }
        if (readerThreads <= 0) {
            throw new IllegalArgumentException("readerThreads must be > 0");
        }
        if (maxCachedAccounts <= 0) {
            throw new IllegalArgumentException("maxCachedAccounts must be > 0");
        }
        this.mode = mode;
        this.readerThreads = readerThreads;
        this.maxCachedAccounts = maxCachedAccounts;
        this.applySettlementDeltas = applySettlementDeltas;
        this.genesisAllocations = genesisAllocations;
    }

    public static SchedulerConfig defaultLocal() {
        Map<String, Long> alloc = new LinkedHashMap<String, Long>();
        alloc.put("alice/0x2::sui::SUI", 1_000_000L);
        alloc.put("bob/0x2::sui::SUI",     500_000L);
        return new SchedulerConfig(
                SchedulerMode.EAGER,
                4,            // storage reader threads
                100_000,      // cached accounts kept across settlements
                false,        // always re-derive balances from storage
                alloc
        );
    }

    public SchedulerConfig withMode(SchedulerMode mode) {
        return new SchedulerConfig(mode, readerThreads, maxCachedAccounts, applySettlementDeltas, genesisAllocations);
    }

    public SchedulerConfig withReaderThreads(int readerThreads) {
        return new SchedulerConfig(mode, readerThreads, maxCachedAccounts, applySettlementDeltas, genesisAllocations);
    }

    public SchedulerConfig withMaxCachedAccounts(int maxCachedAccounts) {
        return new SchedulerConfig(mode, readerThreads, maxCachedAccounts, applySettlementDeltas, genesisAllocations);
    }

    public SchedulerConfig withSettlementDeltas(boolean applySettlementDeltas) {
        return new SchedulerConfig(mode, readerThreads, maxCachedAccounts, applySettlementDeltas, genesisAllocations);
    }

    public SchedulerConfig withGenesisAllocations(Map<String, Long> genesisAllocations) {
        return new SchedulerConfig(mode, readerThreads, maxCachedAccounts, applySettlementDeltas, genesisAllocations);
    }
}
