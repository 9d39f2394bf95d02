package io.validator.core.withdraw;

import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.ObjectId;
import io.validator.core.state.AccountAmount;
import io.validator.core.state.FundsReader;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Re-reads the latest committed balance of every referenced account before
 * admitting a batch. Cached {@link AccountState} objects only carry the
 * reservations granted at the current version; any newer read supersedes them.
 */
public final class NaiveBalanceWithdrawScheduler extends BalanceWithdrawScheduler {
    private static final Logger LOG = Logger.getLogger(NaiveBalanceWithdrawScheduler.class.getName());

    private final ConcurrentMap<ObjectId, AccountState> states = new ConcurrentHashMap<>();

    public NaiveBalanceWithdrawScheduler(FundsReader reader, long startingVersion, int readerThreads) {
        super("naive", reader, startingVersion, readerThreads);
    }

    @Override
    protected CompletableFuture<AccountAmount> fetch(ObjectId account) {
        return readLatest(account);
    }

    @Override
    protected AccountState resolve(ObjectId account, AccountAmount fetched) {
        return refresh(account, fetched);
    }

    private AccountState refresh(ObjectId account, AccountAmount amount) {
        AccountState fresh = new AccountState(amount.balance(), amount.version());
        AccountState existing = states.putIfAbsent(account, fresh);
        if (existing == null) {
            return fresh;
        }
        // a read at the same version keeps the reservations already granted there
        existing.applySettlement(amount.balance(), amount.version());
        return existing;
    }

    @Override
    protected void onSettlement(long previousVersion, BalanceSettlement settlement, Map<ObjectId, BigInteger> rederived) {
        int dropped = states.size();
        states.clear();
        LOG.fine(() -> "Dropped " + dropped + " cached accounts at settlement " + settlement.nextAccumulatorVersion());
    }

    int cachedAccounts() {
        return states.size();
    }
}
