package io.validator.core.mempool;

import io.validator.core.protocol.BalanceWithdraw;
import io.validator.core.state.FundsReader;

/**
 * Signing-time checks for transactions that withdraw from accumulators.
 * The funds check reads unsequenced state, so passing it guarantees nothing
 * once the transaction is ordered.
 */
public class TxValidator {
    private final FundsReader funds;

    public TxValidator(FundsReader funds) {
        this.funds = funds;
    }

    public TxValidator() {
        this.funds = null;
    }

    /**
     * @throws IllegalArgumentException if the request is malformed
     * @throws io.validator.core.state.InsufficientFundsException if an account holds less than requested
     */
    public void validate(BalanceWithdraw withdraw) {
        if (withdraw == null) {
            throw new IllegalArgumentException("Withdraw required");
        }
        withdraw.basicValidate();
        if (funds == null) {
            return;
        }
        funds.amountsAvailable(withdraw.fixedAmounts());
    }
}
