package io.vindex.ledger.mempool;

import io.vindex.ledger.consensus.StakeIntent;
import io.vindex.ledger.consensus.StakingRegistry;
import io.vindex.ledger.consensus.Validator;
import io.vindex.ledger.protocol.Amounts;
import io.vindex.ledger.protocol.FeeSchedule;
import io.vindex.ledger.protocol.ProtocolLimits;
import io.vindex.ledger.protocol.RejectReason;
import io.vindex.ledger.protocol.SignatureUtil;
import io.vindex.ledger.protocol.SwapOrder;
import io.vindex.ledger.protocol.Transaction;
import io.vindex.ledger.protocol.ValidationResult;
import io.vindex.ledger.state.Account;
import io.vindex.ledger.state.Ledger;
import io.vindex.ledger.swap.SwapBook;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Admission checks for the transaction pool, evaluated against the current ledger state.
 * Balances are checked per transaction; pending spends from the same sender are not reserved,
 * so an over-committed batch is pruned at mining time instead.
 */
public class TxValidator {
    private final Ledger ledger;
    private final StakingRegistry staking;
    private final SwapBook swaps;
    private final boolean requireSignatures;
    private final Clock clock;
    private final Predicate<String> alreadyMined;

    public TxValidator(Ledger ledger,
                       StakingRegistry staking,
                       SwapBook swaps,
                       boolean requireSignatures,
                       Clock clock,
                       Predicate<String> alreadyMined) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.staking = Objects.requireNonNull(staking, "staking");
        this.swaps = Objects.requireNonNull(swaps, "swaps");
        this.requireSignatures = requireSignatures;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.alreadyMined = Objects.requireNonNull(alreadyMined, "alreadyMined");
    }

    public ValidationResult check(Transaction tx, TransactionPool pending) {
        if (tx == null) {
            return ValidationResult.error(RejectReason.MALFORMED, "Transaction required");
        }
        try {
            tx.basicValidate();
        } catch (IllegalArgumentException e) {
            return ValidationResult.error(RejectReason.MALFORMED, e.getMessage());
        }

        long now = clock.millis();
        if (now - tx.timestamp() > ProtocolLimits.MAX_TX_AGE_MILLIS) {
            return ValidationResult.error(RejectReason.STALE_TIMESTAMP, "Transaction is too old");
        }
        if (tx.timestamp() - now > ProtocolLimits.MAX_FUTURE_DRIFT_MILLIS) {
            return ValidationResult.error(RejectReason.STALE_TIMESTAMP, "Transaction timestamp is in the future");
        }

        ValidationResult sig = checkSignature(tx);
        if (!sig.isOk()) return sig;

        if (pending.contains(tx.id()) || alreadyMined.test(tx.id())) {
            return ValidationResult.error(RejectReason.DUPLICATE, "Transaction " + tx.id() + " already known");
        }
        if (pending.findRecentDuplicate(tx).isPresent()) {
            return ValidationResult.error(RejectReason.DUPLICATE,
                    "Same transfer from " + tx.from() + " to " + tx.to() + " submitted within the last minute");
        }

        Optional<Account> sender = ledger.getAccount(tx.from());
        if (sender.isEmpty()) {
            return ValidationResult.error(RejectReason.UNKNOWN_SENDER, "Sender account not found: " + tx.from());
        }
        long requiredFee = FeeSchedule.feeFor(tx.type(), tx.amountMinor());
        if (tx.feeMinor() < requiredFee) {
            return ValidationResult.error(RejectReason.FEE_TOO_LOW,
                    "Fee " + Amounts.format(tx.feeMinor()) + " below required " + Amounts.format(requiredFee));
        }

        long balance = sender.get().balance();
        switch (tx.type()) {
            case TRANSFER:
                return requireBalance(balance, tx.totalCostMinor());
            case STAKE:
                return checkStake(tx, balance);
            case UNSTAKE:
                return checkUnstake(tx, balance);
            case SWAP:
                return checkSwap(tx, sender.get());
            default:
                return ValidationResult.error(RejectReason.MALFORMED, "Unsupported type " + tx.type());
        }
    }

    private ValidationResult checkSignature(Transaction tx) {
        if (!tx.isSigned()) {
            return requireSignatures
                    ? ValidationResult.error(RejectReason.SIGNATURE_REQUIRED, "Unsigned transaction")
                    : ValidationResult.ok();
        }
        if (tx.publicKey() == null || !tx.verifySignature()) {
            return ValidationResult.error(RejectReason.BAD_SIGNATURE, "Signature does not verify");
        }
        if (!SignatureUtil.deriveAddress(tx.publicKey()).equals(tx.from())) {
            return ValidationResult.error(RejectReason.BAD_SIGNATURE, "Signer key does not match sender " + tx.from());
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkStake(Transaction tx, long balance) {
        long minStake = staking.params().minStakeAmount();
        if (tx.amountMinor() < minStake) {
            return ValidationResult.error(RejectReason.BELOW_MIN_STAKE,
                    "Minimum stake amount is " + Amounts.format(minStake));
        }
        String target = tx.targetValidator();
        Optional<Validator> validator = staking.getValidator(target);
        if (validator.isEmpty()) {
            if (StakeIntent.of(tx.from(), target) == StakeIntent.DELEGATION) {
                return ValidationResult.error(RejectReason.UNKNOWN_VALIDATOR, "Validator not found: " + target);
            }
            if (staking.validatorCount() >= staking.params().maxValidators()) {
                return ValidationResult.error(RejectReason.VALIDATOR_CAP_REACHED,
                        "Maximum number of validators reached (" + staking.params().maxValidators() + ")");
            }
        }
        return requireBalance(balance, tx.totalCostMinor());
    }

    private ValidationResult checkUnstake(Transaction tx, long balance) {
        ValidationResult fee = requireBalance(balance, tx.feeMinor());
        if (!fee.isOk()) return fee;
        long staked = staking.getDelegation(tx.from(), tx.targetValidator())
                .map(d -> d.stakedAmount())
                .orElse(0L);
        if (staked < tx.amountMinor()) {
            return ValidationResult.error(RejectReason.INSUFFICIENT_STAKE,
                    "Staked " + Amounts.format(staked) + " toward " + tx.targetValidator()
                            + ", requested " + Amounts.format(tx.amountMinor()));
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkSwap(Transaction tx, Account sender) {
        SwapOrder order = tx.swapOrder();
        if (!swaps.hasPair(order.tokenIn(), order.tokenOut())) {
            return ValidationResult.error(RejectReason.UNKNOWN_SWAP_PAIR,
                    "Swap pair not found: " + SwapBook.pairKey(order.tokenIn(), order.tokenOut()));
        }
        if (Amounts.NATIVE_SYMBOL.equals(order.tokenIn())) {
            return requireBalance(sender.balance(), tx.totalCostMinor());
        }
        if (sender.tokenBalance(order.tokenIn()) < tx.amountMinor()) {
            return ValidationResult.error(RejectReason.INSUFFICIENT_BALANCE,
                    "Insufficient " + order.tokenIn() + " balance");
        }
        return requireBalance(sender.balance(), tx.feeMinor());
    }

    private static ValidationResult requireBalance(long balance, long required) {
        if (balance < required) {
            return ValidationResult.error(RejectReason.INSUFFICIENT_BALANCE,
                    "Insufficient balance: need " + Amounts.format(required) + ", have " + Amounts.format(balance));
        }
        return ValidationResult.ok();
    }
}
