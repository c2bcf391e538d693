package io.vindex.ledger.consensus;

import io.vindex.ledger.protocol.Amounts;
import io.vindex.ledger.protocol.Hashes;
import io.vindex.ledger.state.Account;
import io.vindex.ledger.state.Ledger;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Validator set and per-delegator delegation records.
 *
 * Invariants kept by every mutation:
 * - a validator is active iff its totalStake is at least the minimum stake
 * - a validator's totalStake equals the sum of the delegation records pointing at it
 * - an account's staked total equals the sum of its delegation records
 *
 * Validators keep insertion order, which is the order rotation walks them in.
 * Not thread-safe; the owning chain serializes access.
 */
public final class StakingRegistry {
    private static final Logger LOG = Logger.getLogger(StakingRegistry.class.getName());

    private final Ledger ledger;
    private final StakingParams params;
    private final Clock clock;

    private final Map<String, Validator> validators = new LinkedHashMap<>();
    private final Map<String, List<Delegation>> delegations = new LinkedHashMap<>();

    public StakingRegistry(Ledger ledger, StakingParams params, Clock clock) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.params = Objects.requireNonNull(params, "params");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public StakingRegistry(Ledger ledger, StakingParams params) {
        this(ledger, params, Clock.systemUTC());
    }

    public StakingParams params() {
        return params;
    }

    /**
     * Registers a validator that exists from block 0: the stake is created out of thin air
     * (not debited from the balance) and backed by a self-delegation record.
     */
    public void registerGenesisValidator(String address, long selfStake, int commissionBps) {
        if (validators.containsKey(address)) {
            throw new IllegalArgumentException("Validator already registered: " + address);
        }
        if (selfStake < params.minStakeAmount()) {
            throw new IllegalArgumentException("Genesis validator " + address + " needs at least "
                    + Amounts.format(params.minStakeAmount()));
        }
        if (validators.size() >= params.maxValidators()) {
            throw new IllegalArgumentException("Maximum number of validators reached (" + params.maxValidators() + ")");
        }
        ledger.ensureAccount(address);
        Validator validator = new Validator(address, commissionBps);
        validators.put(address, validator);
        ledger.markValidator(address);
        credit(address, validator, StakeIntent.SELF_NOMINATION, selfStake);
    }

    /**
     * Stakes {@code amount} from the delegator's spendable balance toward a validator.
     * Staking to one's own address is a self-nomination and may create the validator;
     * staking to any other address requires the validator to exist.
     *
     * @return a snapshot of the resulting delegation record
     * @throws StakingException if any precondition fails; nothing is changed in that case
     */
    public Delegation stake(String delegator, String validatorAddress, long amount) {
        StakeIntent intent = StakeIntent.of(delegator, validatorAddress);
        if (amount < params.minStakeAmount()) {
            throw new StakingException(StakingException.Reason.BELOW_MINIMUM,
                    "Minimum stake amount is " + Amounts.format(params.minStakeAmount())
                            + ", got " + Amounts.format(amount));
        }
        Optional<Account> account = ledger.getAccount(delegator);
        if (account.isEmpty()) {
            throw new StakingException(StakingException.Reason.ACCOUNT_NOT_FOUND,
                    "Delegator account not found: " + delegator);
        }
        if (account.get().balance() < amount) {
            throw new StakingException(StakingException.Reason.INSUFFICIENT_BALANCE,
                    "Insufficient balance for staking: need " + Amounts.format(amount)
                            + ", spendable " + Amounts.format(account.get().balance()));
        }

        Validator validator = validators.get(validatorAddress);
        if (validator == null) {
            if (intent == StakeIntent.DELEGATION) {
                throw new StakingException(StakingException.Reason.UNKNOWN_VALIDATOR,
                        "Cannot delegate to non-existent validator " + validatorAddress);
            }
            if (validators.size() >= params.maxValidators()) {
                throw new StakingException(StakingException.Reason.VALIDATOR_CAP_REACHED,
                        "Maximum number of validators reached (" + params.maxValidators() + ")");
            }
            validator = new Validator(validatorAddress, params.defaultCommissionBps());
            validators.put(validatorAddress, validator);
            ledger.markValidator(validatorAddress);
            LOG.info("New validator nominated: " + validatorAddress);
        }

        if (!ledger.adjustBalance(delegator, -amount)) {
            throw new IllegalStateException("Balance debit failed after checks for " + delegator);
        }
        return credit(delegator, validator, intent, amount).copy();
    }

    /**
     * Moves {@code amount} out of an active delegation into a pending release that matures
     * after the unstaking period. Repeated unstakes add to the pending amount and refresh the maturity.
     *
     * @throws StakingException if no record exists or it holds less than {@code amount}
     */
    public Delegation unstake(String delegator, String validatorAddress, long amount) {
        if (amount <= 0) {
            throw new StakingException(StakingException.Reason.INVALID_AMOUNT,
                    "Unstake amount must be > 0, got " + amount);
        }
        Delegation record = findRecord(delegator, validatorAddress);
        if (record == null) {
            throw new StakingException(StakingException.Reason.NO_STAKING_RECORD,
                    "No staking record found for " + delegator + " toward " + validatorAddress);
        }
        if (record.stakedAmount() < amount) {
            throw new StakingException(StakingException.Reason.INSUFFICIENT_STAKE,
                    "Insufficient staked amount: requested " + Amounts.format(amount)
                            + ", staked " + Amounts.format(record.stakedAmount()));
        }
        Validator validator = validators.get(validatorAddress);
        if (validator == null) {
            throw new StakingException(StakingException.Reason.UNKNOWN_VALIDATOR,
                    "Validator not found: " + validatorAddress);
        }
        if (!ledger.exists(delegator)) {
            throw new StakingException(StakingException.Reason.ACCOUNT_NOT_FOUND,
                    "Delegator account not found: " + delegator);
        }

        Instant maturity = clock.instant().plus(params.unstakingPeriod());
        record.beginRelease(amount, maturity);

        validator.addTotalStake(-amount);
        if (StakeIntent.of(delegator, validatorAddress) == StakeIntent.SELF_NOMINATION) {
            validator.addSelfStake(-amount);
        }
        if (validator.totalStake() < params.minStakeAmount() && validator.isActive()) {
            validator.setActive(false);
            LOG.info("Validator deactivated (stake below minimum): " + validatorAddress);
        }
        ledger.adjustStaked(delegator, -amount);
        return record.copy();
    }

    /**
     * Releases every pending unstake whose maturity has passed back to the spendable balance.
     *
     * @return the total released, 0 if nothing has matured
     * @throws StakingException if the delegator has no account
     */
    public long completeUnstaking(String delegator) {
        if (!ledger.exists(delegator)) {
            throw new StakingException(StakingException.Reason.ACCOUNT_NOT_FOUND,
                    "Delegator account not found: " + delegator);
        }
        List<Delegation> records = delegations.get(delegator);
        if (records == null) {
            return 0L;
        }
        Instant now = clock.instant();
        long released = 0L;
        Iterator<Delegation> it = records.iterator();
        while (it.hasNext()) {
            Delegation record = it.next();
            Optional<Instant> maturity = record.maturesAt();
            if (maturity.isPresent() && !maturity.get().isAfter(now)) {
                long amount = record.release();
                if (!ledger.adjustBalance(delegator, amount)) {
                    throw new IllegalStateException("Release credit failed for " + delegator);
                }
                released = Math.addExact(released, amount);
            }
            if (record.isEmpty()) {
                it.remove();
            }
        }
        if (records.isEmpty()) {
            delegations.remove(delegator);
        }
        return released;
    }

    // -------------------- reads --------------------

    public Optional<Validator> getValidator(String address) {
        Validator v = validators.get(address);
        return v == null ? Optional.empty() : Optional.of(v.copy());
    }

    public List<Validator> getValidators() {
        List<Validator> out = new ArrayList<>(validators.size());
        for (Validator v : validators.values()) out.add(v.copy());
        return out;
    }

    public List<Validator> getActiveValidators() {
        List<Validator> out = new ArrayList<>();
        for (Validator v : validators.values()) {
            if (v.isActive()) out.add(v.copy());
        }
        return out;
    }

    public List<Delegation> getDelegations(String delegator) {
        List<Delegation> records = delegations.get(delegator);
        if (records == null) {
            return Collections.emptyList();
        }
        List<Delegation> out = new ArrayList<>(records.size());
        for (Delegation d : records) out.add(d.copy());
        return out;
    }

    public Optional<Delegation> getDelegation(String delegator, String validatorAddress) {
        Delegation record = findRecord(delegator, validatorAddress);
        return record == null ? Optional.empty() : Optional.of(record.copy());
    }

    public int validatorCount() {
        return validators.size();
    }

    /** Sum of totalStake over active validators. */
    public long totalActiveStake() {
        long total = 0L;
        for (Validator v : validators.values()) {
            if (v.isActive()) total = Math.addExact(total, v.totalStake());
        }
        return total;
    }

    public StakingStats getNetworkStats() {
        int active = 0;
        for (Validator v : validators.values()) {
            if (v.isActive()) active++;
        }
        return new StakingStats(
                validators.size(),
                active,
                totalActiveStake(),
                ledger.accountCount(),
                params.minStakeAmount(),
                params.maxValidators(),
                params.stakingRewardRate(),
                params.unstakingPeriod());
    }

    /** SHA-256 over validators (rotation order) and delegation records (delegator order). */
    public byte[] stateDigest() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Validator v : validators.values()) {
            byte[] addr = v.address().getBytes(StandardCharsets.UTF_8);
            ByteBuffer buf = ByteBuffer.allocate(4 + addr.length + 8 + 8 + 4 + 1 + 8 + 8);
            buf.putInt(addr.length).put(addr);
            buf.putLong(v.selfStake()).putLong(v.totalStake()).putInt(v.commissionBps());
            buf.put((byte) (v.isActive() ? 1 : 0));
            buf.putLong(v.blocksProduced()).putLong(v.lastActiveBlock());
            out.writeBytes(buf.array());
        }
        for (List<Delegation> records : new TreeMap<>(delegations).values()) {
            for (Delegation d : records) {
                byte[] from = d.delegator().getBytes(StandardCharsets.UTF_8);
                byte[] to = d.validator().getBytes(StandardCharsets.UTF_8);
                ByteBuffer buf = ByteBuffer.allocate(4 + from.length + 4 + to.length + 8 * 4);
                buf.putInt(from.length).put(from).putInt(to.length).put(to);
                buf.putLong(d.stakedAmount()).putLong(d.rewards()).putLong(d.pendingRelease());
                buf.putLong(d.maturesAt().map(Instant::toEpochMilli).orElse(0L));
                out.writeBytes(buf.array());
            }
        }
        return Hashes.sha256(out.toByteArray());
    }

    // -------------------- engine access --------------------

    Collection<Validator> validatorRecords() {
        return validators.values();
    }

    Validator validatorRecord(String address) {
        return validators.get(address);
    }

    /** Live records pointing at a validator, in delegator insertion order. */
    List<Delegation> recordsFor(String validatorAddress) {
        List<Delegation> out = new ArrayList<>();
        for (List<Delegation> records : delegations.values()) {
            for (Delegation d : records) {
                if (d.validator().equals(validatorAddress)) out.add(d);
            }
        }
        return out;
    }

    Ledger ledger() {
        return ledger;
    }

    // -------------------- internals --------------------

    private Delegation credit(String delegator, Validator validator, StakeIntent intent, long amount) {
        ledger.adjustStaked(delegator, amount);
        validator.addTotalStake(amount);
        if (intent == StakeIntent.SELF_NOMINATION) {
            validator.addSelfStake(amount);
        }
        if (validator.totalStake() >= params.minStakeAmount() && !validator.isActive()) {
            validator.setActive(true);
            LOG.info("Validator activated: " + validator.address());
        }
        Delegation record = findRecord(delegator, validator.address());
        if (record == null) {
            record = new Delegation(delegator, validator.address());
            delegations.computeIfAbsent(delegator, k -> new ArrayList<>()).add(record);
        }
        record.addStake(amount);
        return record;
    }

    private Delegation findRecord(String delegator, String validatorAddress) {
        List<Delegation> records = delegations.get(delegator);
        if (records == null) return null;
        for (Delegation d : records) {
            if (d.validator().equals(validatorAddress)) return d;
        }
        return null;
    }
}
