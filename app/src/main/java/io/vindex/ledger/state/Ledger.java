package io.vindex.ledger.state;

import io.vindex.ledger.protocol.Hashes;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.Math.addExact;

/**
 * In-memory account ledger: spendable balances, nonces, staked totals and accrued rewards.
 * Accounts are never removed. Not thread-safe; the owning chain serializes access.
 */
public final class Ledger {

    private final Map<String, Account> accounts = new LinkedHashMap<>();

    public Account createAccount(String address) {
        return createAccount(address, 0L);
    }

    public Account createAccount(String address, long initialBalance) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Account address required");
        }
        if (initialBalance < 0) {
            throw new IllegalArgumentException("Initial balance must be >= 0, got " + initialBalance);
        }
        if (accounts.containsKey(address)) {
            throw new IllegalArgumentException("Account already exists: " + address);
        }
        Account account = new Account(address, initialBalance);
        accounts.put(address, account);
        return account.copy();
    }

    /** Returns a snapshot, never the live record. */
    public Optional<Account> getAccount(String address) {
        Account account = accounts.get(address);
        return account == null ? Optional.empty() : Optional.of(account.copy());
    }

    public boolean exists(String address) {
        return accounts.containsKey(address);
    }

    public long getBalance(String address) {
        Account account = accounts.get(address);
        return account == null ? 0L : account.balance();
    }

    public long getTokenBalance(String address, String symbol) {
        Account account = accounts.get(address);
        return account == null ? 0L : account.tokenBalance(symbol);
    }

    /** Creates a zero-balance account on first use (transfer recipients). */
    public void ensureAccount(String address) {
        if (!accounts.containsKey(address)) {
            createAccount(address, 0L);
        }
    }

    /**
     * Applies a signed delta to the spendable balance.
     * Returns false and changes nothing if the account is missing or the result would be negative.
     */
    public boolean adjustBalance(String address, long delta) {
        Account account = accounts.get(address);
        if (account == null) {
            return false;
        }
        long next;
        try {
            next = addExact(account.balance(), delta);
        } catch (ArithmeticException e) {
            return false;
        }
        if (next < 0) {
            return false;
        }
        account.setBalance(next);
        return true;
    }

    /** Same guard as {@link #adjustBalance} for a non-native token holding. */
    public boolean adjustTokenBalance(String address, String symbol, long delta) {
        Account account = accounts.get(address);
        if (account == null) {
            return false;
        }
        long next;
        try {
            next = addExact(account.tokenBalance(symbol), delta);
        } catch (ArithmeticException e) {
            return false;
        }
        if (next < 0) {
            return false;
        }
        account.setTokenBalance(symbol, next);
        return true;
    }

    public void adjustStaked(String address, long delta) {
        Account account = require(address);
        long next = addExact(account.staked(), delta);
        if (next < 0) {
            throw new IllegalStateException("Staked total would go negative for " + address);
        }
        account.setStaked(next);
    }

    public void addRewards(String address, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Reward amount must be >= 0");
        }
        Account account = accounts.get(address);
        if (account == null) {
            createAccount(address, 0L);
            account = accounts.get(address);
        }
        account.setStakingRewards(addExact(account.stakingRewards(), amount));
    }

    public void incrementNonce(String address) {
        require(address).incrementNonce();
    }

    public void markValidator(String address) {
        require(address).markValidator();
    }

    public int accountCount() {
        return accounts.size();
    }

    public long totalBalance() {
        long total = 0L;
        for (Account account : accounts.values()) total = addExact(total, account.balance());
        return total;
    }

    public long totalStaked() {
        long total = 0L;
        for (Account account : accounts.values()) total = addExact(total, account.staked());
        return total;
    }

    /** SHA-256 over every account in address order. */
    public byte[] stateDigest() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Account account : new TreeMap<>(accounts).values()) {
            byte[] addr = account.address().getBytes(StandardCharsets.UTF_8);
            ByteBuffer buf = ByteBuffer.allocate(4 + addr.length + 8 * 4 + 1 + 4);
            buf.putInt(addr.length).put(addr);
            buf.putLong(account.balance());
            buf.putLong(account.nonce());
            buf.putLong(account.staked());
            buf.putLong(account.stakingRewards());
            buf.put((byte) (account.isValidator() ? 1 : 0));
            buf.putInt(account.tokens().size());
            out.writeBytes(buf.array());
            for (Map.Entry<String, Long> token : account.tokens().entrySet()) {
                byte[] sym = token.getKey().getBytes(StandardCharsets.UTF_8);
                ByteBuffer t = ByteBuffer.allocate(4 + sym.length + 8);
                t.putInt(sym.length).put(sym).putLong(token.getValue());
                out.writeBytes(t.array());
            }
        }
        return Hashes.sha256(out.toByteArray());
    }

    private Account require(String address) {
        Account account = accounts.get(address);
        if (account == null) {
            throw new IllegalArgumentException("Account not found: " + address);
        }
        return account;
    }
}
