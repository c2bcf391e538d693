package io.vindex.ledger.protocol;

public final class ValidationResult {
    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public final boolean ok;
    public final RejectReason error;
    public final String message;

    private ValidationResult(boolean ok, RejectReason error, String message) {
        this.ok = ok; this.error = error; this.message = message;
    }
    public static ValidationResult ok() { return OK; }
    public static ValidationResult error(RejectReason e, String msg) { return new ValidationResult(false, e, msg); }

    public boolean isOk() { return ok; }

    @Override public String toString() {
        return ok ? "OK" : ("ERR["+error+"]: "+message);
    }
}
