package cp.core.model;

/**
 * Outcome of validating one credential against the remote service.
 *
 * Neither {@link Outcome#REJECTED} nor {@link Outcome#FAILED} is fatal: the
 * credential is skipped and initialization continues with the others.
 *
 * @param credential the credential that was checked
 * @param outcome    validation outcome
 * @param detail     error description for non-valid outcomes, empty otherwise
 */
public record ValidationResult(Credential credential, Outcome outcome, String detail) {

    public enum Outcome {
        /** Authenticated call succeeded. */
        VALID,
        /** Remote service refused the credential. */
        REJECTED,
        /** Transport or unexpected error; validity unknown. */
        FAILED
    }

    public ValidationResult {
        if (credential == null) throw new IllegalArgumentException("credential cannot be null");
        if (outcome == null) throw new IllegalArgumentException("outcome cannot be null");
        detail = detail == null ? "" : detail;
    }

    public static ValidationResult valid(Credential credential) {
        return new ValidationResult(credential, Outcome.VALID, "");
    }

    public static ValidationResult rejected(Credential credential, String detail) {
        return new ValidationResult(credential, Outcome.REJECTED, detail);
    }

    public static ValidationResult failed(Credential credential, String detail) {
        return new ValidationResult(credential, Outcome.FAILED, detail);
    }

    public boolean isValid() {
        return outcome == Outcome.VALID;
    }
}
