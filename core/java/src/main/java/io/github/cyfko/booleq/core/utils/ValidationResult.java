package io.github.cyfko.booleq.core.utils;

/**
 * Class representing the result of a validation operation.
 * <p>
 * The result can indicate either a successful validation or a failure with an associated error message.
 * </p>
 *
 * <p>Instances are immutable and created via the static methods
 * {@link #success()} and {@link #failure(String)}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = VariableNames.validate("door open");
 * if (!result.isValid()) {
 *     System.out.println("Validation error: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null);

    private final boolean valid;
    private final String errorMessage;

    private ValidationResult(boolean valid, String errorMessage) {
        this.valid = valid;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates an instance indicating a successful validation.
     *
     * @return a valid result with no error message
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * Creates an instance indicating a failed validation with an error message.
     *
     * @param errorMessage message explaining the reason for failure
     * @return an invalid result containing the provided error message
     */
    public static ValidationResult failure(String errorMessage) {
        return new ValidationResult(false, errorMessage);
    }

    /**
     * Indicates whether the validation succeeded.
     *
     * @return true if valid, false otherwise
     */
    public boolean isValid() {
        return valid;
    }

    /**
     * Returns the error message associated with a validation failure.
     *
     * @return the error message, or null if the validation succeeded
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult{valid}" : "ValidationResult{invalid, message='" + errorMessage + "'}";
    }
}
