package io.validator.core.state;

/** Storage could not produce an account balance. Never means "insufficient". */
public class FundsReadException extends RuntimeException {
    public FundsReadException(String message) {
        super(message);
    }

    public FundsReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
