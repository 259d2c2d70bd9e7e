package io.droplite.server.claim;

/**
 * A value release did not happen; no funds moved.
 */
public class TransferException extends RuntimeException {

    public TransferException(String message) {
        super(message);
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
