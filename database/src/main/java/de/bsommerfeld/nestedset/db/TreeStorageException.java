package de.bsommerfeld.nestedset.db;

/**
 * Thrown when the backing store fails. The enclosing transaction has already
 * been rolled back when this reaches the caller.
 */
public class TreeStorageException extends RuntimeException {

    public TreeStorageException(String message) {
        super(message);
    }

    public TreeStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
