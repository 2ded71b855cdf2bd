package com.leadscore.exceptions;

/**
 * Exception thrown when scoring cannot proceed because of an I/O failure.
 * <p>
 * Used when a configuration directory, a baseline file or a record stream cannot be read or
 * written. These failures are unrelated to the content the caller supplied.
 * </p>
 */
public class InternalServerErrorException extends RuntimeException {

    /**
     * Constructs a new {@link InternalServerErrorException} with the specified error message.
     *
     * @param m the detail message explaining the error.
     */
    public InternalServerErrorException(String m) {
        super(m);
    }

    public InternalServerErrorException(String m, Throwable cause) {
        super(m, cause);
    }
}
