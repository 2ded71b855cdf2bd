package com.leadscore.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when scoring input is structurally unusable (HTTP 400).
 * <p>
 * Covers a required identity column missing from a record table and a scoring configuration
 * document that lacks a required pillar weight. Value-level problems such as an unparseable
 * numeric cell never raise this exception; they are recovered where they occur.
 * </p>
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class BadRequestException extends RuntimeException {

    /**
     * Constructs a new BadRequestException with the specified detail message.
     *
     * @param message the detail message which explains the cause of the exception.
     */
    public BadRequestException(String message) {
        super(message);
    }
}
