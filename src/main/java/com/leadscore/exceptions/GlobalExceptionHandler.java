package com.leadscore.exceptions;

import com.leadscore.models.Error;
import com.leadscore.utils.basic.ErrorUtility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;


/**
 * Global exception handler for the scoring endpoints.
 * <p>
 * Structural input problems map to HTTP 400, I/O failures to HTTP 500. Each response carries an
 * {@link Error} body with a generated uid so a failed run can be traced in the logs.
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles {@link BadRequestException} and returns a HTTP 400 Bad Request response with the error details.
     *
     * @param e the {@link BadRequestException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 400 status.
     */
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<Error> handleBadRequestException(BadRequestException e) {
        log.warn("Rejected scoring request: {}", e.getMessage());
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles a request that omits one of the expected multipart tables.
     *
     * @param e the missing part exception.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 400 status.
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<Error> handleMissingPart(MissingServletRequestPartException e) {
        String message = "Missing required table '" + e.getRequestPartName() + "'";
        return new ResponseEntity<>(ErrorUtility.getError(message, HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles {@link InternalServerErrorException} and returns a HTTP 500 Internal Server Error response with the error details.
     *
     * @param e the {@link InternalServerErrorException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 500 status.
     */
    @ExceptionHandler(InternalServerErrorException.class)
    public ResponseEntity<Error> handleInternalServerErrorException(InternalServerErrorException e) {
        log.error("Scoring request failed: {}", e.getMessage(), e);
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
