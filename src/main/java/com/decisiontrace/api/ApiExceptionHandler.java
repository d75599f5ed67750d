package com.decisiontrace.api;

import com.decisiontrace.contract.ContractViolationException;
import com.decisiontrace.contract.EmissionContractViolation;
import com.decisiontrace.tracer.DuplicateDecisionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps recording and verification failures onto HTTP statuses:
 * <ul>
 *   <li>400 {@code CONTRACT_VIOLATION}: a decision mapping or payload breaks the record contract</li>
 *   <li>400 {@code BAD_REQUEST}: the body or a parameter cannot be parsed</li>
 *   <li>409 {@code DUPLICATE_DECISION}: the decision id was already used in this run</li>
 *   <li>415 {@code UNSUPPORTED_MEDIA_TYPE}: a trace was posted as something other than JSONL text</li>
 *   <li>422 {@code EMISSION_CONTRACT_VIOLATION}: a recorder scope ended without exactly one action</li>
 *   <li>500 {@code INTERNAL_ERROR}: anything else, logged with its stack trace</li>
 * </ul>
 * The body always carries {@code error_code}, {@code message} and {@code timestamp}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ContractViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleContractViolation(ContractViolationException ex) {
        log.warn("Contract violation: {}", ex.getMessage());
        return errorResponse("CONTRACT_VIOLATION", ex.getMessage());
    }

    @ExceptionHandler(DuplicateDecisionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleDuplicateDecision(DuplicateDecisionException ex) {
        log.warn("Duplicate decision: {}", ex.getMessage());
        return errorResponse("DUPLICATE_DECISION", ex.getMessage());
    }

    @ExceptionHandler(EmissionContractViolation.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleEmissionViolation(EmissionContractViolation ex) {
        log.warn("Emission contract violated for {}: {}", ex.getDecisionId(), ex.getMessage());
        return errorResponse("EMISSION_CONTRACT_VIOLATION", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    @ResponseStatus(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
    public Map<String, Object> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return errorResponse("UNSUPPORTED_MEDIA_TYPE", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
