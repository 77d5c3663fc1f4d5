package com.tapelibrary.inventory.controller.handler;

import com.tapelibrary.inventory.changer.ChangerException;
import com.tapelibrary.inventory.dto.response.ErrorResponse;
import com.tapelibrary.inventory.exception.AlreadyExistsException;
import com.tapelibrary.inventory.exception.FinalizeFailedException;
import com.tapelibrary.inventory.exception.InvalidCategoryException;
import com.tapelibrary.inventory.exception.InvalidTransitionException;
import com.tapelibrary.inventory.exception.InventoryException;
import com.tapelibrary.inventory.exception.ResourceNotFoundException;
import com.tapelibrary.inventory.exception.VolumesExhaustedException;
import jakarta.servlet.http.HttpServletRequest;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex,
                                                        HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ex, request);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex,
                                                                 HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ex, request);
    }

    @ExceptionHandler(AlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyExists(AlreadyExistsException ex,
                                                             HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ex, request);
    }

    @ExceptionHandler(InvalidCategoryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCategory(InvalidCategoryException ex,
                                                               HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler(VolumesExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleExhausted(VolumesExhaustedException ex,
                                                         HttpServletRequest request) {
        log.warn("{}", ex.toString());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
    }

    @ExceptionHandler(ChangerException.class)
    public ResponseEntity<ErrorResponse> handleChanger(ChangerException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_GATEWAY, ex, request);
    }

    @ExceptionHandler(FinalizeFailedException.class)
    public ResponseEntity<ErrorResponse> handleFinalizeFailed(FinalizeFailedException ex,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors()
            .stream()
            .map(fe -> new ErrorResponse.FieldError(fe.getField(), fe.getDefaultMessage()))
            .toList();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", "Validation failed", null,
                              Instant.now(), request.getRequestURI(), fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", "Malformed request body",
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        String msg = String.format("Invalid value '%s' for parameter '%s'",
                                   ex.getValue(), ex.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", msg, Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex,
                                                             HttpServletRequest request) {
        String constraintName = extractConstraintName(ex);
        if ("idx_volumes_location".equals(constraintName)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(
                new ErrorResponse(409, "Conflict", "Slot is already occupied by another volume",
                                  Instant.now(), request.getRequestURI()));
        }
        if ("pk_tree".equals(constraintName)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(
                new ErrorResponse(409, "Conflict", "Path is already mapped to a volume",
                                  Instant.now(), request.getRequestURI()));
        }
        if ("pk_volumes".equals(constraintName)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(
                new ErrorResponse(409, "Conflict", "Volume serial already exists",
                                  Instant.now(), request.getRequestURI()));
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", "Data integrity violation",
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex,
                                                              HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
            new ErrorResponse(409, "Conflict",
                              "Volume was modified by another request. Please retry.",
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handlePessimisticLock(PessimisticLockingFailureException ex,
                                                               HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
            new ErrorResponse(409, "Conflict",
                              "Volume is locked by another operation. Please retry.",
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex,
                                                               HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", ex.getMessage(),
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException ex,
                                                            HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
            new ErrorResponse(409, "Conflict", ex.getMessage(),
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            new ErrorResponse(500, "Internal Server Error", "An unexpected error occurred",
                              Instant.now(), request.getRequestURI()));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, InventoryException ex,
                                                  HttpServletRequest request) {
        return ResponseEntity.status(status).body(
            new ErrorResponse(status.value(), status.getReasonPhrase(), ex.getMessage(),
                              ex.getOperation(), Instant.now(), request.getRequestURI()));
    }

    private String extractConstraintName(DataIntegrityViolationException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ConstraintViolationException cve) {
            return cve.getConstraintName();
        }
        return null;
    }
}
