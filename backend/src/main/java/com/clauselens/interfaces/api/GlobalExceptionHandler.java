package com.clauselens.interfaces.api;

import com.clauselens.application.comparison.exception.ComparisonNotFoundException;
import com.clauselens.application.comparison.exception.InvalidComparisonRequestException;
import com.clauselens.application.contract.exception.ContractAlreadyProcessedException;
import com.clauselens.application.contract.exception.ContractInUseException;
import com.clauselens.application.contract.exception.ContractNotFoundException;
import com.clauselens.application.contract.exception.ContractNotReadyException;
import com.clauselens.domain.analysis.service.ReasoningServiceException;
import com.clauselens.interfaces.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ComparisonNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleComparisonNotFound(ComparisonNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("COMPARISON_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(ContractNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleContractNotFound(ContractNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("CONTRACT_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(ContractNotReadyException.class)
    public ResponseEntity<ErrorResponse> handleContractNotReady(ContractNotReadyException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("CONTRACT_NOT_READY", e.getMessage()));
    }

    @ExceptionHandler(InvalidComparisonRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidComparison(InvalidComparisonRequestException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_COMPARISON_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(ContractInUseException.class)
    public ResponseEntity<ErrorResponse> handleContractInUse(ContractInUseException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("CONTRACT_IN_USE", e.getMessage()));
    }

    @ExceptionHandler(ContractAlreadyProcessedException.class)
    public ResponseEntity<ErrorResponse> handleContractAlreadyProcessed(ContractAlreadyProcessedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("CONTRACT_ALREADY_PROCESSED", e.getMessage()));
    }

    @ExceptionHandler(ReasoningServiceException.class)
    public ResponseEntity<ErrorResponse> handleReasoning(ReasoningServiceException e) {
        log.warn("[GlobalExceptionHandler] Reasoning service unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("REASONING_SERVICE_ERROR", "The clause analysis service is temporarily unavailable."));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MALFORMED_REQUEST", "Request body is missing or malformed."));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request.");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An internal error occurred. Please try again later."));
    }
}
