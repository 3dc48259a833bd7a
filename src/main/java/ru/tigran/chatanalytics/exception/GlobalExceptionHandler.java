package ru.tigran.chatanalytics.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for the application.
 * Maps all exceptions to consistent ErrorResponse format.
 *
 * Validation failures are reported specifically; execution and configuration
 * failures are reported generically so SQL and infrastructure details never leak.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles all ApplicationException subtypes.
     * Determines HTTP status code, logging level and message exposure based on exception type.
     *
     * @param e ApplicationException instance
     * @return ResponseEntity with appropriate status and error details
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplicationException(ApplicationException e) {
        ExceptionInfo info = ExceptionInfo.forException(e);

        if (info.shouldLogError()) {
            log.error("Application error: {}", e.getMessage(), e);
        } else {
            log.warn("Application error: {}", e.getMessage());
        }

        String message = info.exposeMessage() ? e.getMessage() : genericMessageFor(e.getErrorCode());
        ErrorResponse response = new ErrorResponse(e.getErrorCode(), message);
        return ResponseEntity.status(info.status()).body(response);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing request parameter: {}", e.getParameterName());
        ErrorResponse response = new ErrorResponse(
                ErrorCode.VALIDATION_ERROR.getCode(),
                e.getParameterName() + ": parameter is required"
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Request parameter type mismatch: {}", e.getName());
        ErrorResponse response = new ErrorResponse(
                ErrorCode.VALIDATION_ERROR.getCode(),
                e.getName() + ": invalid value"
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException e) {
        log.debug("Resource not found: {}", e.getResourcePath());
        ErrorResponse response = new ErrorResponse("NOT_FOUND", "Resource not found");
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        ErrorResponse response = new ErrorResponse(
                ErrorCode.INTERNAL_SERVER_ERROR.getCode(),
                ErrorCode.INTERNAL_SERVER_ERROR.getDefaultMessage()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private String genericMessageFor(String errorCode) {
        for (ErrorCode code : ErrorCode.values()) {
            if (code.getCode().equals(errorCode)) {
                return code.getDefaultMessage();
            }
        }
        return ErrorCode.INTERNAL_SERVER_ERROR.getDefaultMessage();
    }
}
