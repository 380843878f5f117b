package com.openforge.promptyoself.prompt;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Turns request-binding failures into the same ToolResponse envelope the
 * prompt operations return, with HTTP 400.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = PromptController.class)
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ToolResponse> invalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return badRequest(message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ToolResponse> unreadableBody(HttpMessageNotReadableException e) {
        return badRequest("Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ToolResponse> typeMismatch(MethodArgumentTypeMismatchException e) {
        return badRequest("Invalid value for '%s': %s".formatted(e.getName(), e.getValue()));
    }

    private static ResponseEntity<ToolResponse> badRequest(String message) {
        log.debug("[Api] Rejected request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ToolResponse.error(ToolResponse.INVALID_ARGUMENT, message));
    }
}
