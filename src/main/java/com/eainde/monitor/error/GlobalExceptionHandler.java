package com.eainde.monitor.error;

import com.eainde.monitor.ratelimit.RateLimitExceededException;
import com.eainde.monitor.search.eap.InvalidSearchQueryException;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Log4j2
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String RESOURCE_DOES_NOT_EXIST = "The requested resource does not exist";

    @ExceptionHandler(ResourceDoesNotExistException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceDoesNotExistException e) {
        log.debug("Resource not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(RESOURCE_DOES_NOT_EXIST));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .body(new ErrorResponse(e.getMessage()));
    }

    @ExceptionHandler(SuggestionUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleSuggestionUnavailable(SuggestionUnavailableException e) {
        log.error("Suggestion unavailable: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse(e.getMessage()));
    }

    @ExceptionHandler(InvalidSearchQueryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSearchQuery(InvalidSearchQueryException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    }
}
