package edu.brandeis.cosi103a.golfleague.api;

import edu.brandeis.cosi103a.golfleague.workflow.LeagueDataNotFoundException;
import edu.brandeis.cosi103a.golfleague.workflow.MatchDayLockedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps engine exceptions to HTTP error responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MatchDayLockedException.class)
    public ResponseEntity<Map<String, String>> locked(MatchDayLockedException e) {
        return error(HttpStatus.FORBIDDEN, "This match week is locked and scores cannot be modified");
    }

    @ExceptionHandler(LeagueDataNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(LeagueDataNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> invalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(f -> f.getField() + " " + f.getDefaultMessage())
            .orElse("Invalid request");
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> invalidInput(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
