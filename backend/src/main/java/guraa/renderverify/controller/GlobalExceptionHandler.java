package guraa.renderverify.controller;

import guraa.renderverify.core.ToleranceParseException;
import guraa.renderverify.core.UnsupportedDimensionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application.
 * Configuration problems are reported apart from comparison verdicts.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle malformed tolerance documents
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(ToleranceParseException.class)
    public ResponseEntity<Map<String, String>> handleToleranceParseException(ToleranceParseException e) {
        logger.error("Invalid tolerance configuration", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "configuration", "Invalid tolerance configuration: " + e.getMessage());
    }

    /**
     * Handle non-indexable dimensions configured as criteria
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(UnsupportedDimensionException.class)
    public ResponseEntity<Map<String, String>> handleUnsupportedDimension(UnsupportedDimensionException e) {
        logger.error("Unsupported match criterion {}", e.getDimensionName());
        return error(HttpStatus.BAD_REQUEST, "configuration", e.getMessage());
    }

    /**
     * Handle invalid request arguments
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "request", e.getMessage());
    }

    /**
     * Handle IO exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleIOException(IOException e) {
        logger.error("IO Exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "io", "Error reading or writing images: " + e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String kind, String message) {
        Map<String, String> response = new HashMap<>();
        response.put("kind", kind);
        response.put("error", message);
        return ResponseEntity.status(status).body(response);
    }
}
