package shippingquotes.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import shippingquotes.api.dto.ErrorResponse;
import shippingquotes.service.NoQuotesException;

/**
 * Spring MVC's own request errors keep their 4xx status. Only failures nothing
 * else claims become a 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NoQuotesException.class)
    public ResponseEntity<ErrorResponse> handleNoQuotes(NoQuotesException ex) {
        log.warn("No carrier produced a quote: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("No rates from carriers", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Server failure", detail(ex)));
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            Exception ex,
            Object body,
            HttpHeaders headers,
            HttpStatusCode statusCode,
            WebRequest request) {
        log.debug("Request rejected with {}: {}", statusCode.value(), ex.getMessage());
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        String error = status != null ? status.getReasonPhrase() : "Request failed";
        return new ResponseEntity<>(new ErrorResponse(error, detail(ex)), headers, statusCode);
    }

    private static String detail(Exception ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.toString();
    }
}
