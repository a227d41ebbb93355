package com.shopnest.authservice.exception;

import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    private final ErrorResponseWriter writer;
    private final boolean exposeDetails;

    public GlobalExceptionHandler(ErrorResponseWriter writer,
                                  @Value("${app.errors.expose-details:false}") boolean exposeDetails) {
        this.writer = writer;
        this.exposeDetails = exposeDetails;
    }

    // ---------- Custom domain / API exceptions ----------

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        if (ex.getStatus().is5xxServerError()) {
            log.error("{} on {} {}: {}", ex.getCode(), req.getMethod(), req.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.debug("ApiException: status={}, code={}, message={}", ex.getStatus(), ex.getCode(), ex.getMessage());
        }
        writer.write(req, resp, ex.getStatus(), ex.getCode(), safeMessage(ex.getMessage()));
    }

    // ---------- Validation & request-shape errors ----------

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public void handleMethodArgumentNotValid(@NonNull HttpServletRequest req,
                                             @NonNull HttpServletResponse resp,
                                             @NonNull MethodArgumentNotValidException ex) throws IOException {
        List<Map<String, String>> details = ex.getBindingResult().getFieldErrors().stream()
                .limit(10)
                .map(fe -> Map.of(
                        "field", fe.getField(),
                        "message", fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .toList();
        writer.write(req, resp, HttpStatus.BAD_REQUEST, VALIDATION_ERROR, "Validation failed", details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public void handleConstraintViolation(@NonNull HttpServletRequest req,
                                          @NonNull HttpServletResponse resp,
                                          @NonNull ConstraintViolationException ex) throws IOException {
        List<Map<String, String>> details = ex.getConstraintViolations().stream()
                .limit(10)
                .map(cv -> Map.of("field", cv.getPropertyPath().toString(), "message", cv.getMessage()))
                .toList();
        writer.write(req, resp, HttpStatus.BAD_REQUEST, VALIDATION_ERROR, "Validation failed", details);
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, HttpMessageNotReadableException.class })
    public void handleBadRequest(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull Exception ex) throws IOException {
        log.debug("Unreadable request on {}: {}", req.getRequestURI(), ex.getMessage());
        writer.write(req, resp, HttpStatus.BAD_REQUEST, VALIDATION_ERROR, "Malformed or missing request body or parameters");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public void handleTypeMismatch(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull MethodArgumentTypeMismatchException ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST, VALIDATION_ERROR,
                "Parameter '" + ex.getName() + "' has invalid type");
    }

    // ---------- HTTP mapping errors (JSON, not HTML) ----------

    @ExceptionHandler({ NoHandlerFoundException.class, NoResourceFoundException.class })
    public void handleNoHandler(@NonNull HttpServletRequest req,
                                @NonNull HttpServletResponse resp,
                                @NonNull Exception ex) throws IOException {
        writer.write(req, resp, HttpStatus.NOT_FOUND, "NOT_FOUND", "Route " + req.getRequestURI() + " not found");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public void handleMethodNotAllowed(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull HttpRequestMethodNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED",
                "HTTP method not supported for this endpoint");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public void handleUnsupportedMediaType(@NonNull HttpServletRequest req,
                                           @NonNull HttpServletResponse resp,
                                           @NonNull HttpMediaTypeNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UNSUPPORTED_MEDIA_TYPE",
                "Content type is not supported");
    }

    // ---------- Data conflicts ----------

    /**
     * A concurrent registration can pass the existence check and still hit the email
     * unique constraint. Any other integrity failure is reported as a plain conflict.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public void handleDataIntegrity(@NonNull HttpServletRequest req,
                                    @NonNull HttpServletResponse resp,
                                    @NonNull DataIntegrityViolationException ex) throws IOException {
        if (violatesEmailUniqueness(ex)) {
            log.debug("Duplicate email rejected by the database: {}", ex.getMostSpecificCause().getMessage());
            writer.write(req, resp, HttpStatus.BAD_REQUEST, "EMAIL_EXISTS", "Email already registered");
            return;
        }
        log.error("Data integrity violation on {} {}", req.getMethod(), req.getRequestURI(), ex);
        writer.write(req, resp, HttpStatus.CONFLICT, "CONFLICT", "Request conflicts with stored data");
    }

    static boolean violatesEmailUniqueness(DataIntegrityViolationException ex) {
        for (Throwable t = ex; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof org.hibernate.exception.ConstraintViolationException cve
                    && User.EMAIL_UNIQUE_CONSTRAINT.equalsIgnoreCase(cve.getConstraintName())) {
                return true;
            }
            // drivers that do not report a constraint name still mention it in the message
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(User.EMAIL_UNIQUE_CONSTRAINT)) {
                return true;
            }
        }
        return false;
    }

    // ---------- Fallback 500 ----------

    @ExceptionHandler(Exception.class)
    public void handleGeneric(@NonNull HttpServletRequest req,
                              @NonNull HttpServletResponse resp,
                              @NonNull Exception ex) throws IOException {
        log.error("Unhandled exception on {} {}", req.getMethod(), req.getRequestURI(), ex);
        String message = exposeDetails && ex.getMessage() != null ? ex.getMessage() : "Internal server error";
        writer.write(req, resp, HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", message);
    }

    // ---------- helpers ----------

    private String safeMessage(String s) {
        return (s == null || s.isBlank()) ? "Request could not be processed" : s;
    }
}
