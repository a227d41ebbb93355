package com.shopnest.authservice.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopnest.authservice.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Writes the failure envelope straight to the servlet response. Used by the exception
 * handler and by the security entry points, which run before any controller.
 */
@Component
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;

    public ErrorResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      @NonNull String code,
                      @NonNull String message) throws IOException {
        write(req, resp, status, code, message, null);
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      @NonNull String code,
                      @NonNull String message,
                      Object details) throws IOException {

        if (resp.isCommitted()) return;

        String requestId = resolveRequestId(req, resp);
        if (requestId != null && resp.getHeader(RequestIdFilter.REQUEST_ID_HEADER) == null) {
            resp.setHeader(RequestIdFilter.REQUEST_ID_HEADER, requestId);
        }

        resp.setStatus(status.value());
        resp.setHeader("Cache-Control", "no-store");
        resp.setHeader("Pragma", "no-cache");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType(MediaType.APPLICATION_JSON_VALUE);

        objectMapper.writeValue(resp.getOutputStream(), ApiResponse.failure(code, message, details));
    }

    private String resolveRequestId(HttpServletRequest req, HttpServletResponse resp) {
        String id = resp.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        if (id == null || id.isBlank()) {
            Object attr = req.getAttribute(RequestIdFilter.REQUEST_ID_ATTR);
            if (attr instanceof String s && !s.isBlank()) {
                id = s;
            }
        }
        return id;
    }
}
