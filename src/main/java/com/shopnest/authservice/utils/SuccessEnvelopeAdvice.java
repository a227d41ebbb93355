package com.shopnest.authservice.utils;

import com.shopnest.authservice.dto.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps successful controller results in {@link ApiResponse}:
 * <pre>
 * { "success": true, "message": "...", "data": {...} }
 * </pre>
 * The message comes from {@link ResponseMessage}. Handlers with nothing but a
 * message return {@code ApiResponse.ok(message, null)} themselves.
 * Skips wrapping:
 *  - bodies that are already an ApiResponse (errors included)
 *  - non-2xx responses
 *  - non-JSON media types and framework endpoints (actuator, OpenAPI)
 */
@RestControllerAdvice(basePackages = "com.shopnest.authservice.controller")
public class SuccessEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(@NonNull MethodParameter returnType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        // Decide in beforeBodyWrite (we need MediaType & body)
        return true;
    }

    @Override
    public Object beforeBodyWrite(@Nullable Object body,
                                  @NonNull MethodParameter returnType,
                                  @NonNull MediaType selectedContentType,
                                  @NonNull Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  @NonNull ServerHttpRequest request,
                                  @NonNull ServerHttpResponse response) {

        if (body instanceof ApiResponse<?>) return body;
        if (!isJsonLike(selectedContentType)) return body;

        // Don't wrap if the response status is not 2xx
        if (response instanceof ServletServerHttpResponse sResp) {
            int sc = sResp.getServletResponse().getStatus();
            if (sc < 200 || sc >= 300) return body;
        }

        return ApiResponse.ok(resolveMessage(returnType), body);
    }

    private boolean isJsonLike(@NonNull MediaType mt) {
        if (MediaType.APPLICATION_PROBLEM_JSON.includes(mt)) return false;
        return MediaType.APPLICATION_JSON.includes(mt) || mt.getSubtype().endsWith("+json");
    }

    /** Resolve message from @ResponseMessage on method or controller. */
    private @Nullable String resolveMessage(@NonNull MethodParameter returnType) {
        ResponseMessage ann = returnType.getMethodAnnotation(ResponseMessage.class);
        if (ann == null) {
            ann = returnType.getContainingClass().getAnnotation(ResponseMessage.class);
        }
        return (ann != null && StringUtils.hasText(ann.value())) ? ann.value() : null;
    }
}
