package com.shopnest.authservice.utils;

import java.lang.annotation.*;

/** Message placed in the success envelope for a handler's result. */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResponseMessage {
    String value();
}
