package com.shopnest.authservice.dto;

import java.util.List;

/** Admin listing: {@code {users, pagination{page, limit, total, pages}}}. */
public record UserPage(List<UserResponse> users, Pagination pagination) {

    public record Pagination(int page, int limit, long total, int pages) {
    }
}
