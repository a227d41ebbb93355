package com.shopnest.authservice.controller;

import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.entity.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AdminUserControllerTest extends AbstractWebSliceTest {

    private User admin;
    private String adminToken;
    private String customerToken;

    @BeforeEach
    void seed() throws Exception {
        admin = seedUser("admin@example.com", "admin-pass", UserRole.ADMIN);
        seedUser("vendor@example.com", "vendor-pass", UserRole.VENDOR);
        adminToken = accessToken(login("admin@example.com", "admin-pass"));
        customerToken = accessToken(register("cust@example.com", "secret123"));
    }

    @Test
    void customersCannotListUsers() throws Exception {
        mvc.perform(get("/users").header(HttpHeaders.AUTHORIZATION, bearer(customerToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("FORBIDDEN"))
                .andExpect(jsonPath("$.error.message").value("Insufficient permissions"));
    }

    @Test
    void anonymousCallersGetNoToken() throws Exception {
        mvc.perform(get("/users"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("NO_TOKEN"));
    }

    @Test
    void adminListsWithPagination() throws Exception {
        mvc.perform(get("/users").param("limit", "2").header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Users retrieved successfully"))
                .andExpect(jsonPath("$.data.users.length()").value(2))
                .andExpect(jsonPath("$.data.users[0].passwordHash").doesNotExist())
                .andExpect(jsonPath("$.data.pagination.page").value(1))
                .andExpect(jsonPath("$.data.pagination.limit").value(2))
                .andExpect(jsonPath("$.data.pagination.total").value(3))
                .andExpect(jsonPath("$.data.pagination.pages").value(2));
    }

    @Test
    void adminFiltersByRole() throws Exception {
        mvc.perform(get("/users").param("role", "vendor").header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.users.length()").value(1))
                .andExpect(jsonPath("$.data.users[0].email").value("vendor@example.com"));
    }

    @Test
    void unknownRoleFilterRejected() throws Exception {
        mvc.perform(get("/users").param("role", "wizard").header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void oversizedLimitRejected() throws Exception {
        mvc.perform(get("/users").param("limit", "101").header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void unknownUserIsNotFound() throws Exception {
        mvc.perform(get("/users/{id}", UUID.randomUUID()).header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("USER_NOT_FOUND"));
    }

    @Test
    void deactivatedUserCannotLogIn() throws Exception {
        User customer = users.byEmail("cust@example.com").orElseThrow();

        mvc.perform(put("/users/{id}/status", customer.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isActive\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("User status updated successfully"))
                .andExpect(jsonPath("$.data.isActive").value(false));

        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"cust@example.com\",\"password\":\"secret123\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("ACCOUNT_DEACTIVATED"));
    }

    @Test
    void statusRequiresFlag() throws Exception {
        User customer = users.byEmail("cust@example.com").orElseThrow();

        mvc.perform(put("/users/{id}/status", customer.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void adminCannotDeleteSelf() throws Exception {
        mvc.perform(delete("/users/{id}", admin.getId()).header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("CANNOT_DELETE_SELF"));
    }

    @Test
    void adminDeletesOtherUser() throws Exception {
        User vendor = users.byEmail("vendor@example.com").orElseThrow();

        mvc.perform(delete("/users/{id}", vendor.getId()).header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("User deleted successfully"));

        assertThat(users.byEmail("vendor@example.com")).isEmpty();
    }

    @Test
    void malformedIdIsBadRequest() throws Exception {
        mvc.perform(get("/users/{id}", "not-a-uuid").header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isBadRequest());
    }
}
