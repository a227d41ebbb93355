package com.shopnest.authservice.controller;

import com.jayway.jsonpath.JsonPath;
import com.shopnest.authservice.SecurityConfig.JwtAccessDeniedHandler;
import com.shopnest.authservice.SecurityConfig.JwtAuthenticationEntryPoint;
import com.shopnest.authservice.SecurityConfig.JwtTokenProvider;
import com.shopnest.authservice.SecurityConfig.SecurityConfig;
import com.shopnest.authservice.config.ResponseConfig;
import com.shopnest.authservice.config.TimeConfig;
import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.entity.UserRole;
import com.shopnest.authservice.repository.UserRepository;
import com.shopnest.authservice.serviceImpl.AuthServiceImpl;
import com.shopnest.authservice.serviceImpl.EmailServiceImpl;
import com.shopnest.authservice.serviceImpl.RedisSessionRegistry;
import com.shopnest.authservice.serviceImpl.UserServiceImpl;
import com.shopnest.authservice.support.InMemoryRedis;
import com.shopnest.authservice.support.InMemoryUserStore;
import com.shopnest.authservice.utils.ErrorResponseWriter;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web slice with the real security chain, services and token codec; only the
 * database and Redis are replaced by in-memory doubles.
 */
@WebMvcTest(controllers = {AuthController.class, UserController.class, AdminUserController.class})
@Import({
        SecurityConfig.class,
        JwtAuthenticationEntryPoint.class,
        JwtAccessDeniedHandler.class,
        ErrorResponseWriter.class,
        JwtTokenProvider.class,
        RedisSessionRegistry.class,
        AuthServiceImpl.class,
        UserServiceImpl.class,
        EmailServiceImpl.class,
        TimeConfig.class,
        ResponseConfig.class
})
abstract class AbstractWebSliceTest {

    @Autowired
    protected MockMvc mvc;

    @Autowired
    protected PasswordEncoder passwordEncoder;

    @MockBean
    protected UserRepository userRepository;

    @MockBean
    protected StringRedisTemplate redis;

    protected InMemoryUserStore users;
    protected InMemoryRedis cache;

    @BeforeEach
    void wireDoubles() {
        users = InMemoryUserStore.backing(userRepository);
        cache = InMemoryRedis.backing(redis);
    }

    protected String registerJson(String email, String password) {
        return """
                {"email":"%s","password":"%s","firstName":"Alice","lastName":"Smith"}
                """.formatted(email, password);
    }

    protected MvcResult register(String email, String password) throws Exception {
        return mvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerJson(email, password)))
                .andExpect(status().isCreated())
                .andReturn();
    }

    protected MvcResult login(String email, String password) throws Exception {
        return mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"%s"}
                                """.formatted(email, password)))
                .andExpect(status().isOk())
                .andReturn();
    }

    protected User seedUser(String email, String password, UserRole role) {
        User user = User.builder()
                .email(email)
                .firstName("Seed")
                .lastName(role.value())
                .role(role)
                .build();
        user.applyPassword(password, passwordEncoder);
        return users.put(user);
    }

    protected static String accessToken(MvcResult result) throws Exception {
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.tokens.accessToken");
    }

    protected static String refreshToken(MvcResult result) throws Exception {
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.tokens.refreshToken");
    }

    protected static String bearer(String token) {
        return "Bearer " + token;
    }
}
