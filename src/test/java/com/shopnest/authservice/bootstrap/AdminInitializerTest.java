package com.shopnest.authservice.bootstrap;

import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.entity.UserRole;
import com.shopnest.authservice.repository.UserRepository;
import com.shopnest.authservice.support.InMemoryUserStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class AdminInitializerTest {

    @Mock
    private UserRepository userRepository;

    private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private InMemoryUserStore users;

    @BeforeEach
    void setUp() {
        users = InMemoryUserStore.backing(userRepository);
    }

    @Test
    void createsVerifiedAdminOnce() {
        AdminInitializer initializer = new AdminInitializer(userRepository, encoder, " Root@ShopNest.test ", "root-pass");

        initializer.run();
        initializer.run();

        assertThat(users.size()).isEqualTo(1);
        User admin = users.byEmail("root@shopnest.test").orElseThrow();
        assertThat(admin.getRole()).isEqualTo(UserRole.ADMIN);
        assertThat(admin.isEmailVerified()).isTrue();
        assertThat(admin.verifyPassword("root-pass", encoder)).isTrue();
    }

    @Test
    void skippedWhenNotConfigured() {
        new AdminInitializer(userRepository, encoder, "", "").run();

        assertThat(users.size()).isZero();
    }
}
