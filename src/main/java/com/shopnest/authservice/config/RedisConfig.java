package com.shopnest.authservice.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.resource.DefaultClientResources;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Pooled Lettuce connection for the session registry. Commands are bounded by
 * {@code spring.data.redis.timeout} (default 2s) so an unreachable Redis fails fast
 * instead of hanging request threads.
 */
@Configuration
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {

    private static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(2);

    @Bean(destroyMethod = "shutdown")
    DefaultClientResources lettuceClientResources() {
        return DefaultClientResources.create();
    }

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties props,
                                                           DefaultClientResources clientResources) {

        // --- Standalone ---
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration();
        standalone.setHostName(props.getHost());
        standalone.setPort(props.getPort());
        standalone.setDatabase(props.getDatabase());
        if (StringUtils.hasText(props.getUsername())) {
            standalone.setUsername(props.getUsername());
        }
        if (StringUtils.hasText(props.getPassword())) {
            standalone.setPassword(RedisPassword.of(props.getPassword()));
        }

        // --- Pool: MUST be typed to StatefulConnection<?, ?> ---
        GenericObjectPoolConfig<StatefulConnection<?, ?>> pool = new GenericObjectPoolConfig<>();
        RedisProperties.Pool p = props.getLettuce().getPool();
        pool.setMaxTotal(p.getMaxActive());
        pool.setMaxIdle(p.getMaxIdle());
        pool.setMinIdle(p.getMinIdle());
        if (p.getMaxWait() != null && !p.getMaxWait().isNegative()) {
            pool.setMaxWait(p.getMaxWait());
        }
        pool.setTestWhileIdle(true);

        // --- Timeouts / SSL ---
        Duration cmdTimeout = props.getTimeout() != null ? props.getTimeout() : DEFAULT_COMMAND_TIMEOUT;

        LettucePoolingClientConfiguration.LettucePoolingClientConfigurationBuilder builder =
                LettucePoolingClientConfiguration.builder()
                        .clientResources(clientResources)
                        .commandTimeout(cmdTimeout)
                        .shutdownTimeout(Duration.ofSeconds(2))
                        .clientOptions(ClientOptions.builder()
                                .autoReconnect(true)
                                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                                .timeoutOptions(TimeoutOptions.enabled(cmdTimeout))
                                .build())
                        .poolConfig(pool);

        if (props.getSsl().isEnabled()) {
            builder.useSsl();
        }

        return new LettuceConnectionFactory(standalone, builder.build());
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory cf) {
        return new StringRedisTemplate(cf);
    }
}
