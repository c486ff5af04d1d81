package com.ivamare.callsession;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.callsession.api.EventLogger;
import com.ivamare.callsession.api.IdentityService;
import com.ivamare.callsession.api.SessionLifecycle;
import com.ivamare.callsession.api.impl.DefaultEventLogger;
import com.ivamare.callsession.api.impl.DefaultIdentityService;
import com.ivamare.callsession.api.impl.DefaultSessionLifecycle;
import com.ivamare.callsession.auth.JwtManager;
import com.ivamare.callsession.repository.SessionEventRepository;
import com.ivamare.callsession.repository.SessionRepository;
import com.ivamare.callsession.repository.UserRepository;
import com.ivamare.callsession.repository.impl.JdbcSessionEventRepository;
import com.ivamare.callsession.repository.impl.JdbcSessionRepository;
import com.ivamare.callsession.repository.impl.JdbcUserRepository;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Auto-configuration for the call session service.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Repositories (Session, SessionEvent, User)</li>
 *   <li>Password encoder and JWT manager</li>
 *   <li>Session lifecycle, event logger and identity services</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * callsession.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    JacksonAutoConfiguration.class
})
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "callsession", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CallSessionProperties.class)
public class CallSessionAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper callSessionObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock callSessionClock() {
        return Clock.systemUTC();
    }

    // --- Repositories ---

    @Bean
    @ConditionalOnMissingBean
    public SessionRepository sessionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcSessionRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionEventRepository sessionEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcSessionEventRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public UserRepository userRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcUserRepository(jdbcTemplate);
    }

    // --- Credentials ---

    @Bean
    @ConditionalOnMissingBean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    @ConditionalOnMissingBean
    public JwtManager jwtManager(CallSessionProperties properties, Clock clock) {
        CallSessionProperties.JwtProperties jwt = properties.getJwt();
        if (jwt.getSecret() == null || jwt.getSecret().isBlank()) {
            throw new IllegalStateException("callsession.jwt.secret must be configured");
        }
        return new JwtManager(
            jwt.getSecret().getBytes(StandardCharsets.UTF_8),
            jwt.getIssuer(),
            jwt.getTtl(),
            clock
        );
    }

    // --- Core services ---

    @Bean
    @ConditionalOnMissingBean
    public SessionLifecycle sessionLifecycle(
            SessionRepository sessionRepository,
            SessionEventRepository eventRepository,
            CallSessionProperties properties,
            Clock clock) {
        return new DefaultSessionLifecycle(sessionRepository, eventRepository, properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventLogger eventLogger(
            SessionRepository sessionRepository,
            SessionEventRepository eventRepository,
            Clock clock) {
        return new DefaultEventLogger(sessionRepository, eventRepository, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentityService identityService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtManager jwtManager,
            Clock clock) {
        return new DefaultIdentityService(userRepository, passwordEncoder, jwtManager, clock);
    }
}
