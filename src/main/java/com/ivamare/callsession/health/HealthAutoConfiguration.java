package com.ivamare.callsession.health;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Auto-configuration for session store health indicators.
 */
@AutoConfiguration(after = JdbcTemplateAutoConfiguration.class)
@ConditionalOnClass({HealthIndicator.class, JdbcTemplate.class})
@ConditionalOnBean(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "callsession", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(SessionStoreHealthIndicator.class)
    public SessionStoreHealthIndicator sessionStoreHealthIndicator(
            JdbcTemplate jdbcTemplate,
            ObjectProvider<DataSource> dataSource) {
        return new SessionStoreHealthIndicator(jdbcTemplate, dataSource.getIfAvailable());
    }
}
