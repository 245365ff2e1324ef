package com.gamebank.ledger.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import javax.sql.DataSource;
import java.time.Clock;

@Configuration
@EnableTransactionManagement
public class JdbcConfig {

    /**
     * Pooled DataSource for the ledger store.
     *
     * Hosting providers hand out connection strings as postgresql://... while the
     * driver expects jdbc:postgresql://..., so a missing jdbc: prefix is added here.
     * The driver class is resolved from the URL.
     */
    @Bean
    @Primary
    public DataSource dataSource(
            @Value("${spring.datasource.url}") String url,
            @Value("${spring.datasource.username:}") String username,
            @Value("${spring.datasource.password:}") String password,
            @Value("${spring.datasource.hikari.maximum-pool-size:20}") int maxPoolSize,
            @Value("${spring.datasource.hikari.minimum-idle:2}") int minIdle) {

        if (url != null && !url.startsWith("jdbc:")) {
            url = "jdbc:" + url;
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        if (username != null && !username.isEmpty()) config.setUsername(username);
        if (password != null && !password.isEmpty()) config.setPassword(password);
        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(minIdle);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        config.setPoolName("LedgerHikariPool");

        return new HikariDataSource(config);
    }

    @Bean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    /**
     * Time source for created/expiry timestamps. Payment-request expiry is
     * evaluated against this clock, never against the database's NOW().
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
