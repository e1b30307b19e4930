package com.cronq;

import com.cronq.config.CronQProperties;
import com.cronq.internal.CronQMetrics;
import com.cronq.internal.DatabaseQueueClock;
import com.cronq.internal.SystemQueueClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

@AutoConfiguration
@ComponentScan("com.cronq")
@EnableScheduling
@EnableConfigurationProperties(CronQProperties.class)
public class CronQAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "cronqObjectMapper")
    public ObjectMapper cronqObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(QueueClock.class)
    public QueueClock cronqQueueClock(CronQProperties properties, ObjectProvider<JdbcTemplate> jdbcTemplate) {
        if (properties.getClock().getSource() == CronQProperties.Clock.Source.SYSTEM) {
            return new SystemQueueClock();
        }
        return new DatabaseQueueClock(jdbcTemplate.getObject());
    }

    @Bean
    @ConditionalOnMissingBean(name = "cronqHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer cronqHibernatePropertiesCustomizer(CronQProperties properties) {
        return hibernateProperties -> {
            String prefix = properties.getDatabase().getTablePrefix();
            if (prefix != null && !prefix.trim().isEmpty()) {
                hibernateProperties.put("hibernate.physical_naming_strategy",
                        new CamelCaseToUnderscoresNamingStrategy() {
                            @Override
                            public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                                Identifier original = super.toPhysicalTableName(name, jdbcEnvironment);
                                // Only intercept CronQ tables
                                if (original.getText().toLowerCase().startsWith("cronq_")) {
                                    return new Identifier(prefix.trim() + original.getText(), original.isQuoted());
                                }
                                return original;
                            }
                        });
            }
        };
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        public CronQMetrics cronqMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
            return new CronQMetrics(jobRepository, meterRegistry);
        }
    }
}
