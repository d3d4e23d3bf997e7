package com.auditq;

import com.auditq.admission.AdmissionGuard;
import com.auditq.admission.AdmissionLock;
import com.auditq.api.ApiExceptionHandler;
import com.auditq.api.AuditQWebMvcConfigurer;
import com.auditq.api.EventStreamController;
import com.auditq.api.InternalEndpointInterceptor;
import com.auditq.api.JobController;
import com.auditq.api.MonitoringController;
import com.auditq.broadcast.Broadcaster;
import com.auditq.broadcast.SseBroadcaster;
import com.auditq.config.AuditQProperties;
import com.auditq.internal.AuditQMetrics;
import com.auditq.internal.AuditQSchemaInitializer;
import com.auditq.internal.BackgroundJobServer;
import com.auditq.internal.LeaseReaper;
import com.auditq.internal.QueueProcessor;
import com.auditq.internal.RetryPolicy;
import com.auditq.monitoring.RecurringMonitor;
import io.micrometer.core.instrument.MeterRegistry;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.Locale;

@AutoConfiguration(
        before = {HibernateJpaAutoConfiguration.class, JpaRepositoriesAutoConfiguration.class},
        afterName = {
                "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"})
@AutoConfigurationPackage(basePackages = "com.auditq")
@EnableScheduling
@EnableConfigurationProperties(AuditQProperties.class)
@Import({
        AuditQSchemaInitializer.class,
        RetryPolicy.class,
        AdmissionGuard.class,
        AdmissionLock.class,
        QueueProcessor.class,
        LeaseReaper.class,
        JobScheduler.class,
        RecurringMonitor.class,
        BackgroundJobServer.class})
public class AuditQAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock auditqClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceAccessPolicy auditqResourceAccessPolicy() {
        return ResourceAccessPolicy.allowAll();
    }

    @Bean
    @ConditionalOnMissingBean(Broadcaster.class)
    public SseBroadcaster auditqBroadcaster(AuditQProperties properties) {
        return new SseBroadcaster(properties.getApi().getEventStreamTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(name = "auditqHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer auditqHibernatePropertiesCustomizer(AuditQProperties properties) {
        return hibernateProperties -> {
            String prefix = properties.getDatabase().getTablePrefix();
            if (prefix == null || prefix.isBlank()) {
                return;
            }
            String trimmed = prefix.trim();
            hibernateProperties.put("hibernate.physical_naming_strategy", new CamelCaseToUnderscoresNamingStrategy() {
                @Override
                public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                    Identifier physical = super.toPhysicalTableName(name, jdbcEnvironment);
                    // Host application tables keep their names.
                    if (physical.getText().toLowerCase(Locale.ROOT).startsWith("auditq_")) {
                        return new Identifier(trimmed + physical.getText(), physical.isQuoted());
                    }
                    return physical;
                }
            });
        };
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public AuditQMetrics auditqMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
        return new AuditQMetrics(jobRepository, meterRegistry);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @Import({JobController.class, MonitoringController.class, EventStreamController.class,
            ApiExceptionHandler.class})
    static class WebConfiguration {

        @Bean
        InternalEndpointInterceptor auditqInternalEndpointInterceptor(AuditQProperties properties) {
            return new InternalEndpointInterceptor(properties);
        }

        @Bean
        AuditQWebMvcConfigurer auditqWebMvcConfigurer(InternalEndpointInterceptor interceptor) {
            return new AuditQWebMvcConfigurer(interceptor);
        }
    }
}
