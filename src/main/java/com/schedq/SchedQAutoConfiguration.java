package com.schedq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.schedq.config.SchedQProperties;
import com.schedq.internal.SchedQMetrics;
import com.schedq.queue.QueueRouter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationExcludeFilter;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.TypeExcludeFilter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.scheduling.annotation.EnableScheduling;

@AutoConfiguration(
        after = JacksonAutoConfiguration.class,
        before = { HibernateJpaAutoConfiguration.class, JpaRepositoriesAutoConfiguration.class },
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@AutoConfigurationPackage(basePackages = "com.schedq")
@ComponentScan(value = "com.schedq", excludeFilters = {
        @ComponentScan.Filter(type = FilterType.CUSTOM, classes = TypeExcludeFilter.class),
        @ComponentScan.Filter(type = FilterType.CUSTOM, classes = AutoConfigurationExcludeFilter.class) })
@EnableScheduling
@EnableConfigurationProperties(SchedQProperties.class)
public class SchedQAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "schedqObjectMapper")
    public ObjectMapper schedqObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public SchedQMetrics schedqMetrics(JobRepository jobRepository, QueueRouter queueRouter,
            MeterRegistry meterRegistry) {
        return new SchedQMetrics(jobRepository, queueRouter, meterRegistry);
    }
}
