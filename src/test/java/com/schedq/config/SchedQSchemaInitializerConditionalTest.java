package com.schedq.config;

import com.schedq.SchedQSchemaInitializer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class SchedQSchemaInitializerConditionalTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withPropertyValues("schedq.database.fail-on-migration-error=false")
            .withUserConfiguration(SchedQSchemaInitializer.class)
            .withBean(DataSource.class, () -> mock(DataSource.class));

    @Test
    void shouldCreateSchemaInitializerByDefault() {
        contextRunner.run(context -> assertFalse(context.getBeansOfType(SchedQSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldSkipSchemaInitializerWhenConfigured() {
        contextRunner.withPropertyValues("schedq.database.skip-create=true")
                .run(context -> assertTrue(context.getBeansOfType(SchedQSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldFailStartupWhenMigrationFailsByDefault() {
        new ApplicationContextRunner()
                .withUserConfiguration(SchedQSchemaInitializer.class)
                .withBean(DataSource.class, () -> mock(DataSource.class))
                .run(context -> assertTrue(context.getStartupFailure() != null));
    }
}
