package me.golemcore.support;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class SupportApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(SupportApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(SupportApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(SupportApplication.class.getMethod("main", String[].class));
    }
}
