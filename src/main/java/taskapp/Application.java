package taskapp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import taskapp.config.AppProperties;

/**
 * Spring Boot entry point for the task assignment service.
 *
 * <p>Serves {@code /api/users} and {@code /api/tasks}; OpenAPI docs are at
 * {@code /swagger-ui.html}. Run with {@code --spring.profiles.active=h2} to use an
 * embedded database instead of PostgreSQL.
 */
@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class Application {

    public static void main(final String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
