package taskapp.config;

import org.springframework.boot.jackson.autoconfigure.JsonMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.cfg.CoercionAction;
import tools.jackson.databind.cfg.CoercionInputShape;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.type.LogicalType;

/**
 * Jackson configuration for request bodies.
 *
 * <p>String fields such as {@code name}, {@code email} or {@code assignedUser} reject
 * boolean and numeric JSON values instead of silently turning them into text, so
 * {@code {"name": 42}} is a 400 rather than a User called "42". {@code deadline} is
 * untyped and keeps accepting numbers.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public JsonMapperBuilderCustomizer strictCoercionCustomizer() {
        return JacksonConfig::configureStrictCoercion;
    }

    static void configureStrictCoercion(final JsonMapper.Builder builder) {
        builder.withCoercionConfig(LogicalType.Textual, config -> {
            config.setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
            config.setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
            config.setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        });
    }
}
