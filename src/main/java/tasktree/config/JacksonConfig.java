package tasktree.config;

import org.springframework.boot.jackson.autoconfigure.JsonMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.cfg.CoercionAction;
import tools.jackson.databind.cfg.CoercionInputShape;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.type.LogicalType;

/**
 * Jackson settings shared by the REST API and the node document mapper.
 *
 * <p>Titles, ids, and room names are strings on the wire and in stored documents. A
 * request such as {@code {"title": false}} is rejected instead of being stored as
 * {@code "false"}.
 */
@Configuration
public class JacksonConfig {

    /**
     * @return customizer applied to the auto-configured JsonMapper
     */
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
