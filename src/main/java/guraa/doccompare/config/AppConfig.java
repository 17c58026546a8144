package guraa.doccompare.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application configuration.
 */
@Configuration
public class AppConfig {

    /**
     * ObjectMapper used to hand diff results to the renderer.
     * Properties are sorted so identical results always serialize to identical bytes.
     *
     * @return The configured ObjectMapper
     */
    @Bean
    public ObjectMapper diffResultObjectMapper() {
        return createDiffResultMapper();
    }

    public static ObjectMapper createDiffResultMapper() {
        return JsonMapper.builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .build();
    }
}
