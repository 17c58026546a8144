package guraa.doccompare.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.doccompare.comparison.ComparisonResult;
import guraa.doccompare.config.AppConfig;
import guraa.doccompare.model.difference.DiffResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Serializes comparison results to JSON for the report renderer.
 * Identical results always produce identical bytes.
 */
@Component
public class DiffResultJsonWriter {

    private final ObjectMapper objectMapper;

    @Autowired
    public DiffResultJsonWriter(@Qualifier("diffResultObjectMapper") ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DiffResultJsonWriter() {
        this(AppConfig.createDiffResultMapper());
    }

    public String write(DiffResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(result);
    }

    public String write(ComparisonResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(result);
    }

    public byte[] writeBytes(DiffResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(result);
    }
}
