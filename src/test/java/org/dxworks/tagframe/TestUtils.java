package org.dxworks.tagframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.tagframe.model.Analysis;

public class TestUtils {
    public static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static JsonNode toJson(Analysis analysis) {
        return JSON_MAPPER.valueToTree(analysis);
    }
}
