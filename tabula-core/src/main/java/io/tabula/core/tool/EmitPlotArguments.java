package io.tabula.core.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

public record EmitPlotArguments(String title, Map<String, Object> spec) {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public static EmitPlotArguments from(Map<String, Object> args) {
        String title = ToolArguments.optionalText(args, "title");
        Object raw = args.get("vega_lite_spec");
        if (raw == null) {
            throw new ToolArgumentException("'vega_lite_spec' is required");
        }
        Map<String, Object> spec;
        if (raw instanceof String text) {
            // some models send the spec as an encoded JSON string
            try {
                spec = JSON.readValue(text, MAP_TYPE);
            } catch (JsonProcessingException e) {
                throw new ToolArgumentException("'vega_lite_spec' is not valid JSON: " + e.getOriginalMessage());
            }
        } else {
            spec = ToolArguments.object(args, "vega_lite_spec");
        }
        return new EmitPlotArguments(title, spec);
    }
}
