package com.mlld.sdk.types.results;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured output of {@code execute()}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecuteResult {
    private String output = "";
    private List<StateWrite> stateWrites = new ArrayList<>();
    private JsonNode exports;
    private List<Effect> effects = new ArrayList<>();
    private Metrics metrics;

    /**
     * Result carrying only text output, used when a payload has an unexpected shape.
     */
    public static ExecuteResult ofOutput(String output) {
        ExecuteResult result = new ExecuteResult();
        result.setOutput(output);
        return result;
    }
}
