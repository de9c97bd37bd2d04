package com.ndcheck.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A problem plus its proof, given either as step descriptors ({@code lines}) or as raw
 * editor tuples ({@code tuples}). Descriptors win when both are present.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckProofRequest extends ValidateProblemRequest {

    private List<StepDescriptor> lines = new ArrayList<>();
    private List<JsonNode> tuples = new ArrayList<>();

    public List<StepDescriptor> getLines() {
        return lines;
    }

    public void setLines(List<StepDescriptor> lines) {
        this.lines = lines != null ? lines : new ArrayList<>();
    }

    public List<JsonNode> getTuples() {
        return tuples;
    }

    public void setTuples(List<JsonNode> tuples) {
        this.tuples = tuples != null ? tuples : new ArrayList<>();
    }
}
