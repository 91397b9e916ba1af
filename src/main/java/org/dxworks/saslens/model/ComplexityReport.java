package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonPropertyOrder({"method", "blocks"})
public class ComplexityReport {
    public static final String FILE_BLOCK = "__FILE__";
    public static final String TOP_LEVEL_BLOCK = "__TOP_LEVEL__";
    public static final String KEYWORD_COUNT_METHOD =
            "keyword-count approximation: decision points (if, do while, do until, iterative do) + 1; no control-flow graph";

    public String method = KEYWORD_COUNT_METHOD;
    public Map<String, ComplexityMetrics> blocks = new LinkedHashMap<>();
}
