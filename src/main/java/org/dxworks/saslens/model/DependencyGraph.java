package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"edges", "calls", "externalMacros", "unusedMacros", "includes", "datasetUsage"})
public class DependencyGraph {
    public static final String TOP_LEVEL_CALLER = "__TOP_LEVEL__";

    // Raw multigraph, one edge per invocation, in source order
    public List<MacroCallEdge> edges = new ArrayList<>();
    // Summary view, one entry per caller/callee pair
    public List<MacroCall> calls = new ArrayList<>();
    public List<String> externalMacros = new ArrayList<>();
    public List<String> unusedMacros = new ArrayList<>();
    public List<String> includes = new ArrayList<>();
    public DatasetUsage datasetUsage = new DatasetUsage();
}
