package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashSet;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "blockId", "parameters", "parent", "depth", "startLine", "endLine",
        "startOffset", "endOffset", "bodyStart", "bodyEnd", "terminated", "invokes", "invoked", "status"})
public class MacroDefinition {
    public String name;
    public String blockId;  // key of this macro in the complexity map, unique per unit
    public String parameters;  // raw text between the parentheses, null when absent
    public String parent;  // enclosing macro for nested definitions
    public int depth;
    public int startLine;
    public int endLine;
    public int startOffset;  // start of the %macro statement
    public int endOffset;  // end of the %mend statement, or end of file
    public int bodyStart;
    public int bodyEnd;
    public boolean terminated = true;
    public Set<String> invokes = new LinkedHashSet<>();
    public boolean invoked;
    public MacroStatus status;

    @JsonIgnore
    public MacroDefinition parentDefinition;

    public MacroDefinition() {
    }

    public MacroDefinition(String name, String parameters, int startOffset, int bodyStart, int depth) {
        this.name = name;
        this.parameters = parameters;
        this.startOffset = startOffset;
        this.bodyStart = bodyStart;
        this.depth = depth;
    }
}
