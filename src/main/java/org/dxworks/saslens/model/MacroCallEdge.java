package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One observed macro invocation. Repeated invocations produce repeated edges.
 */
@JsonPropertyOrder({"caller", "callee", "kind", "line"})
public class MacroCallEdge {
    public String caller;
    public String callee;
    public CallKind kind;
    public int line;

    public MacroCallEdge(String caller, String callee, CallKind kind, int line) {
        this.caller = caller;
        this.callee = callee;
        this.kind = kind;
        this.line = line;
    }
}
