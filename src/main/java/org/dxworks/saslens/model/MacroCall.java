package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Deduplicated caller/callee pair with the number of times the call occurs.
 */
@JsonPropertyOrder({"caller", "callee", "kind", "callCount"})
public class MacroCall {
    public String caller;
    public String callee;
    public CallKind kind;
    public int callCount = 1;

    public MacroCall(String caller, String callee, CallKind kind) {
        this.caller = caller;
        this.callee = callee;
        this.kind = kind;
    }

    // For aggregation: macro names are case-insensitive
    public boolean matches(String caller, String callee) {
        boolean callerMatch = this.caller != null && this.caller.equalsIgnoreCase(caller);
        boolean calleeMatch = this.callee != null && this.callee.equalsIgnoreCase(callee);
        return callerMatch && calleeMatch;
    }
}
