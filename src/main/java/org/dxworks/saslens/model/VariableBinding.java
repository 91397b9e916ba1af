package org.dxworks.saslens.model;

public class VariableBinding {
    public String name;
    public String value;
    public int order;  // position in definition order, 0-based

    public VariableBinding(String name, String value, int order) {
        this.name = name;
        this.value = value;
        this.order = order;
    }
}
