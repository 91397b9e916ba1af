package org.dxworks.saslens.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Datasets read and written by DATA steps and procedure options outside PROC SQL.
 */
public class DatasetUsage {
    public Set<String> input = new LinkedHashSet<>();
    public Set<String> output = new LinkedHashSet<>();
}
