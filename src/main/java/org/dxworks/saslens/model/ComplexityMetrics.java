package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"totalLines", "codeLines", "commentLines", "blankLines", "macroStepCount",
        "procStepCount", "dataStepCount", "conditionalCount", "loopCount", "decisionPoints",
        "cyclomaticComplexity"})
public class ComplexityMetrics {
    public int totalLines;
    public int codeLines;
    public int commentLines;
    public int blankLines;
    public int macroStepCount;
    public int procStepCount;
    public int dataStepCount;
    public int conditionalCount;
    public int loopCount;
    public int decisionPoints;
    public int cyclomaticComplexity = 1;
}
