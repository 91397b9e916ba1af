package org.dxworks.saslens.model;

/**
 * Marker interface for analysis results written by the runner.
 */
public interface Analysis {
    String getFilePath();
    String getLanguage();
}
