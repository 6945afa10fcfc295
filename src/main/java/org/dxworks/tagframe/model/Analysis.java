package org.dxworks.tagframe.model;

/**
 * Marker interface for all analysis result types.
 * Allows different input languages to return different analysis structures.
 */
public interface Analysis {
    String getFilePath();
    String getLanguage();
}
