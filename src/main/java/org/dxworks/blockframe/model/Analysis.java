package org.dxworks.blockframe.model;

/**
 * Marker interface for per-file analysis results written to the JSONL output.
 */
public interface Analysis {
    String getFilePath();
    String getLanguage();
}
