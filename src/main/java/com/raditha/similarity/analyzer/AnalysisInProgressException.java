package com.raditha.similarity.analyzer;

/**
 * Thrown when a project analysis is requested while another one is still
 * running on the same analyzer.
 */
public class AnalysisInProgressException extends IllegalStateException {

    public AnalysisInProgressException(String projectPath) {
        super("Analysis already in progress; rejected request for " + projectPath);
    }
}
