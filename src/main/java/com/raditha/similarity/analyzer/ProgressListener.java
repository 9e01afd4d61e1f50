package com.raditha.similarity.analyzer;

/**
 * Receives analysis progress as a percentage from 0 to 100.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(int percent);
}
