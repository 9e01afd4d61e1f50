package com.raditha.similarity.model;

/**
 * What refactoring a cluster is expected to buy.
 *
 * @param linesOfCode                Lines that could be removed
 * @param maintainabilityImprovement Relative maintainability score
 */
public record EstimatedSavings(int linesOfCode, int maintainabilityImprovement) {
}
