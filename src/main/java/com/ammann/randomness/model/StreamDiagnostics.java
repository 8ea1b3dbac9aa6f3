/* (C)2026 */
package com.ammann.randomness.model;

/**
 * Uniformity and independence indicators of the live mixed stream.
 *
 * @param sampleCount           number of mixed values examined
 * @param ksStatistic           Kolmogorov-Smirnov distance from Uniform(0,1)
 * @param ksPValue              p-value of that distance
 * @param lagOneCorrelation     Pearson correlation of consecutive values
 * @param refreshCount          refresh count of the examined pool
 */
public record StreamDiagnostics(
        int sampleCount,
        double ksStatistic,
        double ksPValue,
        double lagOneCorrelation,
        long refreshCount) {}
