package com.dcruver.regmetrics.metrics;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Weights and normalization ranges for the language complexity score.
 * Weights are relative; they need not sum to 1.
 */
@Component
@ConfigurationProperties(prefix = "regmetrics.metrics")
@Data
public class ComplexityPolicy {
    private double sentenceLengthWeight = 0.4;
    private double wordLengthWeight = 0.3;
    private double longWordWeight = 0.3;

    // Average sentence length in words mapped onto 0..1
    private double minSentenceLength = 10;
    private double maxSentenceLength = 40;

    // Average word length in characters mapped onto 0..1
    private double minWordLength = 4;
    private double maxWordLength = 8;

    private int longWordLetters = 7;

    private int snapshotLength = 500;

    /**
     * Weighted mean of the three normalized components (0..1)
     */
    public double weightedMean(double sentenceLength, double wordLength, double longWordRatio) {
        double totalWeight = sentenceLengthWeight + wordLengthWeight + longWordWeight;
        if (totalWeight <= 0) {
            return 0.0;
        }

        double weighted = sentenceLengthWeight * normalize(sentenceLength, minSentenceLength, maxSentenceLength)
            + wordLengthWeight * normalize(wordLength, minWordLength, maxWordLength)
            + longWordWeight * clamp(longWordRatio);
        return clamp(weighted / totalWeight);
    }

    static double normalize(double value, double min, double max) {
        if (max <= min) {
            return value >= max ? 1.0 : 0.0;
        }
        return clamp((value - min) / (max - min));
    }

    static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
