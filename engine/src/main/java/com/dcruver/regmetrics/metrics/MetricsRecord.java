package com.dcruver.regmetrics.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Structural and linguistic measurements of one document version.
 * Unique per (document_id, metrics_date).
 */
@Value
@Builder
@Jacksonized
public class MetricsRecord {
    @JsonProperty("document_id")
    String documentId;

    @JsonProperty("metrics_date")
    LocalDate metricsDate;

    @JsonProperty("word_count")
    int wordCount;

    @JsonProperty("sentence_count")
    int sentenceCount;

    @JsonProperty("paragraph_count")
    int paragraphCount;

    @JsonProperty("section_count")
    int sectionCount;

    @JsonProperty("subpart_count")
    int subpartCount;

    @JsonProperty("total_authors")
    int totalAuthors;       // distinct authors up to and including this version

    @JsonProperty("revision_authors")
    int revisionAuthors;

    @JsonProperty("language_complexity_score")
    double languageComplexityScore;

    @JsonProperty("readability_score")
    double readabilityScore;

    @JsonProperty("average_sentence_length")
    double averageSentenceLength;

    @JsonProperty("average_word_length")
    double averageWordLength;

    @JsonProperty("simplicity_score")
    double simplicityScore;

    @JsonProperty("flesch_reading_ease")
    double fleschReadingEase;

    @JsonProperty("smog_index_score")
    double smogIndexScore;

    @JsonProperty("automated_readability_score")
    double automatedReadabilityScore;

    @JsonProperty("combined_readability_score")
    double combinedReadabilityScore;    // 50% Flesch, 25% SMOG, 25% ARI

    @JsonProperty("content_snapshot")
    String contentSnapshot;
}
