package com.dcruver.regmetrics.metrics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Computes word, sentence and paragraph counts plus complexity, readability and
 * simplicity scores for one version text, with the Flesch, SMOG and ARI components of
 * the combined readability score. Pure function of its inputs.
 */
@Component
@Slf4j
public class MetricsCalculator {

    // Tokens ending in '.' that do not close a sentence
    private static final Set<String> ABBREVIATIONS = Set.of(
        "u.s.c.", "u.s.", "u.s.a.", "c.f.r.", "fed.", "reg.", "regs.",
        "no.", "nos.", "sec.", "secs.", "pt.", "pts.", "par.", "para.", "paras.", "p.", "pp.",
        "vol.", "ch.", "chap.", "art.", "app.", "subch.", "cl.", "approx.",
        "e.g.", "i.e.", "cf.", "viz.", "al.", "v.", "vs.",
        "mr.", "mrs.", "ms.", "dr.", "st.", "inc.", "corp.", "co.", "ltd.", "dept.",
        "jan.", "feb.", "mar.", "apr.", "jun.", "jul.", "aug.", "sep.", "sept.", "oct.", "nov.", "dec."
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern TERMINATOR = Pattern.compile("[.!?]+$");
    private static final Pattern TRAILING_CLOSERS = Pattern.compile("[\"')\\]’”]+$");
    private static final Pattern LEADING_OPENERS = Pattern.compile("^[\"'(\\[‘“]+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

    private final ComplexityPolicy policy;

    public MetricsCalculator(ComplexityPolicy policy) {
        this.policy = policy;
    }

    public MetricsRecord compute(String documentId, LocalDate date, String text, DocumentStructure structure,
                                 Set<String> accumulatedAuthors, Set<String> revisionAuthors) {
        String body = text != null ? text : "";
        List<String> tokens = tokens(body);
        List<String> words = words(tokens);

        int wordCount = tokens.size();
        int sentenceCount = countSentences(tokens);
        int paragraphCount = countParagraphs(body);

        double averageSentenceLength = (double) wordCount / Math.max(sentenceCount, 1);
        double averageWordLength = words.isEmpty() ? 0.0
            : words.stream().mapToInt(String::length).average().orElse(0.0);

        double complexity;
        double readability;
        double simplicity;
        // Component scores on a 0..100 scale, higher is easier; all 0 for empty text
        double flesch = 0.0;
        double smog = 0.0;
        double ari = 0.0;
        if (wordCount == 0) {
            complexity = 0.1;
            readability = 100.0;
            simplicity = 1.0;
        } else {
            double longWordRatio = words.isEmpty() ? 0.0
                : (double) words.stream().filter(this::isLongWord).count() / words.size();
            double ariGrade = automatedReadabilityIndex(words, averageSentenceLength);

            flesch = fleschReadingEase(words, averageSentenceLength);
            smog = smogScore(words, sentenceCount);
            ari = toScale(100.0 - (ariGrade - 1) * 100.0 / 13);

            complexity = 0.1 + 0.9 * policy.weightedMean(averageSentenceLength, averageWordLength, longWordRatio);
            readability = 30.0 + 0.7 * flesch;
            simplicity = 1.0 - 0.9 * ComplexityPolicy.normalize(ariGrade, 1, 14);
        }
        double combined = 0.5 * flesch + 0.25 * smog + 0.25 * ari;

        log.debug("Metrics for {} at {}: {} words, {} sentences, {} paragraphs",
            documentId, date, wordCount, sentenceCount, paragraphCount);

        return MetricsRecord.builder()
            .documentId(documentId)
            .metricsDate(date)
            .wordCount(wordCount)
            .sentenceCount(sentenceCount)
            .paragraphCount(paragraphCount)
            .sectionCount(structure != null ? structure.getSectionCount() : 0)
            .subpartCount(structure != null ? structure.getSubpartCount() : 0)
            .totalAuthors(accumulatedAuthors != null ? accumulatedAuthors.size() : 0)
            .revisionAuthors(revisionAuthors != null ? revisionAuthors.size() : 0)
            .languageComplexityScore(complexity)
            .readabilityScore(readability)
            .averageSentenceLength(averageSentenceLength)
            .averageWordLength(averageWordLength)
            .simplicityScore(simplicity)
            .fleschReadingEase(flesch)
            .smogIndexScore(smog)
            .automatedReadabilityScore(ari)
            .combinedReadabilityScore(combined)
            .contentSnapshot(snapshot(body))
            .build();
    }

    /**
     * Sentence terminators are runs of . ! ? at the end of a token. Abbreviations do not
     * count, and unterminated trailing text counts as one sentence.
     */
    int countSentences(List<String> tokens) {
        int sentences = 0;
        boolean open = false;

        for (String token : tokens) {
            String stripped = TRAILING_CLOSERS.matcher(token).replaceFirst("");
            if (TERMINATOR.matcher(stripped).find() && !isAbbreviation(stripped)) {
                sentences++;
                open = false;
            } else {
                open = true;
            }
        }

        return open ? sentences + 1 : sentences;
    }

    int countParagraphs(String text) {
        int paragraphs = 0;
        for (String block : PARAGRAPH_BREAK.split(text)) {
            if (!block.isBlank()) {
                paragraphs++;
            }
        }
        return paragraphs;
    }

    /**
     * Syllables estimated by vowel groups, ignoring a silent final 'e'. At least one per word.
     */
    static int countSyllables(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.endsWith("e")) {
            lower = lower.substring(0, lower.length() - 1);
        }

        int count = 0;
        boolean previousVowel = false;
        for (int i = 0; i < lower.length(); i++) {
            boolean vowel = "aeiouy".indexOf(lower.charAt(i)) >= 0;
            if (vowel && !previousVowel) {
                count++;
            }
            previousVowel = vowel;
        }
        return Math.max(1, count);
    }

    private double fleschReadingEase(List<String> words, double wordsPerSentence) {
        if (words.isEmpty()) {
            return 100.0;
        }
        int syllables = words.stream().mapToInt(MetricsCalculator::countSyllables).sum();
        double syllablesPerWord = (double) syllables / words.size();
        double score = 206.835 - 1.015 * wordsPerSentence - 84.6 * syllablesPerWord;
        return toScale(score);
    }

    /**
     * SMOG grade mapped from 6..20 onto 100..0. Needs 30 sentences; shorter texts score 0.
     */
    private static double smogScore(List<String> words, int sentences) {
        if (sentences < 30 || words.isEmpty()) {
            return 0.0;
        }
        long polysyllables = words.stream().filter(word -> countSyllables(word) >= 3).count();
        double grade = 1.0430 * Math.sqrt(polysyllables * (30.0 / sentences)) + 3.1291;
        return toScale(100.0 - (grade - 6) * 100.0 / 14);
    }

    private static double toScale(double score) {
        return Math.min(100.0, Math.max(0.0, score));
    }

    private double automatedReadabilityIndex(List<String> words, double wordsPerSentence) {
        if (words.isEmpty()) {
            return 0.0;
        }
        int characters = words.stream().mapToInt(String::length).sum();
        return 4.71 * ((double) characters / words.size()) + 0.5 * wordsPerSentence - 21.43;
    }

    private boolean isLongWord(String word) {
        return word.codePoints().filter(Character::isLetter).count() >= policy.getLongWordLetters();
    }

    private static boolean isAbbreviation(String token) {
        String candidate = LEADING_OPENERS.matcher(token).replaceFirst("").toLowerCase(Locale.ROOT);
        return ABBREVIATIONS.contains(candidate);
    }

    private String snapshot(String text) {
        int limit = Math.max(0, policy.getSnapshotLength());
        return text.length() <= limit ? text : text.substring(0, limit);
    }

    private static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(text.strip())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Tokens with surrounding punctuation stripped; tokens that are only punctuation are dropped
     */
    private static List<String> words(List<String> tokens) {
        List<String> words = new ArrayList<>();
        for (String token : tokens) {
            String word = EDGE_PUNCTUATION.matcher(token).replaceAll("");
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }
}
