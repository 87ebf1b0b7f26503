package com.dcruver.regmetrics.history;

import com.dcruver.regmetrics.metrics.MetricsRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stores metrics records in SQLite, one row per (document_id, metrics_date).
 * Re-computing a version replaces its row.
 */
@Component
@Slf4j
public class JdbcMetricsSink implements MetricsSink {

    private static final List<String> READABILITY_COLUMNS = List.of(
        "flesch_reading_ease", "smog_index_score", "automated_readability_score", "combined_readability_score"
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcMetricsSink(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS document_metrics (
                document_id TEXT NOT NULL,
                metrics_date TEXT NOT NULL,
                word_count INTEGER NOT NULL,
                sentence_count INTEGER NOT NULL,
                paragraph_count INTEGER NOT NULL,
                section_count INTEGER NOT NULL,
                subpart_count INTEGER NOT NULL,
                total_authors INTEGER NOT NULL,
                revision_authors INTEGER NOT NULL,
                language_complexity_score REAL NOT NULL,
                readability_score REAL NOT NULL,
                average_sentence_length REAL NOT NULL,
                average_word_length REAL NOT NULL,
                simplicity_score REAL NOT NULL,
                flesch_reading_ease REAL NOT NULL DEFAULT 0,
                smog_index_score REAL NOT NULL DEFAULT 0,
                automated_readability_score REAL NOT NULL DEFAULT 0,
                combined_readability_score REAL NOT NULL DEFAULT 0,
                content_snapshot TEXT,
                PRIMARY KEY (document_id, metrics_date)
            )
            """);

        // Stores created before the readability breakdown was kept
        Set<String> columns = jdbcTemplate.queryForList("PRAGMA table_info(document_metrics)").stream()
            .map(column -> String.valueOf(column.get("name")))
            .collect(Collectors.toSet());
        for (String column : READABILITY_COLUMNS) {
            if (!columns.contains(column)) {
                jdbcTemplate.execute("ALTER TABLE document_metrics ADD COLUMN " + column + " REAL NOT NULL DEFAULT 0");
                log.info("Added column {} to metrics store", column);
            }
        }

        log.info("Initialized metrics store");
    }

    /**
     * Upsert one record. Serialized because SQLite allows a single writer.
     */
    @Override
    public synchronized void accept(MetricsRecord record) {
        jdbcTemplate.update(
            "INSERT OR REPLACE INTO document_metrics (document_id, metrics_date, word_count, sentence_count, " +
            "paragraph_count, section_count, subpart_count, total_authors, revision_authors, " +
            "language_complexity_score, readability_score, average_sentence_length, average_word_length, " +
            "simplicity_score, flesch_reading_ease, smog_index_score, automated_readability_score, " +
            "combined_readability_score, content_snapshot) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            record.getDocumentId(), record.getMetricsDate().toString(), record.getWordCount(),
            record.getSentenceCount(), record.getParagraphCount(), record.getSectionCount(),
            record.getSubpartCount(), record.getTotalAuthors(), record.getRevisionAuthors(),
            record.getLanguageComplexityScore(), record.getReadabilityScore(),
            record.getAverageSentenceLength(), record.getAverageWordLength(),
            record.getSimplicityScore(), record.getFleschReadingEase(), record.getSmogIndexScore(),
            record.getAutomatedReadabilityScore(), record.getCombinedReadabilityScore(),
            record.getContentSnapshot()
        );

        log.debug("Stored metrics for {} at {}", record.getDocumentId(), record.getMetricsDate());
    }

    /**
     * Records of one document, oldest first
     */
    public List<MetricsRecord> findByDocument(String documentId) {
        return jdbcTemplate.query(
            "SELECT * FROM document_metrics WHERE document_id = ? ORDER BY metrics_date",
            new MetricsRowMapper(),
            documentId
        );
    }

    /**
     * Records of one document dated within [from, to], oldest first. A null bound is open.
     */
    public List<MetricsRecord> findByDocument(String documentId, LocalDate from, LocalDate to) {
        return jdbcTemplate.query(
            "SELECT * FROM document_metrics WHERE document_id = ? AND metrics_date >= ? AND metrics_date <= ? " +
            "ORDER BY metrics_date",
            new MetricsRowMapper(),
            documentId,
            from != null ? from.toString() : "0000-01-01",
            to != null ? to.toString() : "9999-12-31"
        );
    }

    @Override
    public boolean contains(String documentId, LocalDate metricsDate) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM document_metrics WHERE document_id = ? AND metrics_date = ?",
            Integer.class,
            documentId, metricsDate.toString()
        );
        return count != null && count > 0;
    }

    /**
     * Averages over every stored record, grouped by the year of its metrics date
     */
    public List<YearlyMetrics> yearlyAverages() {
        return jdbcTemplate.query(
            "SELECT substr(metrics_date, 1, 4) AS year, COUNT(*) AS records, " +
            "COUNT(DISTINCT document_id) AS documents, AVG(word_count) AS word_count, " +
            "AVG(language_complexity_score) AS complexity, AVG(readability_score) AS readability, " +
            "AVG(simplicity_score) AS simplicity, AVG(combined_readability_score) AS combined " +
            "FROM document_metrics GROUP BY year ORDER BY year",
            (rs, rowNum) -> YearlyMetrics.builder()
                .year(rs.getString("year"))
                .records(rs.getInt("records"))
                .documents(rs.getInt("documents"))
                .averageWordCount(rs.getDouble("word_count"))
                .averageComplexity(rs.getDouble("complexity"))
                .averageReadability(rs.getDouble("readability"))
                .averageSimplicity(rs.getDouble("simplicity"))
                .averageCombinedReadability(rs.getDouble("combined"))
                .build()
        );
    }

    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM document_metrics", Integer.class);
        return count != null ? count : 0;
    }

    private static class MetricsRowMapper implements RowMapper<MetricsRecord> {
        @Override
        public MetricsRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return MetricsRecord.builder()
                .documentId(rs.getString("document_id"))
                .metricsDate(LocalDate.parse(rs.getString("metrics_date")))
                .wordCount(rs.getInt("word_count"))
                .sentenceCount(rs.getInt("sentence_count"))
                .paragraphCount(rs.getInt("paragraph_count"))
                .sectionCount(rs.getInt("section_count"))
                .subpartCount(rs.getInt("subpart_count"))
                .totalAuthors(rs.getInt("total_authors"))
                .revisionAuthors(rs.getInt("revision_authors"))
                .languageComplexityScore(rs.getDouble("language_complexity_score"))
                .readabilityScore(rs.getDouble("readability_score"))
                .averageSentenceLength(rs.getDouble("average_sentence_length"))
                .averageWordLength(rs.getDouble("average_word_length"))
                .simplicityScore(rs.getDouble("simplicity_score"))
                .fleschReadingEase(rs.getDouble("flesch_reading_ease"))
                .smogIndexScore(rs.getDouble("smog_index_score"))
                .automatedReadabilityScore(rs.getDouble("automated_readability_score"))
                .combinedReadabilityScore(rs.getDouble("combined_readability_score"))
                .contentSnapshot(rs.getString("content_snapshot"))
                .build();
        }
    }
}
