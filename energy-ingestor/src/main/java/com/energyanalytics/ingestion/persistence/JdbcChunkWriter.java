package com.energyanalytics.ingestion.persistence;

import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.persistence.UpsertStatementBuilder.UpsertStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * PostgreSQL / TimescaleDB chunk writer. One transaction per chunk; a failure rolls
 * the whole chunk back and leaves earlier chunks untouched.
 */
@Component
@Slf4j
public class JdbcChunkWriter implements ChunkWriter {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcChunkWriter(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public ChunkCounts upsertChunk(SourceType type, List<NormalizedRecord> chunk) {
        if (chunk.isEmpty()) return new ChunkCounts(0, 0);

        UpsertStatement statement = UpsertStatementBuilder.build(type, chunk);

        ResultSetExtractor<ChunkCounts> counter = rs -> {
            int inserted = 0;
            int updated = 0;
            while (rs.next()) {
                if (rs.getBoolean("inserted")) inserted++;
                else updated++;
            }
            return new ChunkCounts(inserted, updated);
        };

        ChunkCounts counts = transactionTemplate.execute(status ->
                jdbcTemplate.query(statement.sql(), counter, statement.args()));
        log.debug("Upserted {} rows into {}: {} inserted, {} updated",
                chunk.size(), type.getTableName(), counts.inserted(), counts.updated());
        return counts;
    }
}
