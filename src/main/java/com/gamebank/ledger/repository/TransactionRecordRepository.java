package com.gamebank.ledger.repository;

import com.gamebank.ledger.model.TransactionKind;
import com.gamebank.ledger.model.TransactionRecord;
import com.gamebank.ledger.model.TransactionView;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-only access to {@code ledger_transactions}: records are never updated or deleted.
 */
@Repository
@RequiredArgsConstructor
public class TransactionRecordRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<TransactionRecord> ROW_MAPPER = (rs, rowNum) -> TransactionRecord.builder()
            .id(rs.getLong("id"))
            .fromAccountId(rs.getObject("from_account_id", Long.class))
            .toAccountId(rs.getObject("to_account_id", Long.class))
            .amount(rs.getBigDecimal("amount"))
            .kind(TransactionKind.fromCode(rs.getString("kind")))
            .note(rs.getString("note"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    private static final RowMapper<TransactionView> VIEW_ROW_MAPPER = (rs, rowNum) -> TransactionView.builder()
            .id(rs.getLong("id"))
            .kind(TransactionKind.fromCode(rs.getString("kind")))
            .amount(rs.getBigDecimal("amount"))
            .note(rs.getString("note"))
            .fromExternalId(rs.getObject("from_external_id", Long.class))
            .fromHandle(rs.getString("from_handle"))
            .fromDisplayName(rs.getString("from_display_name"))
            .toExternalId(rs.getObject("to_external_id", Long.class))
            .toHandle(rs.getString("to_handle"))
            .toDisplayName(rs.getString("to_display_name"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    /**
     * Appends one record. Must be called within the transaction that applied
     * the matching balance change.
     */
    public TransactionRecord insert(TransactionKind kind, Long fromAccountId, Long toAccountId,
                                    BigDecimal amount, String note, OffsetDateTime createdAt) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        namedJdbc.update(
                "INSERT INTO ledger_transactions (from_account_id, to_account_id, amount, kind, note, created_at) " +
                "VALUES (:fromAccountId, :toAccountId, :amount, :kind, :note, :createdAt)",
                new MapSqlParameterSource()
                        .addValue("fromAccountId", fromAccountId)
                        .addValue("toAccountId", toAccountId)
                        .addValue("amount", amount)
                        .addValue("kind", kind.code())
                        .addValue("note", note)
                        .addValue("createdAt", createdAt),
                keyHolder,
                new String[]{"id"}
        );
        long id = keyHolder.getKey().longValue();
        return findById(id).orElseThrow();
    }

    public Optional<TransactionRecord> findById(long id) {
        return namedJdbc.query(
                "SELECT id, from_account_id, to_account_id, amount, kind, note, created_at " +
                "FROM ledger_transactions WHERE id = :id",
                new MapSqlParameterSource("id", id),
                ROW_MAPPER
        ).stream().findFirst();
    }

    /**
     * Records the account took part in, newest first, with both parties resolved.
     */
    public List<TransactionView> findHistory(long accountId, int limit) {
        return namedJdbc.query(
                "SELECT t.id, t.kind, t.amount, t.note, t.created_at, " +
                "       f.external_id AS from_external_id, f.handle AS from_handle, " +
                "       f.display_name AS from_display_name, " +
                "       r.external_id AS to_external_id, r.handle AS to_handle, " +
                "       r.display_name AS to_display_name " +
                "FROM ledger_transactions t " +
                "LEFT JOIN accounts f ON f.id = t.from_account_id " +
                "LEFT JOIN accounts r ON r.id = t.to_account_id " +
                "WHERE t.from_account_id = :accountId OR t.to_account_id = :accountId " +
                "ORDER BY t.created_at DESC, t.id DESC " +
                "LIMIT :limit",
                new MapSqlParameterSource()
                        .addValue("accountId", accountId)
                        .addValue("limit", limit),
                VIEW_ROW_MAPPER
        );
    }

    /**
     * Number of appearances of the account as {@code from} or {@code to}; a
     * self-transfer names the account on both sides and counts twice.
     */
    public long countByAccount(long accountId) {
        Long count = namedJdbc.queryForObject(
                "SELECT COALESCE(SUM(CASE WHEN from_account_id = :accountId THEN 1 ELSE 0 END), 0) " +
                "     + COALESCE(SUM(CASE WHEN to_account_id = :accountId THEN 1 ELSE 0 END), 0) " +
                "FROM ledger_transactions " +
                "WHERE from_account_id = :accountId OR to_account_id = :accountId",
                new MapSqlParameterSource("accountId", accountId),
                Long.class
        );
        return count != null ? count : 0L;
    }

    /**
     * Balance obtained by replaying the log from zero: every record adds its
     * amount to {@code to} and subtracts it from {@code from}.
     */
    public BigDecimal replayBalance(long accountId) {
        BigDecimal balance = namedJdbc.queryForObject(
                "SELECT COALESCE(SUM(CASE WHEN to_account_id = :accountId THEN amount ELSE 0 END), 0) " +
                "     - COALESCE(SUM(CASE WHEN from_account_id = :accountId THEN amount ELSE 0 END), 0) " +
                "FROM ledger_transactions " +
                "WHERE from_account_id = :accountId OR to_account_id = :accountId",
                new MapSqlParameterSource("accountId", accountId),
                BigDecimal.class
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }
}
