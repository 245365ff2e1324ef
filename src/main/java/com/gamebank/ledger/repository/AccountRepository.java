package com.gamebank.ledger.repository;

import com.gamebank.ledger.model.Account;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class AccountRepository {

    private static final String COLUMNS =
            "id, external_id, handle, display_name, game_id, registered, deleted, is_admin, balance, created_at";

    private static final String ACTIVE = "registered = TRUE AND deleted = FALSE";

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<Account> ROW_MAPPER = (rs, rowNum) -> Account.builder()
            .id(rs.getLong("id"))
            .externalId(rs.getLong("external_id"))
            .handle(rs.getString("handle"))
            .displayName(rs.getString("display_name"))
            .gameId(rs.getString("game_id"))
            .registered(rs.getBoolean("registered"))
            .deleted(rs.getBoolean("deleted"))
            .admin(rs.getBoolean("is_admin"))
            .balance(rs.getBigDecimal("balance"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    public Optional<Account> findById(long id) {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts WHERE id = :id",
                new MapSqlParameterSource("id", id),
                ROW_MAPPER
        ).stream().findFirst();
    }

    /**
     * Looks up by external identity regardless of registration or deletion state.
     */
    public Optional<Account> findByExternalId(long externalId) {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts WHERE external_id = :externalId",
                new MapSqlParameterSource("externalId", externalId),
                ROW_MAPPER
        ).stream().findFirst();
    }

    public Optional<Account> findActiveByHandle(String handle) {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts " +
                "WHERE LOWER(handle) = LOWER(:handle) AND " + ACTIVE + " ORDER BY id",
                new MapSqlParameterSource("handle", handle),
                ROW_MAPPER
        ).stream().findFirst();
    }

    public Optional<Account> findActiveByGameId(String gameId) {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts WHERE game_id = :gameId AND " + ACTIVE + " ORDER BY id",
                new MapSqlParameterSource("gameId", gameId),
                ROW_MAPPER
        ).stream().findFirst();
    }

    public Optional<Account> findActiveByDisplayName(String displayName) {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts WHERE display_name = :displayName AND " + ACTIVE + " ORDER BY id",
                new MapSqlParameterSource("displayName", displayName),
                ROW_MAPPER
        ).stream().findFirst();
    }

    public List<Account> findActive(int limit) {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts WHERE " + ACTIVE + " " +
                "ORDER BY display_name, id LIMIT :limit",
                new MapSqlParameterSource("limit", limit),
                ROW_MAPPER
        );
    }

    /**
     * Inserts an unregistered zero-balance account unless one with this external id
     * already exists. Concurrent first contacts are safe: the loser inserts nothing.
     *
     * @return 1 if a row was created, 0 if it already existed
     */
    public int insertIfAbsent(long externalId, String handle, boolean admin, OffsetDateTime createdAt) {
        return namedJdbc.update(
                "INSERT INTO accounts (external_id, handle, registered, deleted, is_admin, balance, created_at) " +
                "VALUES (:externalId, :handle, FALSE, FALSE, :admin, 0, :createdAt) " +
                "ON CONFLICT DO NOTHING",
                new MapSqlParameterSource()
                        .addValue("externalId", externalId)
                        .addValue("handle", handle)
                        .addValue("admin", admin)
                        .addValue("createdAt", createdAt)
        );
    }

    public void updateHandle(long id, String handle) {
        namedJdbc.update(
                "UPDATE accounts SET handle = :handle WHERE id = :id",
                new MapSqlParameterSource().addValue("id", id).addValue("handle", handle)
        );
    }

    /**
     * Marks the account registered. The admin flag can only be granted here, never revoked.
     */
    public void updateRegistration(long id, String handle, String displayName, String gameId, boolean grantAdmin) {
        namedJdbc.update(
                "UPDATE accounts SET handle = :handle, display_name = :displayName, " +
                "game_id = :gameId, registered = TRUE, is_admin = (is_admin OR :grantAdmin) WHERE id = :id",
                new MapSqlParameterSource()
                        .addValue("id", id)
                        .addValue("handle", handle)
                        .addValue("displayName", displayName)
                        .addValue("gameId", gameId)
                        .addValue("grantAdmin", grantAdmin)
        );
    }

    public void updateDeleted(long id, boolean deleted) {
        namedJdbc.update(
                "UPDATE accounts SET deleted = :deleted WHERE id = :id",
                new MapSqlParameterSource().addValue("id", id).addValue("deleted", deleted)
        );
    }

    /**
     * Acquires row-level locks on the given accounts in ascending id order and
     * returns the locked rows.
     *
     * Every transaction that touches more than one account locks through here,
     * so two transfers over the same pair always contend on the lower id first
     * and can never wait on each other in a cycle. The returned rows are the
     * latest committed state: flags and balance read from them cannot change
     * until this transaction ends.
     *
     * Must be called within a transaction.
     */
    public List<Account> lockForUpdate(List<Long> sortedAccountIds) {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts WHERE id IN (:ids) ORDER BY id ASC FOR UPDATE",
                new MapSqlParameterSource("ids", sortedAccountIds),
                ROW_MAPPER
        );
    }

    /**
     * Reads the stored balance. Inside a transaction holding the row lock this is
     * the authoritative value; no other writer can change it until commit.
     */
    public BigDecimal getBalance(long id) {
        return namedJdbc.queryForObject(
                "SELECT balance FROM accounts WHERE id = :id",
                new MapSqlParameterSource("id", id),
                BigDecimal.class
        );
    }

    /**
     * Adds {@code delta} (negative for a debit) to the stored balance.
     * Must be called within a transaction holding the row lock.
     */
    public int applyDelta(long id, BigDecimal delta) {
        return namedJdbc.update(
                "UPDATE accounts SET balance = balance + :delta WHERE id = :id",
                new MapSqlParameterSource().addValue("id", id).addValue("delta", delta)
        );
    }
}
