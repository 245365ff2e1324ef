package com.gamebank.ledger.repository;

import com.gamebank.ledger.model.PaymentRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PaymentRequestRepository {

    private static final String COLUMNS = "id, token, requester_id, amount, created_at, expires_at, used";

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<PaymentRequest> ROW_MAPPER = (rs, rowNum) -> PaymentRequest.builder()
            .id(rs.getLong("id"))
            .token(rs.getString("token"))
            .requesterId(rs.getLong("requester_id"))
            .amount(rs.getBigDecimal("amount"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .expiresAt(rs.getObject("expires_at", OffsetDateTime.class))
            .used(rs.getBoolean("used"))
            .build();

    /**
     * Stores a new request unless the token is already taken.
     *
     * @return 1 if stored, 0 on a token collision
     */
    public int insertIfNew(String token, long requesterId, BigDecimal amount,
                           OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        return namedJdbc.update(
                "INSERT INTO payment_requests (token, requester_id, amount, created_at, expires_at, used) " +
                "VALUES (:token, :requesterId, :amount, :createdAt, :expiresAt, FALSE) " +
                "ON CONFLICT DO NOTHING",
                new MapSqlParameterSource()
                        .addValue("token", token)
                        .addValue("requesterId", requesterId)
                        .addValue("amount", amount)
                        .addValue("createdAt", createdAt)
                        .addValue("expiresAt", expiresAt)
        );
    }

    public Optional<PaymentRequest> findByToken(String token) {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM payment_requests WHERE token = :token",
                new MapSqlParameterSource("token", token),
                ROW_MAPPER
        ).stream().findFirst();
    }

    public Optional<PaymentRequest> findRedeemable(String token, OffsetDateTime now) {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM payment_requests " +
                "WHERE token = :token AND used = FALSE AND expires_at > :now",
                new MapSqlParameterSource().addValue("token", token).addValue("now", now),
                ROW_MAPPER
        ).stream().findFirst();
    }

    /**
     * Flips {@code used} from false to true if the request is still redeemable.
     *
     * This conditional update is the only arbiter between concurrent redeemers:
     * the row lock it takes makes a second claimant wait, and once the first
     * commits the second re-evaluates {@code used = FALSE} and updates nothing.
     * If the first rolls back, the second claims the request instead.
     *
     * Must be called within the transaction that performs the transfer.
     *
     * @return 1 if this caller won the claim, 0 otherwise
     */
    public int claim(String token, OffsetDateTime now) {
        return namedJdbc.update(
                "UPDATE payment_requests SET used = TRUE " +
                "WHERE token = :token AND used = FALSE AND expires_at > :now",
                new MapSqlParameterSource().addValue("token", token).addValue("now", now)
        );
    }

    /**
     * Deletes requests that can no longer be redeemed and expired before {@code cutoff}.
     */
    public int deleteExpiredBefore(OffsetDateTime cutoff) {
        return namedJdbc.update(
                "DELETE FROM payment_requests WHERE expires_at < :cutoff",
                new MapSqlParameterSource("cutoff", cutoff)
        );
    }
}
