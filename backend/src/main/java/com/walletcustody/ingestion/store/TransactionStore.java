package com.walletcustody.ingestion.store;

import com.walletcustody.common.InvalidRequestException;
import com.walletcustody.domain.Transaction;
import com.walletcustody.domain.TransactionStatus;
import com.walletcustody.domain.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Idempotent persistence of custodied transactions keyed by hash. The database primitives
 * (ON CONFLICT DO NOTHING, conditional UPDATE) are the only synchronization between writers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionStore {

    public static final int MAX_PAGE_SIZE = 1000;

    private static final String COLUMNS = "hash, asset, address_from, address_to, value, is_token, type, status, "
            + "effective_fee, contract_address, created_at, updated_at, deleted_at";

    private static final String INSERT_SQL = "INSERT INTO transactions (" + COLUMNS + ") VALUES ("
            + ":hash, :asset, :addressFrom, :addressTo, :value, :token, :type, :status, "
            + ":effectiveFee, :contractAddress, :createdAt, :updatedAt, NULL) "
            + "ON CONFLICT (hash) DO NOTHING";

    /** CONFIRMED never moves back to PENDING; the row count still reports existence. */
    private static final String UPDATE_STATUS_SQL = "UPDATE transactions SET "
            + "status = CASE WHEN status = 'confirmed' THEN status ELSE :status END, "
            + "updated_at = :updatedAt WHERE hash = :hash";

    private static final String SELECT_BY_HASH_SQL = "SELECT " + COLUMNS + " FROM transactions WHERE hash = :hash";

    private static final String SELECT_PENDING_SQL = "SELECT " + COLUMNS + " FROM transactions "
            + "WHERE status = 'pending' AND deleted_at IS NULL AND created_at > :since ORDER BY created_at ASC";

    private static final String SELECT_PAGE_SQL = "SELECT " + COLUMNS + " FROM transactions "
            + "ORDER BY created_at DESC LIMIT :limit OFFSET :offset";

    private static final RowMapper<Transaction> ROW_MAPPER = TransactionStore::mapRow;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    /**
     * Inserts the row unless the hash already exists.
     *
     * @return true when a new row was created, false for a duplicate hash
     */
    public boolean insertIfAbsent(Transaction tx) {
        Instant now = Instant.now();
        Instant createdAt = tx.getCreatedAt() != null ? tx.getCreatedAt() : now;
        Instant updatedAt = tx.getUpdatedAt() != null ? tx.getUpdatedAt() : createdAt;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("hash", tx.getHash())
                .addValue("asset", tx.getAsset())
                .addValue("addressFrom", tx.getAddressFrom())
                .addValue("addressTo", tx.getAddressTo())
                .addValue("value", toNumeric(tx.getValue() != null ? tx.getValue() : BigInteger.ZERO))
                .addValue("token", tx.isToken())
                .addValue("type", tx.getType().dbValue())
                .addValue("status", tx.getStatus().dbValue())
                .addValue("effectiveFee", toNumeric(tx.getEffectiveFee()))
                .addValue("contractAddress", tx.getContractAddress())
                .addValue("createdAt", Timestamp.from(createdAt))
                .addValue("updatedAt", Timestamp.from(updatedAt));
        boolean inserted = jdbcTemplate.update(INSERT_SQL, params) > 0;
        if (inserted) {
            tx.setCreatedAt(createdAt);
            tx.setUpdatedAt(updatedAt);
            log.info("Stored transaction {} type={} status={} asset={}", tx.getHash(), tx.getType(), tx.getStatus(), tx.getAsset());
        } else {
            log.debug("Transaction {} already stored, insert skipped", tx.getHash());
        }
        return inserted;
    }

    public Optional<Transaction> getByHash(String hash) {
        List<Transaction> rows = jdbcTemplate.query(SELECT_BY_HASH_SQL, new MapSqlParameterSource("hash", hash), ROW_MAPPER);
        return rows.stream().findFirst();
    }

    /**
     * Moves the status forward. A CONFIRMED row is never regressed.
     *
     * @return true iff a row with the hash exists
     */
    public boolean updateStatus(String hash, TransactionStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("hash", hash)
                .addValue("status", status.dbValue())
                .addValue("updatedAt", Timestamp.from(Instant.now()));
        return jdbcTemplate.update(UPDATE_STATUS_SQL, params) > 0;
    }

    /** Pending, not soft-deleted rows created within the last {@code maxAgeHours}, oldest first. */
    public List<Transaction> listPending(int maxAgeHours) {
        Instant since = Instant.now().minus(Duration.ofHours(maxAgeHours));
        return jdbcTemplate.query(SELECT_PENDING_SQL, new MapSqlParameterSource("since", Timestamp.from(since)), ROW_MAPPER);
    }

    /** Newest first. */
    public List<Transaction> list(int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_PAGE_SIZE + ", got " + limit);
        }
        if (offset < 0) {
            throw new InvalidRequestException("offset must not be negative, got " + offset);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("limit", limit)
                .addValue("offset", offset);
        return jdbcTemplate.query(SELECT_PAGE_SQL, params, ROW_MAPPER);
    }

    private static BigDecimal toNumeric(BigInteger value) {
        return value != null ? new BigDecimal(value) : null;
    }

    private static Transaction mapRow(ResultSet rs, int rowNum) throws SQLException {
        Transaction tx = new Transaction();
        tx.setHash(rs.getString("hash"));
        tx.setAsset(rs.getString("asset"));
        tx.setAddressFrom(rs.getString("address_from"));
        tx.setAddressTo(rs.getString("address_to"));
        BigDecimal value = rs.getBigDecimal("value");
        tx.setValue(value != null ? value.toBigIntegerExact() : BigInteger.ZERO);
        tx.setToken(rs.getBoolean("is_token"));
        tx.setType(TransactionType.fromDbValue(rs.getString("type")));
        tx.setStatus(TransactionStatus.fromDbValue(rs.getString("status")));
        BigDecimal fee = rs.getBigDecimal("effective_fee");
        tx.setEffectiveFee(fee != null ? fee.toBigIntegerExact() : null);
        tx.setContractAddress(rs.getString("contract_address"));
        tx.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
        tx.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
        tx.setDeletedAt(toInstant(rs.getTimestamp("deleted_at")));
        return tx;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
