package com.flagship.escrow_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only store for escrow ledger entries.
 *
 * Key properties:
 * 1. Entries are inserted, never updated or deleted (a database trigger rejects both)
 * 2. Appends must join the caller's transaction, so state change and entry commit together
 * 3. Reads are ordered by (created_at, sequence_number) and take no locks
 *
 * Uses JDBC directly rather than JPA so there is no managed entity that could be modified.
 */
@Service
@Slf4j
public class EscrowLedgerService {

    private static final String SELECT_COLUMNS =
        "SELECT id, sequence_number, escrow_payment_id, allocation_id, order_id, store_id, buyer_id, " +
        "action, amount, currency, balance_after, external_reference, notes, initiated_by, created_at " +
        "FROM escrow_ledger ";

    private static final String MOVEMENT_ACTIONS = "('RELEASED', 'PARTIAL_RELEASE', 'REFUNDED', 'PARTIAL_REFUND')";

    private final JdbcTemplate jdbcTemplate;

    public EscrowLedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends an entry within the caller's transaction.
     *
     * @param entry entry built by one of the {@link EscrowLedgerEntry} factories
     * @return the database-assigned sequence number
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long append(EscrowLedgerEntry entry) {
        Long sequence = jdbcTemplate.queryForObject(
            "INSERT INTO escrow_ledger (id, escrow_payment_id, allocation_id, order_id, store_id, buyer_id, " +
            "action, amount, currency, balance_after, external_reference, notes, initiated_by, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING sequence_number",
            Long.class,
            entry.getId(),
            entry.getEscrowPaymentId(),
            entry.getAllocationId(),
            entry.getOrderId(),
            entry.getStoreId(),
            entry.getBuyerId(),
            entry.getAction().name(),
            entry.getAmount(),
            entry.getCurrency(),
            entry.getBalanceAfter(),
            entry.getExternalReference(),
            entry.getNotes(),
            entry.getInitiatedBy(),
            Timestamp.from(entry.getCreatedAt())
        );

        log.debug("Appended ledger entry: action={}, amount={} {}, balanceAfter={}, seq={}",
                entry.getAction(), entry.getAmount(), entry.getCurrency(), entry.getBalanceAfter(), sequence);

        return sequence != null ? sequence : -1L;
    }

    /**
     * Appends entries in the given order within the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void appendAll(List<EscrowLedgerEntry> entries) {
        for (EscrowLedgerEntry entry : entries) {
            append(entry);
        }
    }

    /**
     * Gets the full ledger of an escrow payment in replay order.
     */
    @Transactional(readOnly = true)
    public List<EscrowLedgerEntry> findByEscrowPaymentId(UUID escrowPaymentId) {
        return List.copyOf(jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE escrow_payment_id = ? ORDER BY created_at, sequence_number",
            ledgerEntryRowMapper(),
            escrowPaymentId
        ));
    }

    /**
     * Gets release and refund entries for a store within [from, to).
     */
    @Transactional(readOnly = true)
    public List<EscrowLedgerEntry> findMovementsForStore(UUID storeId, Instant from, Instant to) {
        return jdbcTemplate.query(
            SELECT_COLUMNS +
            "WHERE store_id = ? AND created_at >= ? AND created_at < ? AND action IN " + MOVEMENT_ACTIONS + " " +
            "ORDER BY created_at, sequence_number",
            ledgerEntryRowMapper(),
            storeId,
            Timestamp.from(from),
            Timestamp.from(to)
        );
    }

    /**
     * Stores that had at least one release or refund within [from, to).
     */
    @Transactional(readOnly = true)
    public List<UUID> findStoresWithMovements(Instant from, Instant to) {
        return jdbcTemplate.query(
            "SELECT DISTINCT store_id FROM escrow_ledger " +
            "WHERE store_id IS NOT NULL AND created_at >= ? AND created_at < ? AND action IN " + MOVEMENT_ACTIONS,
            (rs, rowNum) -> UUID.fromString(rs.getString("store_id")),
            Timestamp.from(from),
            Timestamp.from(to)
        );
    }

    @Transactional(readOnly = true)
    public long countByEscrowPaymentId(UUID escrowPaymentId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM escrow_ledger WHERE escrow_payment_id = ?",
            Long.class,
            escrowPaymentId
        );
        return count != null ? count : 0L;
    }

    private RowMapper<EscrowLedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new EscrowLedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("escrow_payment_id")),
            uuidOrNull(rs, "allocation_id"),
            UUID.fromString(rs.getString("order_id")),
            uuidOrNull(rs, "store_id"),
            UUID.fromString(rs.getString("buyer_id")),
            LedgerAction.valueOf(rs.getString("action")),
            rs.getBigDecimal("amount"),
            rs.getString("currency"),
            rs.getBigDecimal("balance_after"),
            rs.getString("external_reference"),
            rs.getString("notes"),
            rs.getString("initiated_by"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }

    private static UUID uuidOrNull(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }
}
