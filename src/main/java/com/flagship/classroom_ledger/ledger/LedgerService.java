package com.flagship.classroom_ledger.ledger;

import com.flagship.classroom_ledger.ledger.event.LedgerEntryVoidedEvent;
import com.flagship.classroom_ledger.observability.AuditLogger;
import com.flagship.classroom_ledger.observability.ClaimMetrics;
import com.flagship.classroom_ledger.outbox.AggregateType;
import com.flagship.classroom_ledger.outbox.OutboxService;
import com.flagship.classroom_ledger.tenant.TenantGuard;
import com.flagship.classroom_ledger.tenant.TenantScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store of balance-affecting entries.
 *
 * Invariants:
 * 1. There is no update path: amount, subject, tenant, kind and bucket never
 *    change after insert (also enforced by a database trigger)
 * 2. Voiding flips the void flag exactly once; a second attempt fails
 * 3. Balances are derived by summing non-void entries, never stored
 *
 * Uses JDBC directly. Inside a Spring transaction it shares the connection
 * with the JPA repositories, so a claim payout and the claim status change
 * commit together.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String ENTITY_TYPE = "LedgerEntry";

    private static final String SELECT_COLUMNS =
        "SELECT id, tenant_id, subject_id, amount, bucket, entry_kind, description, created_at, " +
        "available_at, voided, voided_at, voided_by, idempotency_key, sequence_number FROM ledger_entries ";

    private final JdbcTemplate jdbcTemplate;
    private final TenantGuard tenantGuard;
    private final OutboxService outboxService;
    private final AuditLogger auditLogger;
    private final ClaimMetrics metrics;
    private final Clock clock;

    public LedgerService(JdbcTemplate jdbcTemplate, TenantGuard tenantGuard, OutboxService outboxService,
                         AuditLogger auditLogger, ClaimMetrics metrics, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.tenantGuard = tenantGuard;
        this.outboxService = outboxService;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Appends a new immutable entry.
     *
     * With an idempotency key, a replay returns the entry stored first
     * instead of writing a second one. The insert uses ON CONFLICT DO NOTHING
     * so a concurrent duplicate never aborts the surrounding transaction.
     *
     * @return the stored entry
     * @throws InvalidAmountException if the amount is missing or has the wrong sign for the kind
     * @throws com.flagship.classroom_ledger.tenant.CrossTenantViolationException if the request's tenant is not the scope's
     */
    @Transactional
    public LedgerEntry append(AppendEntryRequest request, TenantScope scope) {
        if (request.getTenantId() == null) {
            throw new IllegalArgumentException("Tenant is required");
        }
        tenantGuard.checkTenant(scope, ENTITY_TYPE, null, request.getTenantId());

        if (request.getKind() == null) {
            throw new IllegalArgumentException("Entry kind is required");
        }
        if (request.getSubjectId() == null) {
            throw new IllegalArgumentException("Subject is required");
        }
        if (!request.getKind().accepts(request.getAmount())) {
            throw new InvalidAmountException(request.getKind(), request.getAmount());
        }

        UUID entryId = UUID.randomUUID();
        Instant now = clock.instant();
        Instant availableAt = request.getAvailableAt() != null ? request.getAvailableAt() : now;
        AccountBucket bucket = request.getBucket() != null ? request.getBucket() : AccountBucket.CHECKING;

        int inserted = jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, tenant_id, subject_id, amount, bucket, entry_kind, description, " +
            "created_at, available_at, voided, idempotency_key) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, FALSE, ?) " +
            "ON CONFLICT (idempotency_key) DO NOTHING",
            entryId,
            request.getTenantId(),
            request.getSubjectId(),
            request.getAmount(),
            bucket.name(),
            request.getKind().name(),
            request.getDescription(),
            Timestamp.from(now),
            Timestamp.from(availableAt),
            request.getIdempotencyKey()
        );

        if (inserted == 0) {
            LedgerEntry existing = findByIdempotencyKey(request.getIdempotencyKey())
                .orElseThrow(() -> new IllegalStateException(
                    "Idempotency conflict but no entry found for key " + request.getIdempotencyKey()));
            tenantGuard.check(scope, ENTITY_TYPE, existing);
            metrics.recordIdempotencyHit();
            log.info("Ledger append replayed: idempotencyKey={}, entryId={}",
                    request.getIdempotencyKey(), existing.getId());
            return existing;
        }

        metrics.recordEntryAppended(request.getKind().name());
        log.info("Ledger entry appended: entryId={}, subjectId={}, kind={}, amount={}, bucket={}",
                entryId, request.getSubjectId(), request.getKind(), request.getAmount(), bucket);

        return queryOne("WHERE id = ?", entryId)
            .orElseThrow(() -> new IllegalStateException("Entry vanished after insert: " + entryId));
    }

    /**
     * Marks an entry as voided. Never deletes it.
     *
     * The update is conditional on {@code voided = FALSE}; zero affected rows
     * means another void won, which is reported and audited, not ignored.
     *
     * @throws TransactionNotFoundException if the entry does not exist
     * @throws AlreadyVoidedException if the entry was already voided
     */
    @Transactional
    public LedgerEntry voidEntry(UUID entryId, UUID actorId, TenantScope scope) {
        LedgerEntry entry = get(entryId, scope);

        Instant now = clock.instant();
        int updated = jdbcTemplate.update(
            "UPDATE ledger_entries SET voided = TRUE, voided_at = ?, voided_by = ? " +
            "WHERE id = ? AND tenant_id = ? AND voided = FALSE",
            Timestamp.from(now),
            actorId,
            entryId,
            entry.getTenantId()
        );

        if (updated == 0) {
            auditLogger.voidRejected(scope.tenantId(), entryId, actorId);
            throw new AlreadyVoidedException(entryId);
        }

        LedgerEntry voided = get(entryId, scope);
        outboxService.saveEvent(AggregateType.LEDGER_ENTRY, entryId, voided.getTenantId(),
                LedgerEntryVoidedEvent.EVENT_TYPE, LedgerEntryVoidedEvent.fromEntry(voided));

        auditLogger.entryVoided(scope.tenantId(), entryId, actorId);
        metrics.recordEntryVoided();
        log.info("Ledger entry voided: entryId={}, actorId={}", entryId, actorId);

        return voided;
    }

    /**
     * Sum of all non-void entries of the subject in the bucket.
     *
     * Derived and read-only; nothing in the core uses it to block a decision.
     */
    @Transactional(readOnly = true)
    public BigDecimal currentBalance(UUID subjectId, AccountBucket bucket, TenantScope scope) {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_entries " +
            "WHERE tenant_id = ? AND subject_id = ? AND bucket = ? AND voided = FALSE",
            BigDecimal.class,
            scope.tenantId(),
            subjectId,
            bucket.name()
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }

    /**
     * Like {@link #currentBalance} but only counts entries whose funds are
     * already available.
     */
    @Transactional(readOnly = true)
    public BigDecimal availableBalance(UUID subjectId, AccountBucket bucket, TenantScope scope) {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_entries " +
            "WHERE tenant_id = ? AND subject_id = ? AND bucket = ? AND voided = FALSE AND available_at <= ?",
            BigDecimal.class,
            scope.tenantId(),
            subjectId,
            bucket.name(),
            Timestamp.from(clock.instant())
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }

    /**
     * @throws TransactionNotFoundException if absent
     */
    @Transactional(readOnly = true)
    public LedgerEntry get(UUID entryId, TenantScope scope) {
        return findById(entryId, scope)
            .orElseThrow(() -> new TransactionNotFoundException(entryId));
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findById(UUID entryId, TenantScope scope) {
        return queryOne("WHERE id = ?", entryId)
            .map(entry -> tenantGuard.check(scope, ENTITY_TYPE, entry));
    }

    /**
     * Reads the entry with a shared row lock held until the caller's
     * transaction ends. A concurrent void either committed before this read
     * (and is visible) or blocks until the caller commits.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEntry findByIdForShare(UUID entryId, TenantScope scope) {
        return queryOne("WHERE id = ? FOR SHARE", entryId)
            .map(entry -> tenantGuard.check(scope, ENTITY_TYPE, entry))
            .orElseThrow(() -> new TransactionNotFoundException(entryId));
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> listForSubject(UUID subjectId, TenantScope scope) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE tenant_id = ? AND subject_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            scope.tenantId(),
            subjectId
        );
    }

    /**
     * Database side of the idempotency lookup; the caller applies the tenant
     * check when it loads the entry.
     */
    @Transactional(readOnly = true)
    public Optional<UUID> findIdByIdempotencyKey(String idempotencyKey) {
        return findByIdempotencyKey(idempotencyKey).map(LedgerEntry::getId);
    }

    private Optional<LedgerEntry> findByIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        return queryOne("WHERE idempotency_key = ?", idempotencyKey);
    }

    private Optional<LedgerEntry> queryOne(String whereClause, Object param) {
        List<LedgerEntry> rows = jdbcTemplate.query(SELECT_COLUMNS + whereClause, ledgerEntryRowMapper(), param);
        return rows.stream().findFirst();
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("tenant_id")),
            UUID.fromString(rs.getString("subject_id")),
            rs.getBigDecimal("amount"),
            AccountBucket.valueOf(rs.getString("bucket")),
            EntryKind.valueOf(rs.getString("entry_kind")),
            rs.getString("description"),
            toInstant(rs, "created_at"),
            toInstant(rs, "available_at"),
            rs.getBoolean("voided"),
            toInstant(rs, "voided_at"),
            toUuid(rs, "voided_by"),
            rs.getString("idempotency_key"),
            rs.getLong("sequence_number")
        );
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static UUID toUuid(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }
}
