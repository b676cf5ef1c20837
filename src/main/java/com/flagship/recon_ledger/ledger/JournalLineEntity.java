package com.flagship.recon_ledger.ledger;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for journal lines.
 *
 * Every column is insert-only. Draft edits replace the line rows (delete + insert),
 * and the database refuses line changes once the parent entry has been posted.
 */
@Entity
@Table(name = "journal_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "entry_id", nullable = false, updatable = false)
    private JournalEntryEntity entry;

    @Column(name = "line_no", nullable = false, updatable = false)
    private int lineNo;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private Direction direction;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(name = "fx_rate", updatable = false, precision = 19, scale = 8)
    private BigDecimal fxRate;

    @Column(name = "event_type", updatable = false, length = 100)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", updatable = false, columnDefinition = "jsonb")
    private List<String> tags;

    static JournalLineEntity fromDomain(JournalEntryEntity entry, int lineNo, JournalLine line) {
        JournalLineEntity entity = new JournalLineEntity();
        entity.id = line.getId();
        entity.entry = entry;
        entity.lineNo = lineNo;
        entity.accountId = line.getAccountId();
        entity.direction = line.getDirection();
        entity.amount = line.getAmount();
        entity.currency = line.getCurrency();
        entity.fxRate = line.getFxRate();
        entity.eventType = line.getEventType();
        entity.tags = line.getTags();
        return entity;
    }

    public JournalLine toDomain() {
        return new JournalLine(
            id,
            accountId,
            direction,
            amount,
            currency,
            fxRate,
            eventType,
            tags == null ? List.of() : List.copyOf(tags)
        );
    }
}
