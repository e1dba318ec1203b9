package org.politia.warehouse.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * JPA Entity for the sessions table.
 * A parliamentary sitting, written once from its transcript file and never updated.
 */
@Entity
@Table(name = "sessions",
    uniqueConstraints = @UniqueConstraint(name = "uk_sessions_identity",
        columnNames = {"legislature", "chamber", "session_number"}),
    indexes = {
        @Index(name = "idx_sessions_date", columnList = "session_date"),
        @Index(name = "idx_sessions_chamber", columnList = "chamber")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    @Id
    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Column(name = "session_date", nullable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Chamber chamber;

    @Column(nullable = false)
    private Integer legislature;

    @Column(name = "session_number", nullable = false)
    private Integer sessionNumber;

    @Column(name = "source_reference", length = 1024)
    private String sourceReference;
}
