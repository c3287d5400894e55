package de.zeiterfassung.api_gleitzeit.entity.boundaries.holiday;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Betrieblicher Feiertag, zusätzlich zu den bundesweiten gesetzlichen Feiertagen.
 */
@Entity
@Table(name = "holidays",
        uniqueConstraints = @UniqueConstraint(name = "uq_holiday_date", columnNames = "holiday_date"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Holiday {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "holiday_date", nullable = false)
    private LocalDate holidayDate;

    @Column(name = "description", length = 150)
    private String description;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
