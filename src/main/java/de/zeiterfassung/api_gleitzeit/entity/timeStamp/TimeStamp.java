package de.zeiterfassung.api_gleitzeit.entity.timeStamp;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Ein einzelner Stempel (Kommen oder Gehen). Zwei aufeinanderfolgende
 * Stempel desselben Tages bilden ein Arbeitsintervall.
 */
@Entity
@Table(name = "time_stamps",
        indexes = @Index(name = "idx_time_stamps_employee_date", columnList = "employee_id, stamp_date"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeStamp {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @Column(name = "stamp_date", nullable = false)
    private LocalDate stampDate;

    @Column(name = "stamp_time", nullable = false)
    private LocalTime stampTime;

    // true = bereits in die Gleitzeit eingerechnet
    @Builder.Default
    @Column(name = "settled", nullable = false)
    private boolean settled = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public LocalDateTime toDateTime() {
        return stampDate.atTime(stampTime);
    }
}
