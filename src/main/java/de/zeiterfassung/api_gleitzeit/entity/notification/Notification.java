package de.zeiterfassung.api_gleitzeit.entity.notification;

import com.fasterxml.jackson.annotation.JsonIgnore;
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

@Entity
@Table(name = "notifications",
        uniqueConstraints = @UniqueConstraint(name = "uq_notification_employee_code_date",
                columnNames = {"employee_id", "code", "notification_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @Enumerated(EnumType.STRING)
    @Column(name = "code", nullable = false, length = 40)
    private NotificationCode code;

    @Column(name = "notification_date", nullable = false)
    private LocalDate notificationDate;

    @Builder.Default
    @Column(name = "popup", nullable = false)
    private boolean popup = false;

    // nur für PopUps: Uhrzeit, zu der die Meldung angezeigt werden soll
    @Column(name = "popup_time")
    private LocalTime popupTime;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
