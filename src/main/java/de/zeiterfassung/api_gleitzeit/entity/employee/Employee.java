package de.zeiterfassung.api_gleitzeit.entity.employee;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;

@Entity
@Table(name = "employees")
@Data
@NoArgsConstructor
public class Employee {

    public static final int AGE_OF_MAJORITY = 18;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @JsonIgnore
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    // Vertragliche Wochenstunden (aktueller Stand, Historie in weekly_hours_history)
    @Column(name = "weekly_hours")
    private Integer weeklyHours;

    @Column(name = "birth_date", nullable = false)
    private LocalDate birthDate;

    // Gleitzeitkonto in Stunden
    @Column(name = "flex_balance", nullable = false)
    private Double flexBalance = 0.0;

    @Column(name = "traffic_light_green", nullable = false)
    private Double trafficLightGreen;

    @Column(name = "traffic_light_red", nullable = false)
    private Double trafficLightRed;

    @Column(name = "last_login")
    private LocalDate lastLogin;

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "supervisor_id")
    private Employee supervisor;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /** Minderjährig am angegebenen Datum (Alter unter 18). */
    public boolean isMinorOn(LocalDate date) {
        return isMinorOn(birthDate, date);
    }

    public static boolean isMinorOn(LocalDate birthDate, LocalDate date) {
        if (birthDate == null || date == null) return false;
        return Period.between(birthDate, date).getYears() < AGE_OF_MAJORITY;
    }

    public double currentFlexBalance() {
        return flexBalance == null ? 0.0 : flexBalance;
    }
}
