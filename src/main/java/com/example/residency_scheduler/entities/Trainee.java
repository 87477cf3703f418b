package com.example.residency_scheduler.entities;

import com.example.residency_scheduler.enums.Department;
import com.example.residency_scheduler.enums.Track;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "trainee")
public class Trainee {
    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "track", nullable = false)
    private Track track;

    // fixed at intake
    @Enumerated(EnumType.STRING)
    @Column(name = "department", nullable = false, updatable = false)
    private Department department;

    // always the first day of the start month
    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    public Trainee(String id, String displayName, Track track, Department department, YearMonth startMonth) {
        this.id = id;
        this.displayName = displayName;
        this.track = track;
        this.department = department;
        this.startDate = startMonth.atDay(1);
        this.active = true;
    }

    public YearMonth startMonth() {
        return YearMonth.from(startDate);
    }

    /** Absolute calendar month of the given month index of this trainee's own timeline. */
    public YearMonth calendarMonth(int monthIndex) {
        return startMonth().plusMonths(monthIndex);
    }

    /** Month index of the given calendar month; negative before the start month. */
    public int monthIndexOf(YearMonth calendarMonth) {
        return (int) startMonth().until(calendarMonth, ChronoUnit.MONTHS);
    }
}
