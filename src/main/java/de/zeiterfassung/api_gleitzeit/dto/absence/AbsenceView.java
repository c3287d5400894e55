package de.zeiterfassung.api_gleitzeit.dto.absence;

import com.fasterxml.jackson.annotation.JsonFormat;
import de.zeiterfassung.api_gleitzeit.entity.absence.Absence;
import de.zeiterfassung.api_gleitzeit.entity.absence.AbsenceType;

import java.time.LocalDate;

public record AbsenceView(Long id,
                          @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
                          AbsenceType type,
                          boolean approved) {

    public static AbsenceView of(Absence absence) {
        return new AbsenceView(absence.getId(), absence.getAbsenceDate(), absence.getType(), absence.isApproved());
    }
}
