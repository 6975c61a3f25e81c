package com.clinicbooking.room.domain.repository;

import com.clinicbooking.room.domain.model.Holiday;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface HolidayRepository extends JpaRepository<Holiday, Long> {

    Optional<Holiday> findByDate(LocalDate date);

    List<Holiday> findByDateBetweenOrderByDateAsc(LocalDate from, LocalDate to);

    long deleteByDate(LocalDate date);
}
