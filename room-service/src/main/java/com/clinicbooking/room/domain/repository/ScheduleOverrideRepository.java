package com.clinicbooking.room.domain.repository;

import com.clinicbooking.room.domain.model.ScheduleOverride;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ScheduleOverrideRepository extends JpaRepository<ScheduleOverride, Long> {

    Optional<ScheduleOverride> findByRoomIdAndDate(Long roomId, LocalDate date);

    List<ScheduleOverride> findByRoomIdAndDateBetweenOrderByDateAsc(Long roomId, LocalDate from, LocalDate to);

    long deleteByRoomIdAndDate(Long roomId, LocalDate date);
}
