package com.clinicbooking.room.domain.repository;

import com.clinicbooking.room.domain.model.RoomSchedule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface RoomScheduleRepository extends JpaRepository<RoomSchedule, Long> {

    Optional<RoomSchedule> findByRoomIdAndDayOfWeek(Long roomId, Integer dayOfWeek);

    List<RoomSchedule> findByRoomIdOrderByDayOfWeekAsc(Long roomId);
}
