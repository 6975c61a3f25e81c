package com.clinicbooking.room.domain.repository;

import com.clinicbooking.room.domain.model.Room;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RoomRepository extends JpaRepository<Room, Long> {

    /**
     * SELECT ... FOR UPDATE on the room row. Creation and approval take it before counting
     * approved bookings, so two requests for the same room never both pass the check.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Room r WHERE r.id = :id")
    Optional<Room> findByIdForUpdate(@Param("id") Long id);

    List<Room> findByActiveTrueOrderByNameAsc();

    boolean existsByNameIgnoreCase(String name);
}
