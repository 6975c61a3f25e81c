package com.clinicbooking.device.domain.repository;

import com.clinicbooking.device.domain.model.Device;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface DeviceRepository extends JpaRepository<Device, Long> {

    /**
     * Locks the device row (SELECT ... FOR UPDATE) for the rest of the transaction.
     * Every capacity check followed by an insert or approval runs under this lock,
     * so two concurrent creations for the same device are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Device d WHERE d.id = :id")
    Optional<Device> findByIdForUpdate(@Param("id") Long id);

    Optional<Device> findByNameIgnoreCase(String name);

    List<Device> findByActiveTrueOrderBySortOrderAscNameAsc();

    List<Device> findByPermanentReservedTrueOrderByNameAsc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Device d SET d.permanentReserved = :reserved, d.updatedAt = CURRENT_TIMESTAMP WHERE d.id = :id")
    int setPermanentReserved(@Param("id") Long id, @Param("reserved") boolean reserved);
}
