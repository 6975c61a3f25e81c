package com.clinicbooking.room.domain.service;

import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.common.exception.ErrorCodes;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.room.api.dto.CreateRoomRequest;
import com.clinicbooking.room.api.dto.RoomResponse;
import com.clinicbooking.room.domain.model.Room;
import com.clinicbooking.room.domain.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private final RoomRepository roomRepository;
    private final ScheduleService scheduleService;

    /**
     * Creates a room open every day with the default hours.
     */
    @Transactional
    public RoomResponse createRoom(CreateRoomRequest request) {
        String name = request.name().trim();
        if (roomRepository.existsByNameIgnoreCase(name)) {
            throw new BusinessException("Room " + name + " already exists", ErrorCodes.VALIDATION_ERROR);
        }
        Room room = roomRepository.save(Room.builder()
                .name(name)
                .description(request.description())
                .build());
        scheduleService.ensureDefaultSchedules(room.getId());
        log.info("Room {} created: {}", room.getId(), name);
        return RoomResponse.from(room);
    }

    @Transactional(readOnly = true)
    public List<RoomResponse> listRooms() {
        return roomRepository.findByActiveTrueOrderByNameAsc().stream()
                .map(RoomResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public Room getRoom(Long roomId) {
        return roomRepository.findById(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
    }
}
