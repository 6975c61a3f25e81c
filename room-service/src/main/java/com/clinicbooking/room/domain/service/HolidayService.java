package com.clinicbooking.room.domain.service;

import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.room.api.dto.HolidayRequest;
import com.clinicbooking.room.api.dto.HolidayResponse;
import com.clinicbooking.room.domain.model.Holiday;
import com.clinicbooking.room.domain.repository.HolidayRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Clinic-wide holidays. A holiday closes every room that has no override for the date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HolidayService {

    private final HolidayRepository holidayRepository;

    @Transactional
    public HolidayResponse addHoliday(HolidayRequest request) {
        Holiday holiday = holidayRepository.findByDate(request.date())
                .orElseGet(() -> Holiday.builder().date(request.date()).build());
        holiday.setName(request.name().trim());
        holiday = holidayRepository.save(holiday);
        log.info("Holiday on {}: {}", holiday.getDate(), holiday.getName());
        return HolidayResponse.from(holiday);
    }

    @Transactional
    public void removeHoliday(LocalDate date) {
        if (holidayRepository.deleteByDate(date) == 0) {
            throw new ResourceNotFoundException("Holiday", date);
        }
        log.info("Holiday on {} removed", date);
    }

    @Transactional(readOnly = true)
    public List<HolidayResponse> listHolidays(LocalDate from, LocalDate to) {
        return holidayRepository.findByDateBetweenOrderByDateAsc(from, to).stream()
                .map(HolidayResponse::from)
                .toList();
    }
}
