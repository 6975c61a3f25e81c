package com.clinicbooking.device.domain.service;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.device.api.dto.AvailabilityRangeRequest;
import com.clinicbooking.device.api.dto.AvailabilityRangeResponse;
import com.clinicbooking.device.api.dto.AvailabilityRangeResponse.DateAvailability;
import com.clinicbooking.device.api.dto.DeviceAvailabilityResponse;
import com.clinicbooking.device.api.dto.DeviceListResponse;
import com.clinicbooking.device.api.dto.DeviceResponse;
import com.clinicbooking.device.domain.model.Device;
import com.clinicbooking.device.domain.model.DeviceBooking;
import com.clinicbooking.device.domain.repository.DeviceBookingRepository;
import com.clinicbooking.device.domain.repository.DeviceRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class DeviceCatalogServiceTest {

    private static final LocalDate JAN_14 = LocalDate.of(2026, 1, 14);

    @Mock
    private DeviceRepository deviceRepository;
    @Mock
    private DeviceBookingRepository bookingRepository;

    private DeviceCatalogService service() {
        return new DeviceCatalogService(deviceRepository, bookingRepository,
                Clock.fixed(Instant.parse("2026-01-14T09:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("range availability marks days covered by an approved booking as booked")
    void getAvailability_range_marksBookedDays() {
        Device device = Device.builder().id(1L).name("ECG").totalQuantity(1).build();
        DeviceBooking approved = DeviceBooking.builder()
                .deviceId(1L)
                .startDate(LocalDate.of(2026, 1, 15))
                .endDate(LocalDate.of(2026, 1, 16))
                .status(BookingStatus.APPROVED)
                .build();
        LocalDate end = LocalDate.of(2026, 1, 17);
        given(deviceRepository.findByActiveTrueOrderBySortOrderAscNameAsc()).willReturn(List.of(device));
        given(bookingRepository.findOverlapping(1L, JAN_14, end, BookingStatus.APPROVED_STATES))
                .willReturn(List.of(approved));

        AvailabilityRangeResponse response = service().getAvailability(new AvailabilityRangeRequest(JAN_14, end, null));

        assertThat(response.items()).hasSize(1);
        assertThat(response.items().get(0).availability())
                .extracting(DateAvailability::available)
                .containsExactly(true, false, false, true);
        assertThat(response.items().get(0).availability().get(1).reason()).isEqualTo("booked");
    }

    @Test
    @DisplayName("permanently reserved device is unavailable every day with reason reserved")
    void getAvailability_range_reservedDevice() {
        Device device = Device.builder().id(2L).name("MRI").permanentReserved(true).build();
        given(deviceRepository.findByActiveTrueOrderBySortOrderAscNameAsc()).willReturn(List.of(device));
        given(bookingRepository.findOverlapping(2L, JAN_14, JAN_14, BookingStatus.APPROVED_STATES))
                .willReturn(List.of());

        AvailabilityRangeResponse response = service().getAvailability(
                new AvailabilityRangeRequest(JAN_14, JAN_14, List.of(2L)));

        assertThat(response.items().get(0).availability())
                .containsExactly(new DateAvailability(JAN_14, false, "reserved"));
    }

    @Test
    @DisplayName("start after end is a validation error")
    void getAvailability_range_invertedRange_throws() {
        assertThatThrownBy(() -> service().getAvailability(
                new AvailabilityRangeRequest(JAN_14, JAN_14.minusDays(1), null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo("VALIDATION_ERROR");
    }

    @Test
    @DisplayName("range longer than 90 days is rejected")
    void getAvailability_range_tooLong_throws() {
        assertThatThrownBy(() -> service().getAvailability(
                new AvailabilityRangeRequest(JAN_14, JAN_14.plusDays(91), null)))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("90 days");
    }

    @Test
    @DisplayName("listing hides permanently reserved devices unless asked for")
    void listDevices_hidesReservedByDefault() {
        Device ecg = Device.builder().id(1L).name("ECG").totalQuantity(2).build();
        Device mri = Device.builder().id(2L).name("MRI").permanentReserved(true).build();
        given(deviceRepository.findByActiveTrueOrderBySortOrderAscNameAsc()).willReturn(List.of(ecg, mri));
        given(bookingRepository.countOverlapping(eq(1L), eq(JAN_14), eq(JAN_14), eq(BookingStatus.APPROVED_STATES), anyLong()))
                .willReturn(1L);

        DeviceListResponse response = service().listDevices(null, false);

        assertThat(response.date()).isEqualTo(JAN_14);
        assertThat(response.devices()).extracting(DeviceResponse::name).containsExactly("ECG");
        assertThat(response.devices().get(0).available()).isTrue();
    }

    @Test
    @DisplayName("single-day availability reports booked against total quantity")
    void getAvailability_singleDay() {
        Device ecg = Device.builder().id(1L).name("ECG").totalQuantity(1).build();
        given(deviceRepository.findById(1L)).willReturn(Optional.of(ecg));
        given(bookingRepository.countOverlapping(1L, JAN_14, JAN_14, BookingStatus.APPROVED_STATES, 0L)).willReturn(1L);

        DeviceAvailabilityResponse response = service().getAvailability(1L, JAN_14);

        assertThat(response.booked()).isEqualTo(1L);
        assertThat(response.available()).isFalse();
    }
}
