package com.clinicbooking.room.bridge;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.common.exception.ErrorCodes;
import com.clinicbooking.common.exception.NotAvailableException;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.room.client.DeviceServiceClient;
import com.clinicbooking.room.client.dto.DeviceBookingRequest;
import com.clinicbooking.room.client.dto.DeviceBookingResult;
import com.clinicbooking.room.domain.model.HourlyBooking;
import feign.FeignException;
import feign.Request;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DeviceReservationBridgeTest {

    private static final Request REQUEST = Request.create(
            Request.HttpMethod.POST, "/api/book-device", Map.of(), null, StandardCharsets.UTF_8, null);

    @Mock
    private DeviceServiceClient deviceServiceClient;

    @InjectMocks
    private DeviceReservationBridge bridge;

    @Test
    @DisplayName("409 from device-service means the device is taken")
    void translate_conflict() {
        RuntimeException translated = DeviceReservationBridge.translate(
                new FeignException.Conflict("conflict", REQUEST, null, Map.of()), "device booking crm-1");

        assertThat(translated).isInstanceOf(NotAvailableException.class);
    }

    @Test
    @DisplayName("404 and 400 are definite answers, 5xx stays a transport failure")
    void translate_otherStatuses() {
        assertThat(DeviceReservationBridge.translate(
                new FeignException.NotFound("nf", REQUEST, null, Map.of()), "device booking crm-1"))
                .isInstanceOf(ResourceNotFoundException.class);

        RuntimeException badRequest = DeviceReservationBridge.translate(
                new FeignException.BadRequest("bad", REQUEST, null, Map.of()), "device booking crm-1");
        assertThat(badRequest).isInstanceOf(BusinessException.class);
        assertThat(((BusinessException) badRequest).getErrorCode()).isEqualTo(ErrorCodes.VALIDATION_ERROR);

        FeignException unavailable = new FeignException.ServiceUnavailable("down", REQUEST, null, Map.of());
        assertThat(DeviceReservationBridge.translate(unavailable, "device booking crm-1")).isSameAs(unavailable);
    }

    @Test
    @DisplayName("reserve sends the booking date and the crm-{id} key")
    void reserve_sendsIdempotencyKey() {
        HourlyBooking booking = HourlyBooking.builder()
                .id(42L)
                .deviceName("Ultrasound")
                .startTime(LocalDate.of(2026, 3, 12).atTime(10, 0))
                .endTime(LocalDate.of(2026, 3, 12).atTime(11, 0))
                .clientName("Alex")
                .build();
        DeviceBookingResult result = new DeviceBookingResult(5L, "crm-42", 1L, "Ultrasound", BookingStatus.APPROVED, false);
        given(deviceServiceClient.bookDevice(any()))
                .willReturn(BaseResponse.success(result));

        assertThat(bridge.reserve(booking)).isEqualTo(result);

        ArgumentCaptor<DeviceBookingRequest> sent = ArgumentCaptor.forClass(DeviceBookingRequest.class);
        verify(deviceServiceClient).bookDevice(sent.capture());
        assertThat(sent.getValue().externalBookingId()).isEqualTo("crm-42");
        assertThat(sent.getValue().date()).isEqualTo(LocalDate.of(2026, 3, 12));
        assertThat(sent.getValue().deviceName()).isEqualTo("Ultrasound");
    }

    @Test
    @DisplayName("an empty response body is not treated as success")
    void reserve_emptyBody_fails() {
        HourlyBooking booking = HourlyBooking.builder()
                .id(42L)
                .deviceName("Ultrasound")
                .startTime(LocalDate.of(2026, 3, 12).atTime(10, 0))
                .endTime(LocalDate.of(2026, 3, 12).atTime(11, 0))
                .build();
        given(deviceServiceClient.bookDevice(any()))
                .willReturn(BaseResponse.success(null));

        assertThatThrownBy(() -> bridge.reserve(booking)).isInstanceOf(IllegalStateException.class);
    }
}
