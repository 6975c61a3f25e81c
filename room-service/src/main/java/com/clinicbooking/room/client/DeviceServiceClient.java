package com.clinicbooking.room.client;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.room.client.dto.DeviceBookingRequest;
import com.clinicbooking.room.client.dto.DeviceBookingResult;
import com.clinicbooking.room.client.dto.DeviceCatalog;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * device-service API used for composite bookings. Call it through {@code DeviceReservationBridge},
 * which adds retries, the circuit breaker and error translation.
 */
@FeignClient(name = "device-service", url = "${room.device-api.base-url}", configuration = DeviceApiClientConfig.class)
public interface DeviceServiceClient {

    @PostMapping("/api/book-device")
    BaseResponse<DeviceBookingResult> bookDevice(@RequestBody DeviceBookingRequest request);

    @DeleteMapping("/api/book-device/{externalBookingId}")
    BaseResponse<Void> cancelBooking(@PathVariable("externalBookingId") String externalBookingId);

    @GetMapping("/api/devices")
    BaseResponse<DeviceCatalog> listDevices(@RequestParam("date") String date,
                                            @RequestParam("include_reserved") boolean includeReserved);
}
