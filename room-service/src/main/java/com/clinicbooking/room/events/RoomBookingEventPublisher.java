package com.clinicbooking.room.events;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.room.domain.model.HourlyBooking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for booking lifecycle events, keyed by booking id so a booking's events stay ordered.
 * Publishing happens after the change is committed and never fails the request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomBookingEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${room.events.topic:room-booking-status}")
    private String topic = "room-booking-status";

    public void publishCreated(HourlyBooking booking) {
        publish(booking, null, booking.getStatus(), booking.getVersion());
    }

    public void publishStatusChanged(HourlyBooking booking, BookingStatus newStatus, long newVersion) {
        publish(booking, booking.getStatus(), newStatus, newVersion);
    }

    /** Interval or device changed; the status stays the same. */
    public void publishUpdated(HourlyBooking booking) {
        publish(booking, booking.getStatus(), booking.getStatus(), booking.getVersion());
    }

    private void publish(HourlyBooking booking, BookingStatus previous, BookingStatus current, long version) {
        RoomBookingStatusChangedEvent event = RoomBookingStatusChangedEvent.builder()
                .bookingId(booking.getId())
                .roomId(booking.getRoomId())
                .roomName(booking.getRoomName())
                .userId(booking.getUserId())
                .startTime(booking.getStartTime())
                .endTime(booking.getEndTime())
                .previousStatus(previous != null ? previous.value() : null)
                .status(current.value())
                .version(version)
                .deviceReservationStatus(booking.getDeviceReservationStatus().name())
                .timestamp(Instant.now())
                .build();
        String key = String.valueOf(booking.getId());
        log.info("Publishing event to topic {}: booking {} -> {}", topic, booking.getId(), event.getStatus());
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published to topic {}: offset={}", topic, result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event for booking {} to topic {}", booking.getId(), topic, ex);
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to publish event for booking {} to topic {}", booking.getId(), topic, e);
        }
    }
}
