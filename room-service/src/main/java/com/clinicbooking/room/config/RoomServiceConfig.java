package com.clinicbooking.room.config;

import com.clinicbooking.room.client.DeviceServiceClient;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Kept off the application class so test slices do not pick up Feign clients or the scheduler.
 */
@Configuration
@EnableFeignClients(basePackageClasses = DeviceServiceClient.class)
@EnableScheduling
public class RoomServiceConfig {
}
