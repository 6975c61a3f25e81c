package com.clinicbooking.room.client;

import com.clinicbooking.common.web.RequestIdFilter;
import feign.RequestInterceptor;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

/**
 * Feign configuration for {@link DeviceServiceClient} only (deliberately not a {@code @Configuration}).
 * Adds the shared API key headers and forwards the request id.
 */
public class DeviceApiClientConfig {

    static final String API_KEY_HEADER = "x-api-key";
    static final String API_EXTRA_HEADER = "x-api-extra";

    @Bean
    public RequestInterceptor deviceApiAuthInterceptor(@Value("${room.device-api.key:}") String apiKey,
                                                       @Value("${room.device-api.extra:}") String apiExtra) {
        return template -> {
            if (StringUtils.hasText(apiKey)) {
                template.header(API_KEY_HEADER, apiKey);
            }
            if (StringUtils.hasText(apiExtra)) {
                template.header(API_EXTRA_HEADER, apiExtra);
            }
            String requestId = MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY);
            if (requestId != null) {
                template.header(RequestIdFilter.REQUEST_ID_HEADER, requestId);
            }
        };
    }
}
