package com.hal9001.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.TimeZone;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Token timestamps, log lines and readiness responses all use {@link #APPLICATION_ZONE}.
 * {@link #applyDefaultZone()} runs before the context starts so JVM defaults agree with the
 * injected {@link Clock}.
 */
@Configuration
public class TimeConfig {

    public static final ZoneId APPLICATION_ZONE = ZoneOffset.UTC;

    public static void applyDefaultZone() {
        TimeZone.setDefault(TimeZone.getTimeZone(APPLICATION_ZONE));
    }

    @Bean
    public Clock applicationClock() {
        return Clock.system(APPLICATION_ZONE);
    }
}
