package com.gt.flashstudy.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

// Calendar days for daily progress and streaks are days in this zone
@Configuration
public class ClockConfig {

    private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

    @Bean
    public Clock getClock(@Value("${flashstudy.timezone:UTC}") String timezone) {
        log.info("Using time zone {} for study days", timezone);
        return Clock.system(ZoneId.of(timezone));
    }
}
