package com.gt.flashstudy.task;

import com.gt.flashstudy.studySession.StudySessionDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class GuestSessionCleanupTask {

    private static final Logger log = LoggerFactory.getLogger(GuestSessionCleanupTask.class);

    private final StudySessionDao studySessionDao;
    private final Clock clock;
    private final int guestSessionRetentionDays;

    public GuestSessionCleanupTask(StudySessionDao studySessionDao,
                                   Clock clock,
                                   @Value("${flashstudy.maintenance.guestSessionRetentionDays:7}") int guestSessionRetentionDays) {
        this.studySessionDao = studySessionDao;
        this.clock = clock;
        this.guestSessionRetentionDays = guestSessionRetentionDays;
    }

    @Scheduled(cron = "@daily")
    public void purgeInactiveGuestSessions() {
        Instant cutoff = clock.instant().minus(guestSessionRetentionDays, ChronoUnit.DAYS);

        int rowsDeleted = studySessionDao.purgeInactiveGuestSessions(cutoff);

        log.info("Purged inactive guest study sessions. {} row deleted.", rowsDeleted);
    }
}
