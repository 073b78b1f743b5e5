package com.qualitrack.backend.modules.session.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceScheduler.class);

    private final SessionService sessionService;

    public SessionMaintenanceScheduler(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Scheduled(fixedDelayString = "${app.access.session.cleanup-interval:PT15M}")
    public void closeExpiredSessions() {
        int closed = sessionService.cleanupExpiredSessions();
        if (closed > 0) {
            log.info("Closed {} expired sessions", closed);
        }
    }
}
