package com.vybe.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ExpiredSessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpiredSessionSweeper.class);

    private final SessionManager sessionManager;

    public ExpiredSessionSweeper(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Scheduled(fixedDelayString = "${app.auth.session.sweep-interval:PT1H}",
            initialDelayString = "${app.auth.session.sweep-interval:PT1H}")
    public void sweepExpiredSessions() {
        int deleted = sessionManager.sweepExpired();
        if (deleted > 0) {
            log.info("[AUTH][SESSION] swept {} expired sessions", deleted);
        }
    }
}
