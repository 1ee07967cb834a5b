package com.example.tablecompare.application;

import com.example.tablecompare.domain.ComparisonResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory registry of open comparison runs. Nothing outlives the process.
 */
@Service
public class ReconciliationSessionService {
    private static final Logger log = LogManager.getLogger(ReconciliationSessionService.class);
    private static final int DEFAULT_MAX_SESSIONS = 50;

    private final int maxSessions;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, ReconciliationSession> sessions = new ConcurrentHashMap<>();

    public ReconciliationSessionService(
            @Value("${table-compare.session.max-sessions:50}") int maxSessions) {
        this.maxSessions = maxSessions > 0 ? maxSessions : DEFAULT_MAX_SESSIONS;
    }

    public ReconciliationSession open(String name, ComparisonResult result) {
        long id = sequence.incrementAndGet();
        ReconciliationSession session = new ReconciliationSession(id, sanitizeName(name, id), result);
        sessions.put(id, session);
        log.info(
                "Opened comparison {} '{}' with {} differences",
                id,
                session.getName(),
                session.getStore().size());
        evictOverflow();
        return session;
    }

    public ReconciliationSession loadSession(long id) {
        ReconciliationSession session = sessions.get(id);
        if (session == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Comparison not found");
        }
        return session;
    }

    public List<ReconciliationSession> listSessions() {
        return sessions.values().stream()
                .sorted(Comparator.comparingLong(ReconciliationSession::getId).reversed())
                .toList();
    }

    public void discard(long id) {
        if (sessions.remove(id) == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Comparison not found");
        }
        log.info("Discarded comparison {}", id);
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    // Oldest sessions go first; ids are handed out in creation order.
    private void evictOverflow() {
        while (sessions.size() > maxSessions) {
            sessions.keySet().stream()
                    .min(Long::compare)
                    .ifPresent(
                            oldest -> {
                                if (sessions.remove(oldest) != null) {
                                    log.info("Evicted comparison {} (limit {})", oldest, maxSessions);
                                }
                            });
        }
    }

    private String sanitizeName(String name, long id) {
        if (name == null || name.isBlank()) {
            return "Comparison " + id;
        }
        return name.trim();
    }
}
