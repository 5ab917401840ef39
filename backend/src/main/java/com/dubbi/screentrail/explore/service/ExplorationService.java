package com.dubbi.screentrail.explore.service;

import com.dubbi.screentrail.explore.domain.ExplorationRunEntity;
import com.dubbi.screentrail.explore.domain.ExplorationRunRepository;
import com.dubbi.screentrail.explore.engine.ExplorationBudget;
import com.dubbi.screentrail.explore.engine.ExplorationEngine;
import com.dubbi.screentrail.explore.engine.ExplorationSession;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 탐색 세션 수명 관리. 앱 하나에 진행 중인 세션은 하나뿐이다.
 */
@Service
public class ExplorationService {
    private static final Logger log = LoggerFactory.getLogger(ExplorationService.class);

    private final ExplorationEngine engine;
    private final ExplorationRunRepository runRepository;
    private final ConcurrentHashMap<UUID, ExplorationSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, UUID> activeByApp = new ConcurrentHashMap<>();

    public ExplorationService(ExplorationEngine engine, ExplorationRunRepository runRepository) {
        this.engine = engine;
        this.runRepository = runRepository;
    }

    /**
     * 새 세션을 만들고 실행을 시작한다.
     *
     * @throws SessionConflictException 같은 앱에 진행 중인 세션이 있을 때
     */
    public ExplorationRunEntity start(String appId, String entryPoint, Map<String, Object> budgetJson) {
        ExplorationBudget budget = ExplorationBudget.from(budgetJson);
        ExplorationSession session = engine.newSession(appId, entryPoint, budget);

        UUID existing = activeByApp.putIfAbsent(appId, session.id());
        if (existing != null) {
            throw new SessionConflictException("exploration " + existing + " is still active for " + appId);
        }

        ExplorationRunEntity run;
        try {
            run = runRepository.save(new ExplorationRunEntity(
                    session.id(), appId, entryPoint, budget.maxDepth(), (int) budget.maxDuration().toMinutes()));
            sessions.put(session.id(), session);
            session.completion().whenComplete((report, error) -> {
                activeByApp.remove(appId, session.id());
                sessions.remove(session.id());
            });
            engine.launch(session);
        } catch (RuntimeException e) {
            activeByApp.remove(appId, session.id());
            sessions.remove(session.id());
            throw e;
        }
        log.info("[Explore] queued session {} for {}", session.id(), appId);
        return run;
    }

    /** 진행 중인 세션만 찾는다. 끝난 세션은 exploration_runs에서 조회한다. */
    public Optional<ExplorationSession> find(UUID sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /** @return 세션이 없으면 empty, 일시정지 상태가 아니면 false */
    public Optional<Boolean> resume(UUID sessionId) {
        return find(sessionId).map(ExplorationSession::resume);
    }

    public Optional<Boolean> abort(UUID sessionId) {
        return find(sessionId).map(ExplorationSession::abort);
    }

    public static class SessionConflictException extends RuntimeException {
        public SessionConflictException(String message) {
            super(message);
        }
    }
}
