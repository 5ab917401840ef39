package com.dubbi.screentrail.explore.api;

import com.dubbi.screentrail.common.dto.ListResponse;
import com.dubbi.screentrail.explore.api.dto.ExplorationDtos.ExplorationRunDTO;
import com.dubbi.screentrail.explore.api.dto.ExplorationDtos.SessionCommandResponse;
import com.dubbi.screentrail.explore.api.dto.ExplorationDtos.StartExplorationRequest;
import com.dubbi.screentrail.explore.domain.ExplorationRunEntity;
import com.dubbi.screentrail.explore.domain.ExplorationRunRepository;
import com.dubbi.screentrail.explore.engine.ExplorationSession;
import com.dubbi.screentrail.explore.service.ExplorationService;
import com.dubbi.screentrail.explore.service.ExplorationService.SessionConflictException;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/explorations")
public class ExplorationController {
    private final ExplorationService explorationService;
    private final ExplorationRunRepository runRepository;

    public ExplorationController(ExplorationService explorationService, ExplorationRunRepository runRepository) {
        this.explorationService = explorationService;
        this.runRepository = runRepository;
    }

    @GetMapping
    public ListResponse<ExplorationRunDTO> list(@RequestParam(required = false) String appId) {
        var runs = (appId == null || appId.isBlank()) ? runRepository.findAllNewestFirst() : runRepository.findByAppId(appId);
        return ListResponse.of(runs.stream().map(ExplorationController::toDto).toList());
    }

    @PostMapping
    public ResponseEntity<ExplorationRunDTO> start(@Valid @RequestBody StartExplorationRequest req) {
        try {
            var run = explorationService.start(req.appId().trim(), req.entryUrl(), req.budget());
            return ResponseEntity.ok(toDto(run));
        } catch (SessionConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExplorationRunDTO> get(@PathVariable UUID id) {
        return runRepository.findById(id)
                .map(run -> ResponseEntity.ok(toDto(run)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<SessionCommandResponse> resume(@PathVariable UUID id) {
        return command(id, ExplorationSession::resume);
    }

    @PostMapping("/{id}/abort")
    public ResponseEntity<SessionCommandResponse> abort(@PathVariable UUID id) {
        return command(id, ExplorationSession::abort);
    }

    private ResponseEntity<SessionCommandResponse> command(UUID id, Function<ExplorationSession, Boolean> action) {
        Optional<ExplorationSession> session = explorationService.find(id);
        if (session.isEmpty()) {
            // finished sessions only live in the runs table
            if (runRepository.existsById(id)) return ResponseEntity.status(HttpStatus.CONFLICT).build();
            return ResponseEntity.notFound().build();
        }
        boolean accepted = action.apply(session.get());
        var body = new SessionCommandResponse(id, session.get().state(), accepted);
        return accepted ? ResponseEntity.ok(body) : ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    private static ExplorationRunDTO toDto(ExplorationRunEntity e) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("screensExplored", e.getScreensExplored());
        stats.put("elementsDiscovered", e.getElementsDiscovered());
        stats.put("edgesRecorded", e.getEdgesRecorded());
        stats.put("dangerousSkipped", e.getDangerousSkipped());
        stats.put("loginScreens", e.getLoginScreens());
        stats.put("failures", e.getFailures());
        return new ExplorationRunDTO(
                e.getId(),
                e.getAppId(),
                e.getEntryPoint(),
                e.getStatus(),
                e.getMaxDepth(),
                e.getMaxMinutes(),
                e.getAppVersion(),
                stats,
                e.getCreatedAt(),
                e.getStartedAt(),
                e.getFinishedAt(),
                e.getErrorMessage()
        );
    }
}
