package com.dubbi.screentrail.explore.api;

import com.dubbi.screentrail.explore.domain.ExplorationRunRepository;
import com.dubbi.screentrail.explore.service.ExplorationEventHub;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/explorations/{id}/events")
public class ExplorationEventsController {
    private final ExplorationRunRepository runRepository;
    private final ExplorationEventHub eventHub;

    public ExplorationEventsController(ExplorationRunRepository runRepository, ExplorationEventHub eventHub) {
        this.runRepository = runRepository;
        this.eventHub = eventHub;
    }

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> subscribe(@PathVariable UUID id) {
        if (!runRepository.existsById(id)) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(eventHub.subscribe(id));
    }
}
