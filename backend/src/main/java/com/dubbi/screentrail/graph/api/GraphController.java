package com.dubbi.screentrail.graph.api;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import com.dubbi.screentrail.graph.api.dto.GraphDtos.EdgeDTO;
import com.dubbi.screentrail.graph.api.dto.GraphDtos.GraphDTO;
import com.dubbi.screentrail.graph.api.dto.GraphDtos.NodeDTO;
import com.dubbi.screentrail.graph.api.dto.GraphDtos.PathDTO;
import com.dubbi.screentrail.graph.domain.NavigationEdgeRepository;
import com.dubbi.screentrail.graph.domain.ScreenStateRepository;
import com.dubbi.screentrail.graph.service.NavigationGraphBuilder;
import com.dubbi.screentrail.identity.service.ElementIdentity;
import com.dubbi.screentrail.identity.service.IdentityRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 저장된 내비게이션 그래프 조회. 진행 중인 세션의 변경분은 세션이 끝나 flush된 뒤 보인다.
 */
@RestController
@RequestMapping("/api/apps/{appId}/graph")
public class GraphController {
    private final ScreenStateRepository screenStateRepository;
    private final NavigationEdgeRepository navigationEdgeRepository;
    private final NavigationGraphBuilder graphBuilder;
    private final IdentityRegistry identityRegistry;

    public GraphController(
            ScreenStateRepository screenStateRepository,
            NavigationEdgeRepository navigationEdgeRepository,
            NavigationGraphBuilder graphBuilder,
            IdentityRegistry identityRegistry
    ) {
        this.screenStateRepository = screenStateRepository;
        this.navigationEdgeRepository = navigationEdgeRepository;
        this.graphBuilder = graphBuilder;
        this.identityRegistry = identityRegistry;
    }

    @GetMapping
    public ResponseEntity<GraphDTO> get(@PathVariable String appId) {
        var screens = screenStateRepository.findByAppId(appId);
        if (screens.isEmpty()) return ResponseEntity.notFound().build();

        var nodes = screens.stream()
                .map(s -> new NodeDTO(
                        s.getFingerprint(),
                        s.getTitle(),
                        s.getDepth(),
                        s.getAppVersion(),
                        ScreenFingerprint.EXTERNAL.value().equals(s.getFingerprint()),
                        s.getElementIds()
                ))
                .toList();

        var edges = navigationEdgeRepository.findByAppId(appId).stream()
                .map(e -> new EdgeDTO(
                        e.getFromFingerprint(),
                        e.getToFingerprint(),
                        e.getTriggerElementId(),
                        triggerName(e.getTriggerElementId()),
                        e.getDiscoveredAt()
                ))
                .toList();

        return ResponseEntity.ok(new GraphDTO(appId, nodes, edges));
    }

    /** 이번 프로세스에서 탐색한 그래프 기준 최단 경로 */
    @GetMapping("/path")
    public ResponseEntity<PathDTO> path(@PathVariable String appId, @RequestParam String from, @RequestParam String to) {
        ScreenFingerprint start;
        ScreenFingerprint goal;
        try {
            start = new ScreenFingerprint(from);
            goal = new ScreenFingerprint(to);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }

        var path = graphBuilder.getGraph(appId).shortestPath(start, goal);
        if (path.isEmpty()) return ResponseEntity.notFound().build();

        var edges = path.get().stream()
                .map(e -> new EdgeDTO(e.from().value(), e.to().value(), e.triggerElementId(), triggerName(e.triggerElementId()), e.discoveredAt()))
                .toList();
        return ResponseEntity.ok(new PathDTO(from, to, edges));
    }

    private String triggerName(String identityId) {
        return identityRegistry.find(identityId).map(ElementIdentity::displayName).orElse(null);
    }
}
