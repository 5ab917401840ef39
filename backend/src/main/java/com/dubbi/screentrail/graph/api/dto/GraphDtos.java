package com.dubbi.screentrail.graph.api.dto;

import java.time.Instant;
import java.util.List;

public final class GraphDtos {
    private GraphDtos() {}

    public record GraphDTO(String appId, List<NodeDTO> nodes, List<EdgeDTO> edges) {}

    public record NodeDTO(
            String fingerprint,
            String title,
            int depth,
            String appVersion,
            boolean external,
            List<String> elementIds
    ) {}

    public record EdgeDTO(
            String from,
            String to,
            String triggerElementId,
            String triggerName,
            Instant discoveredAt
    ) {}

    public record PathDTO(String from, String to, List<EdgeDTO> edges) {}
}
