package com.dubbi.screentrail.graph.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class NavigationGraphBuilderTest {
    private static final String APP = "com.example.app";
    private static final ScreenFingerprint HOME = new ScreenFingerprint("1".repeat(64));
    private static final ScreenFingerprint LIST = new ScreenFingerprint("2".repeat(64));
    private static final ScreenFingerprint DETAIL = new ScreenFingerprint("3".repeat(64));
    private static final ScreenFingerprint ABOUT = new ScreenFingerprint("4".repeat(64));

    private final NavigationGraphBuilder builder =
            new NavigationGraphBuilder(Clock.fixed(Instant.parse("2026-01-05T09:00:00Z"), ZoneOffset.UTC));

    @Test
    void sameTransitionIsRecordedOnce() {
        assertThat(builder.addEdge(APP, HOME, "btn-list", LIST)).isTrue();
        assertThat(builder.addEdge(APP, HOME, "btn-list", LIST)).isFalse();
        assertThat(builder.addEdge(APP, HOME, "btn-list-2", LIST)).isTrue();

        assertThat(builder.getGraph(APP).edges()).hasSize(2);
    }

    @Test
    void edgeEndpointsBecomePlaceholdersUntilExplored() {
        builder.addEdge(APP, HOME, "btn-list", LIST);
        assertThat(builder.getGraph(APP).screen(LIST)).get().extracting(ScreenNode::depth).isEqualTo(-1);

        builder.addScreen(APP, LIST, "List", 1, List.of("e1", "e2"));

        ScreenNode list = builder.getGraph(APP).screen(LIST).orElseThrow();
        assertThat(list.depth()).isEqualTo(1);
        assertThat(list.title()).isEqualTo("List");
        assertThat(list.elementIds()).containsExactly("e1", "e2");
    }

    @Test
    void exploredScreenIsNotOverwritten() {
        builder.addScreen(APP, HOME, "Home", 0, List.of("e1"));
        builder.addScreen(APP, HOME, "Home again", 3, List.of());

        assertThat(builder.getGraph(APP).screen(HOME)).get().extracting(ScreenNode::depth).isEqualTo(0);
    }

    @Test
    void shortestPathFollowsFewestEdges() {
        builder.addEdge(APP, HOME, "a", LIST);
        builder.addEdge(APP, LIST, "b", DETAIL);
        builder.addEdge(APP, HOME, "c", ABOUT);
        builder.addEdge(APP, ABOUT, "d", LIST);
        builder.addEdge(APP, HOME, "e", DETAIL);

        NavigationGraph graph = builder.getGraph(APP);

        assertThat(graph.shortestPath(HOME, DETAIL).orElseThrow()).hasSize(1);
        assertThat(graph.shortestPath(ABOUT, DETAIL).orElseThrow())
                .extracting(NavigationEdge::triggerElementId).containsExactly("d", "b");
        assertThat(graph.shortestPath(HOME, HOME)).contains(List.of());
        assertThat(graph.shortestPath(DETAIL, HOME)).isEmpty();
    }

    @Test
    void unknownAppHasEmptyGraph() {
        NavigationGraph graph = builder.getGraph("com.example.unknown");

        assertThat(graph.screens()).isEmpty();
        assertThat(graph.edges()).isEmpty();
        assertThat(graph.outgoing(HOME)).isEmpty();
    }

    @Test
    void externalEndpointIsLabelled() {
        builder.addEdge(APP, HOME, "share", ScreenFingerprint.EXTERNAL);

        assertThat(builder.getGraph(APP).screen(ScreenFingerprint.EXTERNAL)).get()
                .extracting(ScreenNode::title).isEqualTo("external");
        assertThat(builder.getGraph(APP).outgoing(HOME)).extracting(NavigationEdge::to)
                .containsExactly(ScreenFingerprint.EXTERNAL);
    }
}
