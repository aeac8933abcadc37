package co.fanki.codeintel.graph.domain;

import co.fanki.codeintel.config.SqliteDatabases;
import co.fanki.codeintel.shared.ProjectScope;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for {@link ProjectGraphStore} over a temporary SQLite
 * database file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectGraphStoreTest {

    private static final ProjectScope DEMO = ProjectScope.of("demo");

    @TempDir
    Path tempDir;

    private Jdbi jdbi;

    private ProjectGraphStore store;

    @BeforeEach
    void setUp() {
        jdbi = SqliteDatabases.open(tempDir.resolve("graph.db"),
                SqliteDatabases.GRAPH_MIGRATIONS);
        store = new ProjectGraphStore(jdbi);
    }

    /** Y calls the three callees; X and Z call one each. */
    private static List<CodeBlock> fanOutMethods() {
        return List.of(
                new CodeBlock("Y", "Y", List.of("callee"), "F1", "demo"),
                new CodeBlock("X", "X", List.of("callee1"), "F1", "demo"),
                new CodeBlock("Z", "Z", List.of("callee2"), "F1", "demo"),
                new CodeBlock("callee1", "callee1", List.of(), "F2", "demo"),
                new CodeBlock("callee2", "callee2", List.of(), "F2", "demo"),
                new CodeBlock("callee3", "callee3", List.of(), "F2", "demo"));
    }

    /** Returns the item lines following a section header. */
    private static List<String> section(final String text,
            final String header) {
        final List<String> lines = List.of(text.split("\n"));
        return lines.stream()
                .skip(lines.indexOf(header) + 1)
                .takeWhile(line -> line.startsWith("- "))
                .toList();
    }

    private static List<CodeBlock> demoMethods() {
        return List.of(
                new CodeBlock("A", "A", List.of("B"), "F1", "demo"),
                new CodeBlock("B", "B", List.of(), "F1", "demo"));
    }

    @Test
    void whenRebuilding_givenTwoMethods_shouldReturnStats() {
        final GraphStats stats = store.rebuild(DEMO, demoMethods());

        assertEquals(1, stats.files());
        assertEquals(2, stats.methods());
        assertEquals(1, stats.callEdges());
        assertEquals(2, stats.containsEdges());
    }

    @Test
    void whenGettingOverview_givenRebuiltProject_shouldListTotals() {
        store.rebuild(DEMO, demoMethods());

        final String overview = store.overviewText(DEMO, 25);

        assertTrue(overview.contains("Project: demo"));
        assertTrue(overview.contains("Files indexed: 1"));
        assertTrue(overview.contains("Methods indexed: 2"));
        assertTrue(overview.contains("Call edges (best-effort): 1"));
        assertTrue(overview.contains("Top callers (out-degree):\n- A (calls=1)"));
        assertTrue(overview.contains("Top callees (in-degree):\n- B (called_by=1)"));
        assertTrue(overview.contains("Sample call edges:\n- A -> B"));
    }

    @Test
    void whenGettingNeighbors_givenDepthOne_shouldListCalls() {
        store.rebuild(DEMO, demoMethods());

        final String neighbors = store.neighborsText(DEMO, "demo::A", 1, 50);

        assertTrue(neighbors.startsWith("Node: A\nDepth: 1"));
        assertTrue(neighbors.contains("Calls:\n- A -> B"));
        assertFalse(neighbors.contains("Called by:"));
    }

    @Test
    void whenGettingNeighbors_givenCallee_shouldListCallers() {
        store.rebuild(DEMO, demoMethods());

        final String neighbors = store.neighborsText(DEMO, "demo::B", 1, 50);

        assertTrue(neighbors.contains("Called by:\n- A -> B"));
    }

    @Test
    void whenGettingNeighbors_givenDepthAboveMaximum_shouldClampToFour() {
        store.rebuild(DEMO, demoMethods());

        final String neighbors = store.neighborsText(DEMO, "demo::A", 99, 0);

        assertTrue(neighbors.contains("Depth: 4"));
    }

    @Test
    void whenGettingOverview_givenTiedDegrees_shouldOrderByNodeId() {
        store.rebuild(DEMO, fanOutMethods());

        final String overview = store.overviewText(DEMO, 25);

        assertTrue(overview.contains("Top callers (out-degree):\n"
                + "- Y (calls=3)\n- X (calls=1)\n- Z (calls=1)"));
        assertTrue(overview.contains("Top callees (in-degree):\n"
                + "- callee1 (called_by=2)\n- callee2 (called_by=2)\n"
                + "- callee3 (called_by=1)"));
    }

    @Test
    void whenGettingOverview_givenSmallLimit_shouldCutTiesByNodeId() {
        store.rebuild(DEMO, fanOutMethods());

        final String overview = store.overviewText(DEMO, 2);

        assertEquals(List.of("- Y (calls=3)", "- X (calls=1)"),
                section(overview, "Top callers (out-degree):"));
        assertEquals(List.of("- callee1 (called_by=2)",
                "- callee2 (called_by=2)"),
                section(overview, "Top callees (in-degree):"));
    }

    @Test
    void whenGettingNeighbors_givenLimitBelowFanOut_shouldCapEachSection() {
        store.rebuild(DEMO, fanOutMethods());

        final String neighbors = store.neighborsText(DEMO, "demo::Y", 2, 2);

        assertEquals(List.of("- Y -> callee1", "- Y -> callee2"),
                section(neighbors, "Calls:"));
        assertEquals(List.of("- X -> callee1", "- Y -> callee1"),
                section(neighbors, "Called by:"));
        assertFalse(neighbors.contains("callee3"));
    }

    @Test
    void whenGettingNeighbors_givenCycle_shouldExpandEachNodeOnce() {
        store.rebuild(DEMO, List.of(
                new CodeBlock("alpha", "alpha", List.of("beta"), "F1", "demo"),
                new CodeBlock("beta", "beta", List.of("alpha"), "F1", "demo")));

        final String neighbors = store.neighborsText(DEMO, "demo::alpha", 4,
                50);

        assertEquals(List.of("- alpha -> beta", "- beta -> alpha"),
                section(neighbors, "Calls:"));
        assertEquals(List.of("- beta -> alpha", "- alpha -> beta"),
                section(neighbors, "Called by:"));
    }

    @Test
    void whenGettingOverview_givenUnknownProject_shouldReturnEmptyReport() {
        final String overview = store.overviewText(ProjectScope.of("nope"), 10);

        assertEquals("Project: nope\nFiles indexed: 0\nMethods indexed: 0\n"
                + "Call edges (best-effort): 0", overview);
    }

    @Test
    void whenRebuilding_givenNewParse_shouldReplaceOnlyThatScope() {
        store.rebuild(DEMO, demoMethods());
        store.rebuild(ProjectScope.of("other"), demoMethods());

        final GraphStats stats = store.rebuild(DEMO, List.of(
                new CodeBlock("C", "C", List.of(), "F2", "demo")));

        assertEquals(1, stats.methods());
        assertTrue(store.findNode(DEMO, "demo::A").isEmpty());
        assertTrue(store.findNode(DEMO, "demo::C").isPresent());
        assertTrue(store.overviewText(ProjectScope.of("other"), 5)
                .contains("Methods indexed: 2"));
    }

    @Test
    void whenRebuilding_givenUnscopedPartition_shouldUseRawIds() {
        store.rebuild(ProjectScope.unscoped(), demoMethods());

        final GraphNode node = store.findNode(ProjectScope.unscoped(), "A")
                .orElseThrow();

        assertEquals(NodeKind.METHOD, node.kind());
        assertEquals("F1", node.filePath());
        assertTrue(store.overviewText(ProjectScope.unscoped(), 5)
                .startsWith("Project: (default)"));
    }

    @Test
    void whenComputingFileDependencies_givenCrossFileCalls_shouldGroupByFile() {
        store.rebuild(DEMO, List.of(
                new CodeBlock("ctrl", "void handle()", List.of("save", "log"),
                        "Controller.java", "demo"),
                new CodeBlock("svc", "void save()", List.of("log"),
                        "Service.java", "demo"),
                new CodeBlock("util", "void log()", List.of(),
                        "Util.java", "demo"),
                new CodeBlock("helper", "void saveHelper()", List.of(),
                        "Controller.java", "demo")));

        final Map<String, List<String>> dependencies =
                store.fileDependencies(DEMO);

        assertEquals(List.of("Service.java", "Util.java"),
                dependencies.get("Controller.java"));
        assertEquals(List.of("Util.java"), dependencies.get("Service.java"));
        assertFalse(dependencies.containsKey("Util.java"));
    }

}
