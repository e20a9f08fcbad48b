package com.updates.dtree.io;

import com.updates.dtree.api.CycleDetectedException;
import com.updates.dtree.api.DecodingException;
import com.updates.dtree.api.NodeId;
import com.updates.dtree.api.Query;
import com.updates.dtree.engine.DecisionGraph;
import com.updates.dtree.engine.TreeEvaluator;
import com.updates.dtree.node.DecisionNode;
import com.updates.dtree.node.EnumeratedNode;
import com.updates.dtree.node.Nodes;
import com.updates.dtree.node.SetMembershipNode;
import com.updates.dtree.testutil.UpdateTreeFixtures;
import com.updates.dtree.util.RandomSources;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.updates.dtree.api.NodeId.of;
import static org.junit.Assert.*;

public class GraphSerializerTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final GraphSerializer serializer = new GraphSerializer();

    private static DecisionGraph everyVariant() {
        Map<Object, NodeId> cases = new LinkedHashMap<>();
        cases.put(32, of(2));
        cases.put(64L, of(3));
        return DecisionGraph.builder()
                .node(0, Nodes.product("Firefox", of(1), of(9)))
                .node(1, new EnumeratedNode("cpuarch", cases, of(3)))
                .node(2, Nodes.versionCutoff("56", of(4), of(5)))
                .node(3, new SetMembershipNode("locale", Set.of(), of(9), of(5)))
                .node(4, new SetMembershipNode("flag", Set.of("1", 1L, true), of(6), of(5)))
                .node(5, Nodes.rollout(0.05, of(6), of(9)))
                .node(6, Nodes.outcome(42))
                .node(9, Nodes.outcome("no-update"))
                .build();
    }

    @Test
    public void testRecordsRoundTrip() {
        for (DecisionGraph g : List.of(everyVariant(), UpdateTreeFixtures.firefoxUpdates())) {
            List<NodeRecord> records = serializer.serialize(g);
            assertEquals(g.size(), records.size());
            assertEquals(g, serializer.deserialize(records));
        }
    }

    @Test
    public void testCustomRootRoundTrip() {
        DecisionGraph g = DecisionGraph.builder()
                .root(of("start"))
                .node("ok", Nodes.outcome("ok"))
                .node("other", Nodes.outcome("other"))
                .node("start", Nodes.product("Firefox", of("ok"), of("other")))
                .build();
        List<NodeRecord> records = serializer.serialize(g);
        assertEquals(of("start"), records.get(0).id());

        DecisionGraph back = serializer.deserialize(records);
        assertEquals(of("start"), back.root());
        assertEquals(g, back);
    }

    @Test
    public void testCustomRootNotRerootedAtZero() {
        DecisionGraph g = DecisionGraph.builder()
                .root(of("start"))
                .node(0, Nodes.outcome("zero"))
                .node("start", Nodes.versionCutoff("56", of(0), of("new")))
                .node("new", Nodes.outcome("new"))
                .build();
        assertEquals(g, serializer.deserialize(serializer.serialize(g)));
    }

    @Test(expected = DecodingException.class)
    public void testEmptyRecordSequence() {
        serializer.deserialize(List.of());
    }

    @Test
    public void testRecordsKeepGraphOrder() {
        List<NodeId> ids = new ArrayList<>();
        for (NodeRecord r : serializer.serialize(everyVariant()))
            ids.add(r.id());
        assertEquals(List.copyOf(everyVariant().nodes().keySet()), ids);
    }

    @Test
    public void testStateLayout() {
        NodeRecord r = serializer.encode(of(2), Nodes.versionCutoff("56", of(4), of(5)));
        assertEquals("ORDERED_CUTOFF", r.type());
        assertEquals("{\"field\":\"version\",\"cutoff\":\"56\",\"less\":\"4\",\"greater_or_equal\":\"5\"}",
                r.stateJson());

        NodeRecord terminal = serializer.encode(of(6), Nodes.outcome(42));
        assertEquals("{\"value\":42}", terminal.stateJson());
    }

    @Test
    public void testStorageRowRoundTrip() {
        NodeRecord written = serializer.encode(of(3), Nodes.locale(List.of("fr", "de"), of(4), of(5)));
        NodeRecord read = NodeRecord.of(written.id().value(), written.type(), written.stateJson());
        assertEquals(written, read);
        assertEquals(Nodes.locale(List.of("de", "fr"), of(4), of(5)), serializer.decode(read));
    }

    @Test
    public void testIntegerNodeIdsAreAccepted() {
        DecisionNode n = serializer.decode(NodeRecord.of("0", "EQUALS_BRANCH",
                "{\"field\":\"cpuarch\",\"value\":32,\"success\":1,\"failure\":\"2\"}"));
        assertEquals(Nodes.cpuArchitecture(of(1), of(2)), n);
    }

    @Test
    public void testUnknownTag() {
        try {
            serializer.decode(NodeRecord.of("7", "REGEX_BRANCH", "{}"));
            fail("expected DecodingException");
        } catch (DecodingException e) {
            assertEquals("7", e.nodeId());
            assertTrue(e.getMessage().contains("Unknown node type 'REGEX_BRANCH'"));
        }
    }

    @Test
    public void testMissingPayloadField() {
        try {
            serializer.decode(NodeRecord.of("3", "ORDERED_CUTOFF", "{\"field\":\"version\",\"less\":1,\"greater_or_equal\":2}"));
            fail("expected DecodingException");
        } catch (DecodingException e) {
            assertTrue(e.getMessage().contains("Missing 'cutoff'"));
        }
    }

    @Test
    public void testNonScalarValue() {
        try {
            serializer.decode(NodeRecord.of("3", "TERMINAL", "{\"value\":[1,2]}"));
            fail("expected DecodingException");
        } catch (DecodingException e) {
            assertTrue(e.getMessage().contains("'value' must be a string, integer or boolean"));
        }
        try {
            serializer.decode(NodeRecord.of("3", "TERMINAL", "{\"value\":1.5}"));
            fail("expected DecodingException");
        } catch (DecodingException expected) {
        }
    }

    @Test
    public void testStateMustBeAnObject() {
        try {
            serializer.decode(NodeRecord.of("3", "TERMINAL", "\"x\""));
            fail("expected DecodingException");
        } catch (DecodingException e) {
            assertTrue(e.getMessage().contains("must be a JSON object"));
        }
    }

    @Test
    public void testInvalidParametersAreWrapped() {
        try {
            serializer.decode(NodeRecord.of("4", "PROBABILISTIC", "{\"threshold\":2,\"inside\":1,\"outside\":2}"));
            fail("expected DecodingException");
        } catch (DecodingException e) {
            assertTrue(e.getMessage().contains("Invalid PROBABILISTIC parameters"));
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    @Test
    public void testDuplicateEnumeratedCase() {
        try {
            serializer.decode(NodeRecord.of("1", "ENUMERATED",
                    "{\"field\":\"os\",\"cases\":[{\"value\":\"linux\",\"target\":2},{\"value\":\"linux\",\"target\":3}],\"default\":4}"));
            fail("expected DecodingException");
        } catch (DecodingException e) {
            assertTrue(e.getMessage().contains("Duplicate enumerated case"));
        }
    }

    @Test(expected = DecodingException.class)
    public void testMalformedStateJson() {
        NodeRecord.of("1", "TERMINAL", "{\"value\":");
    }

    @Test(expected = DecodingException.class)
    public void testRecordWithoutId() {
        NodeRecord.of("", "TERMINAL", "{\"value\":1}");
    }

    @Test
    public void testDuplicateRecordId() {
        List<NodeRecord> records = new ArrayList<>(serializer.serialize(UpdateTreeFixtures.versionSplit("56")));
        records.add(serializer.encode(of("old"), Nodes.outcome("again")));
        try {
            serializer.deserialize(records);
            fail("expected DecodingException");
        } catch (DecodingException e) {
            assertTrue(e.getMessage().contains("Duplicate node id"));
        }
    }

    @Test(expected = CycleDetectedException.class)
    public void testGraphValidationStillApplies() {
        List<NodeRecord> records = List.of(
                serializer.encode(of(0), Nodes.versionCutoff("56", of(1), of(2))),
                serializer.encode(of(1), Nodes.locale(List.of("de"), of(0), of(2))),
                serializer.encode(of(2), Nodes.outcome("x")));
        serializer.deserialize(records);
    }

    @Test
    public void testJsonDocumentRoundTrip() {
        DecisionGraph g = DecisionGraph.builder()
                .root(of("start"))
                .node("start", Nodes.rollout(0.5, of("a"), of("b")))
                .node("a", Nodes.outcome("a"))
                .node("b", Nodes.outcome(true))
                .build();
        String json = serializer.toJson(g, "ab-test", "3");
        assertTrue(json.contains("\"root\" : \"start\""));
        assertTrue(json.contains("\"description\" : \"rollout 50%\""));
        assertEquals(g, serializer.fromJson(json));

        GraphDefinition def = serializer.toDefinition(g, "ab-test", "3");
        assertEquals("ab-test", def.getTree().getName());
        assertEquals(3, def.getTree().getNodes().size());
    }

    @Test
    public void testFileRoundTrip() throws Exception {
        Path file = tmp.newFile("tree.json").toPath();
        DecisionGraph g = UpdateTreeFixtures.firefoxUpdates();
        serializer.write(g, "firefox", "1", file);
        assertEquals(g, serializer.read(file));
    }

    @Test
    public void testMalformedDocuments() {
        for (String json : List.of("{", "{}", "{\"tree\":{\"name\":\"empty\",\"nodes\":[]}}",
                "{\"tree\":{\"nodes\":[{\"type\":\"TERMINAL\",\"state\":{\"value\":1}}]}}",
                "{\"tree\":{\"nodes\":[{\"id\":\"0\",\"type\":\"TERMINAL\"}]}}")) {
            try {
                serializer.fromJson(json);
                fail("expected DecodingException for " + json);
            } catch (DecodingException expected) {
            }
        }
    }

    @Test
    public void testLoadFixture() throws Exception {
        DecisionGraph g;
        try (InputStream in = getClass().getResourceAsStream("/trees/rollout_tree.json")) {
            g = serializer.read(in);
        }
        assertEquals(9, g.size());
        assertEquals(NodeId.ROOT, g.root());

        TreeEvaluator evaluator = new TreeEvaluator(g, RandomSources.constant(0.1));
        Query windowsOld = Query.builder().with("product", "Firefox").with("os", "windows")
                .with("version", "55.0.3").build();
        assertEquals("firefox57-partial", evaluator.evaluate(windowsOld));
        assertEquals("no-update", evaluator.evaluate(windowsOld, RandomSources.constant(0.9)));
        assertEquals("unsupported-product", evaluator.evaluate(Query.builder().with("product", "Thunderbird").build()));
        assertEquals("firefox57-complete", evaluator.evaluate(Query.builder().with("product", "Firefox")
                .with("os", "osx").with("locale", "de").build()));
    }
}
