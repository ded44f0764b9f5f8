package org.flowcanvas.interchange;

import org.flowcanvas.interchange.graph.GraphFileHelper;
import org.flowcanvas.interchange.graph.ProcessGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {
    private static final String COLLABORATION_BPMN = "src/test/resources/fixtures/collaboration.bpmn";
    private static final String MALFORMED_BPMN = "src/test/resources/fixtures/malformed.bpmn";

    @Test
    void shouldDecodeToJson(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("graph.json");

        int status = new Main().run(new String[]{"decode", COLLABORATION_BPMN, out.toString()});

        assertEquals(0, status);
        ProcessGraph graph = GraphFileHelper.readGraph(out);
        assertEquals(9, graph.nodes().size());
        assertEquals(4, graph.edges().size());
    }

    @Test
    void shouldEncodeJsonBackToBpmn(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("graph.json");
        Path bpmn = dir.resolve("out/model.bpmn");
        assertEquals(0, new Main().run(new String[]{"decode", COLLABORATION_BPMN, json.toString()}));

        int status = new Main().run(new String[]{"encode", json.toString(), bpmn.toString()});

        assertEquals(0, status);
        String xml = Files.readString(bpmn, StandardCharsets.UTF_8);
        assertTrue(xml.contains("id=\"Definitions_Orders\""));
        assertTrue(xml.contains("bpmnElement=\"MessageFlow_1\""));
    }

    @Test
    void shouldRoundTripAndValidate(@TempDir Path dir) throws IOException {
        Path bpmn = dir.resolve("roundtrip.bpmn");

        assertEquals(0, new Main().run(new String[]{"roundtrip", "--strict", COLLABORATION_BPMN, bpmn.toString()}));
        assertEquals(0, new Main().run(new String[]{"validate", bpmn.toString()}));
    }

    @Test
    void shouldUseConfigFile(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("codec.json");
        Files.writeString(config, "{\"indentAmount\":0,\"exporter\":\"batch\"}");
        Path json = dir.resolve("graph.json");
        Files.writeString(json, "{\"nodes\":[{\"id\":\"Task_1\",\"kind\":\"TASK\",\"name\":\"Solo\"}],\"edges\":[]}");
        Path bpmn = dir.resolve("solo.bpmn");

        int status = new Main().run(new String[]{"encode", "--config", config.toString(), json.toString(), bpmn.toString()});

        assertEquals(0, status);
        String xml = Files.readString(bpmn, StandardCharsets.UTF_8);
        assertTrue(xml.contains("exporter=\"batch\""));
        assertFalse(xml.contains("\n  <"));
    }

    @Test
    void shouldFailOnMalformedInput(@TempDir Path dir) throws IOException {
        int status = new Main().run(new String[]{"decode", MALFORMED_BPMN, dir.resolve("x.json").toString()});

        assertEquals(1, status);
        assertFalse(Files.exists(dir.resolve("x.json")));
    }

    @Test
    void shouldReportUsageErrors() throws IOException {
        assertEquals(2, new Main().run(new String[]{}));
        assertEquals(2, new Main().run(new String[]{"publish", "a", "b"}));
        assertEquals(2, new Main().run(new String[]{"decode", COLLABORATION_BPMN}));
        assertEquals(2, new Main().run(new String[]{"decode", "--config"}));
    }

    @Test
    void shouldFailOnMissingInput(@TempDir Path dir) {
        int status = new Main().run(new String[]{"decode", dir.resolve("absent.bpmn").toString(), dir.resolve("x.json").toString()});

        assertEquals(1, status);
    }

    @Test
    void shouldFailOnInvalidGraphJson(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("graph.json");
        Files.writeString(json, "{\"nodes\": [");

        int status = new Main().run(new String[]{"encode", json.toString(), dir.resolve("out.bpmn").toString()});

        assertEquals(1, status);
        assertFalse(Files.exists(dir.resolve("out.bpmn")));
    }
}
