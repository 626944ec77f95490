import com.lambdalab.calculus.EvaluationResult;
import com.lambdalab.protocol.LambdaLabProtocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LambdaLabProtocolTest {

    private final ObjectMapper om = new ObjectMapper();
    private LambdaLabProtocol protocol;

    @BeforeEach
    void setUp() {
        protocol = new LambdaLabProtocol();
    }

    private ObjectNode request(String method, String... kv) {
        ObjectNode req = om.createObjectNode();
        req.put("id", 7);
        req.put("method", method);
        ObjectNode args = req.putObject("args");
        for (int i = 0; i < kv.length; i += 2) args.put(kv[i], kv[i + 1]);
        return req;
    }

    private static List<String> texts(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : array) out.add(n.asText());
        return out;
    }

    @Test
    public void ping_echoesIdAndPongs() {
        ObjectNode resp = protocol.process(request("ping"));
        assertEquals(7, resp.get("id").asInt());
        assertTrue(resp.get("ok").asBoolean());
        assertEquals("pong", resp.get("result").asText());
    }

    @Test
    public void define_thenEvaluate_returnsMarkedStepsAndResugaredValue() {
        ObjectNode def = protocol.process(request("define", "source", "I = \\x.x"));
        assertTrue(def.get("ok").asBoolean(), def.toString());
        assertEquals("I", def.at("/result/name").asText());
        assertEquals("I ≜ λx.x", def.at("/result/definition").asText());
        assertTrue(def.at("/result/hasValue").asBoolean());

        ObjectNode resp = protocol.process(request("evaluate", "code", "I I", "strategy", "normal"));
        assertTrue(resp.get("ok").asBoolean(), resp.toString());
        JsonNode result = resp.get("result");
        assertEquals(Arrays.asList("<a>I</a> <s>I</s>", "<a>I</a>", "λx.x", EvaluationResult.RESUGARED_PREFIX + "I"), texts(result.get("steps")));
        assertEquals("λx.x", result.get("final").asText());
        assertEquals("I", result.get("resugared").asText());
        assertFalse(result.get("timedOut").asBoolean());
        assertEquals(2, result.get("stepsTaken").asInt());
    }

    @Test
    public void evaluate_timeoutIsANormalResult() {
        ObjectNode req = request("evaluate", "code", "(\\x.x x)(\\x.x x)", "strategy", "cbv");
        ((ObjectNode) req.get("args")).put("budget", 3);

        ObjectNode resp = protocol.process(req);
        assertTrue(resp.get("ok").asBoolean());
        assertTrue(resp.at("/result/timedOut").asBoolean());
        assertTrue(resp.at("/result/final").isNull());
        assertEquals(3, resp.at("/result/steps").size());
    }

    @Test
    public void cyclicDefinition_isReportedAsError() {
        protocol.process(request("define", "name", "B", "body", "\\x.x"));
        protocol.process(request("define", "name", "A", "body", "B"));

        ObjectNode resp = protocol.process(request("define", "source", "B ≜ A"));
        assertFalse(resp.get("ok").asBoolean());
        assertEquals("CYCLIC", resp.at("/error/kind").asText());

        ObjectNode macros = protocol.process(request("macros"));
        List<String> names = new ArrayList<>();
        for (JsonNode m : macros.get("result")) names.add(m.get("definition").asText());
        assertEquals(Arrays.asList("B ≜ λx.x", "A ≜ B"), names);
    }

    @Test
    public void parseFailures_carryKindAndPosition() {
        ObjectNode unbound = protocol.process(request("evaluate", "code", "K", "strategy", "cbv"));
        assertFalse(unbound.get("ok").asBoolean());
        assertEquals("UNBOUND_MACRO", unbound.at("/error/kind").asText());
        assertEquals(0, unbound.at("/error/pos").asInt());

        ObjectNode syntax = protocol.process(request("evaluate", "code", "(x"));
        assertEquals("SYNTAX", syntax.at("/error/kind").asText());
        assertEquals("unbalanced parentheses", syntax.at("/error/message").asText());
        assertEquals(2, syntax.at("/error/pos").asInt());
    }

    @Test
    public void badRequests_neverThrow() {
        assertEquals("BAD_REQUEST", protocol.process(request("launch")).at("/error/kind").asText());
        assertEquals("BAD_REQUEST", protocol.process(request("evaluate")).at("/error/kind").asText());
        assertEquals("BAD_REQUEST",
                protocol.process(request("evaluate", "code", "x", "strategy", "lazy")).at("/error/kind").asText());

        String resp = protocol.process("{not json");
        assertTrue(resp.contains("\"ok\":false"), resp);
        assertTrue(resp.contains("BAD_REQUEST"), resp);
    }

    @Test
    public void clear_emptiesMacroList() {
        protocol.process(request("define", "source", "I = \\x.x"));
        assertEquals(1, protocol.process(request("macros")).get("result").size());

        assertTrue(protocol.process(request("clear")).get("ok").asBoolean());
        assertEquals(0, protocol.process(request("macros")).get("result").size());
    }

    @Test
    public void dot_rendersParsedExpression() {
        ObjectNode resp = protocol.process(request("dot", "code", "f x"));
        assertTrue(resp.get("ok").asBoolean());
        assertTrue(resp.at("/result/dot").asText().startsWith("digraph ast {"));
    }

    @Test
    public void textRoundTrip_usesSameEnvelope() {
        String resp = protocol.process("{\"id\":\"a\",\"method\":\"ping\"}");
        assertEquals("{\"id\":\"a\",\"ok\":true,\"result\":\"pong\"}", resp);
    }

    @Test
    public void deeplyNestedInput_isRejectedNotThrown() {
        StringBuilder code = new StringBuilder("x");
        for (int i = 0; i < 200_000; i++) code.append(" x");

        ObjectNode resp = protocol.process(request("evaluate", "code", code.toString(), "strategy", "cbv"));
        assertFalse(resp.get("ok").asBoolean());
        assertEquals("BAD_REQUEST", resp.at("/error/kind").asText());

        assertTrue(protocol.process(request("ping")).get("ok").asBoolean());
    }
}
