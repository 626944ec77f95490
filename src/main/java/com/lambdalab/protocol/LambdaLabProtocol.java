package com.lambdalab.protocol;

import com.lambdalab.calculus.EvaluationResult;
import com.lambdalab.calculus.LambdaLab;
import com.lambdalab.calculus.ast.DotRenderer;
import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.ast.Printer;
import com.lambdalab.calculus.macro.DefinitionError;
import com.lambdalab.calculus.macro.DefinitionResult;
import com.lambdalab.calculus.macro.MacroDefinition;
import com.lambdalab.calculus.parser.ParseError;
import com.lambdalab.calculus.parser.UnboundMacroError;
import com.lambdalab.calculus.reduce.Strategy;
import com.lambdalab.debug.Debug;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON request/response layer between a front end and one {@link LambdaLab}
 * session.
 *
 * Request  = {"id":..,"method":"...","args":{...}}   ("params" is accepted for "args")
 * Response = {"id":..,"ok":true,"result":...}
 *          | {"id":..,"ok":false,"error":{"kind":"...","message":"...","pos":N}}
 *
 * Methods:
 *  - ping
 *  - define    {"source":"K = \\x.\\y.x"} or {"name":"K","body":"\\x.\\y.x"}
 *  - evaluate  {"code":"...","strategy":"cbv|cbn|appl|normal","budget":N?}
 *  - macros
 *  - clear
 *  - dot       {"code":"...","strategy":...?}
 *
 * Never throws: every failure becomes an ok:false response.
 */
public final class LambdaLabProtocol {

    private static final Debug.Channel LOG = Debug.channel("Protocol");

    private final ObjectMapper om = new ObjectMapper();
    private final LambdaLab session;

    public LambdaLabProtocol() {
        this(new LambdaLab());
    }

    public LambdaLabProtocol(LambdaLab session) {
        if (session == null) throw new IllegalArgumentException("session is null");
        this.session = session;
    }

    public LambdaLab session() { return session; }

    /** Text in, text out. Malformed JSON gives an ok:false response. */
    public String process(String requestJson) {
        ObjectNode resp;
        try {
            resp = process(requestJson == null ? null : om.readTree(requestJson));
        } catch (JsonProcessingException e) {
            resp = om.createObjectNode();
            fail(resp, "BAD_REQUEST", "Malformed JSON: " + e.getOriginalMessage(), -1);
        }
        try {
            return om.writeValueAsString(resp);
        } catch (JsonProcessingException e) {
            // ObjectNode trees always serialize
            throw new IllegalStateException(e);
        }
    }

    public ObjectNode process(JsonNode req) {
        ObjectNode resp = om.createObjectNode();
        if (req == null || !req.isObject()) {
            fail(resp, "BAD_REQUEST", "Request must be a JSON object", -1);
            return resp;
        }

        JsonNode id = req.get("id");
        if (id != null) resp.set("id", id);

        try {
            String method = req.path("method").asText("");
            JsonNode args = req.has("args") ? req.get("args") : req.get("params");
            if (args == null || args.isNull()) args = om.createObjectNode();

            switch (method) {
                case "ping": {
                    resp.put("ok", true);
                    resp.put("result", "pong");
                    break;
                }

                case "define": {
                    DefinitionResult r;
                    if (args.hasNonNull("source")) {
                        r = session.defineSource(args.get("source").asText());
                    } else if (args.hasNonNull("name") && args.hasNonNull("body")) {
                        r = session.define(args.get("name").asText(), args.get("body").asText());
                    } else {
                        fail(resp, "BAD_REQUEST", "define requires args.source or args.name and args.body", -1);
                        break;
                    }

                    if (r.isSuccess()) {
                        ObjectNode result = om.createObjectNode();
                        result.put("name", r.name());
                        result.put("definition", r.definition().render());
                        result.put("hasValue", r.definition().hasValue());
                        result.set("steps", strings(r.trace().highlightedSteps()));
                        result.set("macros", macroList());
                        resp.put("ok", true);
                        resp.set("result", result);
                    } else {
                        fail(resp, r.error().name(), r.message(), r.pos());
                    }
                    break;
                }

                case "evaluate": {
                    if (!args.hasNonNull("code")) {
                        fail(resp, "BAD_REQUEST", "evaluate requires args.code", -1);
                        break;
                    }
                    Strategy strategy = strategy(args);
                    int budget = args.path("budget").asInt(session.getStepBudget());

                    Expr expr = session.parse(args.get("code").asText(), strategy);
                    EvaluationResult r = session.evaluate(expr, strategy, budget);

                    ObjectNode result = om.createObjectNode();
                    result.put("strategy", strategy.key());
                    result.set("steps", strings(r.displayLines()));
                    result.put("timedOut", r.timedOut());
                    result.put("stepsTaken", r.stepsTaken());
                    if (r.timedOut()) result.putNull("final");
                    else result.put("final", Printer.render(r.finalExpr()));
                    if (r.resugared() != null) result.put("resugared", Printer.render(r.resugared()));
                    resp.put("ok", true);
                    resp.set("result", result);
                    break;
                }

                case "macros": {
                    resp.put("ok", true);
                    resp.set("result", macroList());
                    break;
                }

                case "clear": {
                    session.clear();
                    resp.put("ok", true);
                    resp.putNull("result");
                    break;
                }

                case "dot": {
                    if (!args.hasNonNull("code")) {
                        fail(resp, "BAD_REQUEST", "dot requires args.code", -1);
                        break;
                    }
                    Expr expr = session.parse(args.get("code").asText(), strategy(args));
                    ObjectNode result = om.createObjectNode();
                    result.put("dot", DotRenderer.render(expr));
                    resp.put("ok", true);
                    resp.set("result", result);
                    break;
                }

                default: {
                    fail(resp, "BAD_REQUEST", "Unknown method: " + method, -1);
                    break;
                }
            }

        } catch (UnboundMacroError e) {
            fail(resp, DefinitionError.UNBOUND_MACRO.name(), e.msg(), e.pos());
        } catch (ParseError e) {
            fail(resp, DefinitionError.SYNTAX.name(), e.msg(), e.pos());
        } catch (IllegalArgumentException e) {
            fail(resp, "BAD_REQUEST", e.getMessage(), -1);
        } catch (RuntimeException e) {
            LOG.e("request failed", e);
            fail(resp, "INTERNAL", e.toString(), -1);
        } catch (StackOverflowError e) {
            LOG.w("request nested too deeply");
            fail(resp, "BAD_REQUEST", "Expression is nested too deeply", -1);
        }

        return resp;
    }

    private Strategy strategy(JsonNode args) {
        return args.hasNonNull("strategy") ? Strategy.fromString(args.get("strategy").asText()) : Strategy.NORMAL;
    }

    private ArrayNode macroList() {
        ArrayNode out = om.createArrayNode();
        for (MacroDefinition def : session.listMacros()) {
            ObjectNode m = om.createObjectNode();
            m.put("name", def.name());
            m.put("body", Printer.render(def.unreducedBody()));
            m.put("definition", def.render());
            if (def.fullNormalForm() != null) m.put("normalForm", Printer.render(def.fullNormalForm()));
            if (def.cbvValue() != null) m.put("cbvValue", Printer.render(def.cbvValue()));
            if (def.cbnValue() != null) m.put("cbnValue", Printer.render(def.cbnValue()));
            out.add(m);
        }
        return out;
    }

    private ArrayNode strings(Iterable<String> lines) {
        ArrayNode out = om.createArrayNode();
        for (String s : lines) out.add(s);
        return out;
    }

    private void fail(ObjectNode resp, String kind, String message, int pos) {
        ObjectNode err = om.createObjectNode();
        err.put("kind", kind);
        err.put("message", message);
        if (pos >= 0) err.put("pos", pos);
        resp.put("ok", false);
        resp.set("error", err);
    }
}
