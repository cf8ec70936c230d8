package com.ignis.ruleengine.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.ignis.ruleengine.api.IRuleLoader;
import com.ignis.ruleengine.api.exceptions.InvalidRuleException;
import com.ignis.ruleengine.api.exceptions.MalformedSourceException;
import com.ignis.ruleengine.api.exceptions.RuleLoadException;
import com.ignis.ruleengine.api.exceptions.SourceNotFoundException;
import com.ignis.ruleengine.api.model.Condition;
import com.ignis.ruleengine.api.model.Operator;
import com.ignis.ruleengine.api.model.Rule;
import com.ignis.ruleengine.api.model.RuleDefinition;
import com.ignis.ruleengine.api.model.RuleOutcome;
import com.ignis.ruleengine.api.model.RuleStore;
import com.ignis.ruleengine.api.model.ValueKind;
import com.ignis.ruleengine.infra.telemetry.TracingService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Loads a JSON rule set into a validated, priority-ordered {@link RuleStore}.
 *
 * <p>Loading happens in three steps:
 * <ol>
 *   <li>Parse the document into a JSON tree. A missing source, a syntax error or a
 *       root that is not an array fails the whole load.</li>
 *   <li>Bind and validate each element on its own, so that an error names the
 *       rule (index and id) and the field at fault.</li>
 *   <li>Sort by ascending priority. {@link List#sort} is stable, so rules sharing a
 *       priority keep their declaration order.</li>
 * </ol>
 *
 * <p>Operator symbols are resolved to {@link Operator} constants and operands are
 * tagged with their {@link ValueKind} here, once, rather than on every evaluation.
 */
public class RuleLoader implements IRuleLoader {
    private static final Logger logger = Logger.getLogger(RuleLoader.class.getName());

    private final ObjectMapper objectMapper = newObjectMapper();
    private final Tracer tracer;

    public RuleLoader() {
        this(TracingService.getInstance().getTracer());
    }

    public RuleLoader(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Strict mapper: content after the root value is a syntax error, and priorities
     * must be JSON integers, neither fractional nor quoted.
     */
    private static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper()
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        return mapper;
    }

    @Override
    public RuleStore load(Path rulesPath) throws IOException {
        String source = rulesPath.toString();
        if (!Files.exists(rulesPath)) {
            throw new SourceNotFoundException(source);
        }
        try (InputStream in = Files.newInputStream(rulesPath)) {
            return load(in, source);
        } catch (NoSuchFileException e) {
            throw new SourceNotFoundException(source, e);
        }
    }

    @Override
    public RuleStore load(InputStream in, String sourceName) throws IOException {
        Span span = tracer.spanBuilder("load-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleSource", sourceName);
            long startTime = System.nanoTime();

            JsonNode root = parse(in, sourceName);
            List<Rule> rules = validate(root, sourceName);
            rules.sort(Comparator.comparingInt(Rule::priority));

            RuleStore store = new RuleStore(rules, sourceName, Instant.now());
            long elapsedMicros = (System.nanoTime() - startTime) / 1_000;
            span.setAttribute("ruleCount", store.size());
            span.setAttribute("loadTimeMicros", elapsedMicros);
            logger.info(String.format("Loaded %d rules from '%s' in %d µs", store.size(), sourceName, elapsedMicros));
            return store;
        } catch (IOException | RuleLoadException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private JsonNode parse(InputStream in, String sourceName) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new MalformedSourceException(sourceName, "not valid JSON (" + e.getOriginalMessage() + ")", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new MalformedSourceException(sourceName, "document is empty");
        }
        if (!root.isArray()) {
            throw new MalformedSourceException(sourceName,
                    "expected a JSON array of rules but found " + root.getNodeType());
        }
        return root;
    }

    private List<Rule> validate(JsonNode root, String sourceName) {
        Span span = tracer.spanBuilder("validate-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (root.isEmpty()) {
                throw new InvalidRuleException(sourceName, -1, null, null, "Rule set contains no rules");
            }

            List<Rule> rules = new ArrayList<>(root.size());
            Set<String> seenIds = new HashSet<>();
            for (int i = 0; i < root.size(); i++) {
                Rule rule = toRule(root.get(i), i, sourceName);
                if (!seenIds.add(rule.id())) {
                    logger.warning("Duplicate rule id '" + rule.id() + "' at index " + i + " in '" + sourceName + "'");
                }
                rules.add(rule);
            }
            span.setAttribute("validRuleCount", rules.size());
            return rules;
        } catch (RuleLoadException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Rule toRule(JsonNode node, int index, String sourceName) {
        if (node == null || !node.isObject()) {
            throw new InvalidRuleException(sourceName, index, null, null,
                    "expected a JSON object but found " + (node == null ? "nothing" : node.getNodeType()));
        }
        JsonNode idNode = node.path("id");
        String rawId = idNode.isTextual() || idNode.isNumber() ? idNode.asText() : null;

        RuleDefinition def;
        try {
            def = objectMapper.treeToValue(node, RuleDefinition.class);
        } catch (JsonMappingException e) {
            throw new InvalidRuleException(sourceName, index, rawId, pathOf(e),
                    "cannot be read (" + e.getOriginalMessage() + ")", e);
        } catch (JsonProcessingException e) {
            throw new InvalidRuleException(sourceName, index, rawId, null,
                    "cannot be read (" + e.getOriginalMessage() + ")", e);
        }

        String id = def.id();
        if (id == null || id.isBlank()) {
            throw new InvalidRuleException(sourceName, index, null, "id", "missing or empty id");
        }
        if (def.priority() == null) {
            throw new InvalidRuleException(sourceName, index, id, "priority", "missing priority");
        }
        if (def.conditions() == null) {
            throw new InvalidRuleException(sourceName, index, id, "conditions", "missing conditions");
        }

        List<Condition> conditions = new ArrayList<>(def.conditions().size());
        for (int j = 0; j < def.conditions().size(); j++) {
            conditions.add(toCondition(def.conditions().get(j), index, id, j, sourceName));
        }

        RuleDefinition.ResultDefinition result = def.result();
        if (result == null) {
            throw new InvalidRuleException(sourceName, index, id, "result", "missing result");
        }
        if (result.risk() == null) {
            throw new InvalidRuleException(sourceName, index, id, "result.risk", "missing risk label");
        }
        if (result.action() == null) {
            throw new InvalidRuleException(sourceName, index, id, "result.action", "missing action");
        }

        return new Rule(id, def.priority(), def.description(), conditions,
                new RuleOutcome(result.risk(), result.action()));
    }

    private Condition toCondition(RuleDefinition.ConditionDefinition cond, int index, String ruleId,
                                  int conditionIndex, String sourceName) {
        String path = "conditions[" + conditionIndex + "]";
        if (cond == null) {
            throw new InvalidRuleException(sourceName, index, ruleId, path, "condition is null");
        }
        if (cond.field() == null || cond.field().isBlank()) {
            throw new InvalidRuleException(sourceName, index, ruleId, path + ".field", "missing field");
        }
        if (cond.operator() == null) {
            throw new InvalidRuleException(sourceName, index, ruleId, path + ".operator", "missing operator");
        }
        Operator operator = Operator.fromSymbol(cond.operator());
        if (operator == null) {
            throw new InvalidRuleException(sourceName, index, ruleId, path + ".operator",
                    "unrecognized operator '" + cond.operator() + "' (expected one of >, <, ==, !=, >=, <=)");
        }
        if (cond.value() == null) {
            throw new InvalidRuleException(sourceName, index, ruleId, path + ".value", "missing value");
        }
        ValueKind kind = ValueKind.of(cond.value());
        if (kind == null) {
            throw new InvalidRuleException(sourceName, index, ruleId, path + ".value",
                    "value must be a number or a string but was " + cond.value().getClass().getSimpleName());
        }
        if (operator.isOrdering() && kind == ValueKind.STRING) {
            logger.warning(String.format("Rule '%s' compares '%s' %s a string; this condition never holds",
                    ruleId, cond.field(), operator.symbol()));
        }
        return new Condition(cond.field(), operator, cond.value(), kind);
    }

    private static String pathOf(JsonMappingException e) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) sb.append('.');
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
