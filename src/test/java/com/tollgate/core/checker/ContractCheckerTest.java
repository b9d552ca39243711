package com.tollgate.core.checker;

import com.tollgate.core.artifact.ExecutionArtifact;
import com.tollgate.core.model.GateType;
import com.tollgate.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContractCheckerTest {

    private final ContractChecker checker = new ContractChecker();

    private static final Map<String, Object> USER_SCHEMA = Map.of(
            "type", "object",
            "required", List.of("id", "email"),
            "properties", Map.of(
                    "id", Map.of("type", "integer"),
                    "email", Map.of("type", "string"),
                    "roles", Map.of("type", "array", "items", Map.of("type", "string"))));

    @SafeVarargs
    private static ThresholdConfig endpoints(Map<String, Object>... endpoints) {
        return ThresholdConfig.of(Map.of("endpoints", List.of(endpoints)));
    }

    @SafeVarargs
    private static ExecutionArtifact responses(Map<String, Object>... responses) {
        return ExecutionArtifact.of(GateType.CONTRACT, Map.of("responses", List.of(responses)));
    }

    @Test
    @DisplayName("response matching the schema passes")
    void conforming() {
        var result = checker.evaluate(
                responses(Map.of("method", "get", "path", "/users/1", "status", 200,
                        "body", Map.of("id", 1, "email", "a@b.c", "roles", List.of("admin")))),
                endpoints(Map.of("method", "GET", "path", "/users/1", "status", 200, "schema", USER_SCHEMA)));

        assertTrue(result.passed());
        assertEquals(1, result.metrics().get("endpoints_passed"));
    }

    @Test
    @DisplayName("each violation is a high issue")
    void violations() {
        var result = checker.evaluate(
                responses(Map.of("method", "GET", "path", "/users/1", "status", 500,
                        "body", Map.of("id", "one", "roles", List.of(7)))),
                endpoints(Map.of("method", "GET", "path", "/users/1", "status", 200, "schema", USER_SCHEMA)));

        assertFalse(result.passed());
        var messages = result.issues().stream().map(i -> i.message()).toList();
        assertEquals(4, messages.size(), messages.toString());
        assertTrue(messages.contains("expected status 200 but was 500"));
        assertTrue(messages.stream().anyMatch(m -> m.startsWith("$") && m.contains("email")), messages.toString());
        assertTrue(messages.stream().anyMatch(m -> m.startsWith("$.id")), messages.toString());
        assertTrue(messages.stream().anyMatch(m -> m.startsWith("$.roles[0]")), messages.toString());
        assertTrue(result.issues().stream().allMatch(i -> i.severity() == Severity.HIGH));
        assertEquals("GET /users/1", result.issues().get(0).location());
    }

    @Test
    @DisplayName("enum, minimum and additionalProperties are enforced")
    void fullKeywordSet() {
        Map<String, Object> statusSchema = Map.of(
                "type", "object",
                "additionalProperties", false,
                "properties", Map.of(
                        "state", Map.of("enum", List.of("ok")),
                        "count", Map.of("type", "integer", "minimum", 0)));

        var result = checker.evaluate(
                responses(Map.of("method", "GET", "path", "/status",
                        "body", Map.of("state", "broken", "count", -5, "leak", "x"))),
                endpoints(Map.of("method", "GET", "path", "/status", "schema", statusSchema)));

        assertFalse(result.passed());
        var messages = result.issues().stream().map(i -> i.message()).toList();
        assertEquals(3, messages.size(), messages.toString());
        assertTrue(messages.stream().anyMatch(m -> m.startsWith("$.state")), messages.toString());
        assertTrue(messages.stream().anyMatch(m -> m.startsWith("$.count")), messages.toString());
        assertTrue(messages.stream().anyMatch(m -> m.contains("leak")), messages.toString());
        assertEquals(List.of("GET /status"), result.details().get("failing_endpoints"));
    }

    @Test
    @DisplayName("an endpoint with no captured response fails")
    void missingResponse() {
        var result = checker.evaluate(responses(),
                endpoints(Map.of("method", "POST", "path", "/users", "schema", USER_SCHEMA)));

        assertFalse(result.passed());
        assertEquals("no captured response", result.issues().get(0).message());
    }

    @Test
    @DisplayName("no endpoints configured passes with a recommendation")
    void noEndpoints() {
        var result = checker.evaluate(responses(), ThresholdConfig.of(Map.of("endpoints", List.of())));

        assertTrue(result.passed());
        assertEquals(List.of("[LOW] API Contract: No endpoints configured for contract testing"),
                result.recommendations());
    }

    @Test
    @DisplayName("malformed schema names the offending key")
    void malformedSchema() {
        var bad = endpoints(Map.of("method", "GET", "path", "/x",
                "schema", Map.of("type", "object", "properties", Map.of("id", Map.of("type", "uuid")))));

        var e = assertThrows(ConfigException.class, () -> checker.evaluate(responses(), bad));
        assertTrue(e.getKey().startsWith("endpoints[0].schema"), e.getKey());
    }

    @Test
    @DisplayName("a schema that is not an object is a config error")
    void schemaNotAnObject() {
        var bad = endpoints(Map.of("method", "GET", "path", "/x", "schema", "object"));

        var e = assertThrows(ConfigException.class, () -> checker.evaluate(responses(), bad));
        assertEquals("endpoints[0].schema", e.getKey());
    }

    @Test
    @DisplayName("missing endpoints key is a config error")
    void missingEndpoints() {
        var e = assertThrows(ConfigException.class,
                () -> checker.evaluate(responses(), ThresholdConfig.of(Map.of())));
        assertEquals("endpoints", e.getKey());
    }
}
