package com.tollgate.core.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SchemaId;
import com.networknt.schema.SchemaLocation;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.tollgate.core.artifact.ExecutionArtifact;
import com.tollgate.core.model.GateIssue;
import com.tollgate.core.model.GateResult;
import com.tollgate.core.model.GateType;
import com.tollgate.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Captured API responses against the endpoint schemas declared in {@code endpoints}.
 * Schemas are JSON Schema draft-07 and are checked against the draft-07 meta-schema
 * before any response is looked at. Every violation is a {@link Severity#HIGH}
 * issue; the gate passes iff there are none.
 */
public class ContractChecker implements GateChecker {

    private static final int MAX_ENDPOINTS_LISTED = 5;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMAS = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private static final JsonSchema META_SCHEMA = SCHEMAS.getSchema(SchemaLocation.of(SchemaId.V7));

    private record Endpoint(String key, String method, String path, Integer status, JsonSchema schema) {
        String label() {
            return method + " " + path;
        }
    }

    @Override
    public GateType gateType() {
        return GateType.CONTRACT;
    }

    @Override
    public GateResult evaluate(ExecutionArtifact artifact, ThresholdConfig thresholds) {
        List<Endpoint> endpoints = endpoints(thresholds.requireList("endpoints"));
        var responses = artifact.objectList("responses");

        var issues = new ArrayList<GateIssue>();
        var failing = new ArrayList<String>();
        for (Endpoint endpoint : endpoints) {
            var response = findResponse(responses, endpoint);
            var violations = new ArrayList<String>();
            if (response == null) {
                violations.add("no captured response");
            } else {
                Integer actualStatus = ExecutionArtifact.optionalInt(response, "status");
                if (endpoint.status() != null && !endpoint.status().equals(actualStatus)) {
                    violations.add("expected status " + endpoint.status() + " but was " + actualStatus);
                }
                violations.addAll(validate(endpoint, response.get("body")));
            }
            for (String violation : violations) {
                issues.add(new GateIssue(Severity.HIGH, violation, endpoint.label()));
            }
            if (!violations.isEmpty()) {
                failing.add(endpoint.label());
            }
        }

        var recommendations = new ArrayList<String>();
        if (endpoints.isEmpty()) {
            recommendations.add(Recommendations.of(Severity.LOW, "API Contract",
                    "No endpoints configured for contract testing"));
        } else if (!failing.isEmpty()) {
            var shown = failing.subList(0, Math.min(MAX_ENDPOINTS_LISTED, failing.size()));
            String suffix = failing.size() > MAX_ENDPOINTS_LISTED
                    ? " and " + (failing.size() - MAX_ENDPOINTS_LISTED) + " more" : "";
            recommendations.add(Recommendations.of(Severity.HIGH, "API Contract",
                    "Fix failing endpoints: " + String.join(", ", shown) + suffix));
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("endpoints_tested", endpoints.size());
        metrics.put("endpoints_passed", endpoints.size() - failing.size());
        metrics.put("violations", issues.size());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failing_endpoints", failing);

        return new GateResult(issues.isEmpty(), false, issues, metrics, recommendations, details);
    }

    private static List<Endpoint> endpoints(List<?> raw) {
        var endpoints = new ArrayList<Endpoint>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String key = "endpoints[" + i + "]";
            if (!(raw.get(i) instanceof Map<?, ?> entry)) {
                throw new ConfigException(key, "must be an object");
            }
            if (!(entry.get("method") instanceof String method) || method.isBlank()) {
                throw new ConfigException(key + ".method", "required string is missing");
            }
            if (!(entry.get("path") instanceof String path) || path.isBlank()) {
                throw new ConfigException(key + ".path", "required string is missing");
            }
            Object status = entry.get("status");
            if (status != null && !(status instanceof Number)) {
                throw new ConfigException(key + ".status", "expected a number but was " + ThresholdConfig.describe(status));
            }
            Object schema = entry.get("schema");
            if (schema == null) {
                throw new ConfigException(key + ".schema", "required key is missing");
            }
            endpoints.add(new Endpoint(key + ".schema", method.toUpperCase(), path,
                    status == null ? null : ((Number) status).intValue(), compile(schema, key + ".schema")));
        }
        return endpoints;
    }

    /**
     * Compiles one endpoint schema. A schema the meta-schema rejects is reported with
     * {@code key} extended by the offending location, e.g.
     * {@code endpoints[1].schema.properties.id.type}.
     */
    private static JsonSchema compile(Object schema, String key) {
        if (!(schema instanceof Map<?, ?>)) {
            throw new ConfigException(key, "schema must be an object but was " + ThresholdConfig.describe(schema));
        }
        JsonNode node = MAPPER.valueToTree(schema);
        Set<ValidationMessage> problems = META_SCHEMA.validate(node);
        if (!problems.isEmpty()) {
            ValidationMessage first = problems.iterator().next();
            String location = String.valueOf(first.getInstanceLocation());
            String suffix = location.startsWith("$") ? location.substring(1) : "";
            throw new ConfigException(key + suffix, "invalid JSON schema: " + first.getMessage());
        }
        try {
            return SCHEMAS.getSchema(node);
        } catch (JsonSchemaException e) {
            throw new ConfigException(key, "invalid JSON schema: " + e.getMessage());
        }
    }

    private static List<String> validate(Endpoint endpoint, Object body) {
        JsonNode value = body == null ? NullNode.getInstance() : MAPPER.valueToTree(body);
        try {
            return endpoint.schema().validate(value).stream()
                    .map(ValidationMessage::getMessage)
                    .toList();
        } catch (JsonSchemaException e) {
            throw new ConfigException(endpoint.key(), "schema cannot be applied: " + e.getMessage());
        }
    }

    private static Map<String, Object> findResponse(List<Map<String, Object>> responses, Endpoint endpoint) {
        for (int i = 0; i < responses.size(); i++) {
            var response = responses.get(i);
            String path = "responses[" + i + "]";
            if (endpoint.method().equalsIgnoreCase(ExecutionArtifact.string(response, "method", path))
                    && endpoint.path().equals(ExecutionArtifact.string(response, "path", path))) {
                return response;
            }
        }
        return null;
    }
}
