package com.tollgate.core.artifact;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.core.config.TollgateProperties;
import com.tollgate.core.model.EvaluationTarget;
import com.tollgate.core.model.GateEnvironmentException;
import com.tollgate.core.model.GateType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads evidence bundles written by the build sandbox, laid out as
 * {@code <root>/<workspace>/<project>/<kind>-<targetId>/<gate_type>.json}.
 */
@Component
public class FileSystemArtifactProvider implements ArtifactProvider {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactProvider.class);

    private final Path root;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileSystemArtifactProvider(TollgateProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getArtifactsRoot()), objectMapper);
    }

    public FileSystemArtifactProvider(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    @Override
    public ExecutionArtifact getArtifact(EvaluationTarget target, GateType gateType) {
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new GateEnvironmentException("Artifact root not readable: " + root.toAbsolutePath());
        }
        Path file = resolve(target, gateType);
        if (!Files.isRegularFile(file)) {
            throw new ArtifactFormatException("No " + gateType.value() + " evidence for " + target + " (expected " + file + ")");
        }
        try {
            Map<String, Object> evidence = objectMapper.readValue(file.toFile(), new TypeReference<>() {});
            log.debug("Loaded {} evidence for {} from {}", gateType.value(), target, file);
            return ExecutionArtifact.of(gateType, evidence);
        } catch (IOException e) {
            throw new ArtifactFormatException("Unreadable " + gateType.value() + " evidence at " + file + ": " + e.getMessage(), e);
        }
    }

    Path resolve(EvaluationTarget target, GateType gateType) {
        return root.resolve(target.workspaceId())
                .resolve(target.projectId())
                .resolve(target.kind().value() + "-" + target.targetId())
                .resolve(gateType.value() + ".json");
    }
}
