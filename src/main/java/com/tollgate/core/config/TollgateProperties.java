package com.tollgate.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "tollgate")
public class TollgateProperties {

    private Runner runner = new Runner();
    private Artifacts artifacts = new Artifacts();
    private Store store = new Store();

    // -- Runner accessors (delegate to nested) --
    public int getMaxParallelGates() { return runner.maxParallelGates; }
    public Duration getDefaultTimeout() { return runner.defaultTimeout; }

    // -- Artifacts / store accessors --
    public String getArtifactsRoot() { return artifacts.root; }
    public boolean isSchemaInit() { return store.schemaInit; }

    public Runner getRunner() { return runner; }
    public void setRunner(Runner runner) { this.runner = runner; }
    public Artifacts getArtifacts() { return artifacts; }
    public void setArtifacts(Artifacts artifacts) { this.artifacts = artifacts; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public static class Runner {
        private int maxParallelGates = 4;
        private Duration defaultTimeout = Duration.ofSeconds(300);

        public int getMaxParallelGates() { return maxParallelGates; }
        public void setMaxParallelGates(int maxParallelGates) {
            if (maxParallelGates < 1) {
                throw new IllegalArgumentException("tollgate.runner.max-parallel-gates must be >= 1");
            }
            this.maxParallelGates = maxParallelGates;
        }
        public Duration getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(Duration defaultTimeout) {
            if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
                throw new IllegalArgumentException("tollgate.runner.default-timeout must be positive");
            }
            this.defaultTimeout = defaultTimeout;
        }
    }

    public static class Artifacts {
        private String root = "./artifacts";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
    }

    public static class Store {
        private boolean schemaInit = true;

        public boolean isSchemaInit() { return schemaInit; }
        public void setSchemaInit(boolean schemaInit) { this.schemaInit = schemaInit; }
    }
}
