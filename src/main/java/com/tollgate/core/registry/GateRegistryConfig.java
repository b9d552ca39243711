package com.tollgate.core.registry;

import com.tollgate.core.checker.BuiltInCheckers;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the sealed {@link GateRegistry} holding the built-in checkers.
 */
@Configuration
public class GateRegistryConfig {

    @Bean
    public GateRegistry gateRegistry() {
        var registry = new GateRegistry();
        BuiltInCheckers.registerAll(registry);
        registry.seal();
        return registry;
    }
}
