package com.upgradedoctor.infra;

import com.upgradedoctor.check.CheckRegistry;
import com.upgradedoctor.checks.components.CodeFlareRemovalCheck;
import com.upgradedoctor.checks.components.KueueManagedRemovalCheck;
import com.upgradedoctor.checks.services.ServiceMeshRemovalCheck;
import com.upgradedoctor.checks.workloads.LlamaStackConfigCheck;
import com.upgradedoctor.checks.workloads.NotebookAcceleratorMigrationCheck;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition root of the check catalogue. Every shipped check is registered here, explicitly;
 * a duplicate ID fails application startup.
 */
@Factory
public class CheckRegistryFactory {

    private static final Logger log = LoggerFactory.getLogger(CheckRegistryFactory.class);

    @Singleton
    public CheckRegistry checkRegistry(CodeFlareRemovalCheck codeFlareRemoval,
                                       KueueManagedRemovalCheck kueueManagedRemoval,
                                       ServiceMeshRemovalCheck serviceMeshRemoval,
                                       LlamaStackConfigCheck llamaStackConfig,
                                       NotebookAcceleratorMigrationCheck notebookAcceleratorMigration) {
        CheckRegistry registry = new CheckRegistry();

        // Services
        registry.mustRegister(serviceMeshRemoval);

        // Components
        registry.mustRegister(codeFlareRemoval);
        registry.mustRegister(kueueManagedRemoval);

        // Workloads
        registry.mustRegister(llamaStackConfig);
        registry.mustRegister(notebookAcceleratorMigration);

        log.info("Check registry initialized with {} checks", registry.size());
        return registry;
    }
}
