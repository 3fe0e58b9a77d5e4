package br.edu.ifba.kgrag.storage.impl;

import org.jboss.logging.Logger;

import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.storage.VectorStorage;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * CDI producer for the in-memory stores, active when
 * {@code kgrag.storage.backend=memory}. Nothing survives a restart.
 */
@ApplicationScoped
@IfBuildProperty(name = "kgrag.storage.backend", stringValue = "memory")
public class InMemoryStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);

    private InMemoryGraphStorage graphStorage;
    private InMemoryVectorStorage vectorStorage;

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "kgrag.storage.backend", stringValue = "memory")
    public GraphStorage produceGraphStorage() {
        if (graphStorage == null) {
            graphStorage = new InMemoryGraphStorage();
            graphStorage.initialize().join();
            LOG.warn("Using in-memory graph storage; data is lost on shutdown");
        }
        return graphStorage;
    }

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "kgrag.storage.backend", stringValue = "memory")
    public VectorStorage produceVectorStorage() {
        if (vectorStorage == null) {
            vectorStorage = new InMemoryVectorStorage();
            vectorStorage.initialize().join();
        }
        return vectorStorage;
    }

    @PreDestroy
    void shutdown() {
        if (graphStorage != null) {
            graphStorage.close();
        }
        if (vectorStorage != null) {
            vectorStorage.close();
        }
    }
}
