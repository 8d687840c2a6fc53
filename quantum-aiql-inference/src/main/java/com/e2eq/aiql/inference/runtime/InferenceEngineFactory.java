package com.e2eq.aiql.inference.runtime;

import com.e2eq.aiql.ast.Program;
import com.e2eq.aiql.inference.InferenceEngine;
import com.e2eq.aiql.inference.InferenceSettings;
import com.e2eq.aiql.inference.InferenceSettingsLoader;
import com.e2eq.aiql.inference.spi.OntologyReasoner;
import com.e2eq.aiql.inference.spi.TrustRegistry;
import com.e2eq.aiql.parser.AiqlProgramLoader;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.Objects;

/**
 * Creates {@link InferenceEngine} instances wired with the application's settings and,
 * when the application provides them, its {@link OntologyReasoner} and {@link TrustRegistry}
 * beans. Engines are not shared; each call returns a fresh one.
 */
@ApplicationScoped
public class InferenceEngineFactory {

    private static final Logger LOG = Logger.getLogger(InferenceEngineFactory.class);

    private final AiqlProgramLoader programLoader;
    private final Instance<OntologyReasoner> ontologyReasoners;
    private final Instance<TrustRegistry> trustRegistries;
    private final String settingsLocation;

    private InferenceSettings settings;
    private OntologyReasoner ontologyReasoner;
    private TrustRegistry trustRegistry;

    // required by CDI for client proxies
    protected InferenceEngineFactory() {
        this.programLoader = null;
        this.ontologyReasoners = null;
        this.trustRegistries = null;
        this.settingsLocation = null;
    }

    @Inject
    public InferenceEngineFactory(AiqlProgramLoader programLoader,
                                  Instance<OntologyReasoner> ontologyReasoners,
                                  Instance<TrustRegistry> trustRegistries,
                                  @ConfigProperty(name = "quantum.aiql.inference.settings", defaultValue = "aiql/inference.yaml")
                                  String settingsLocation) {
        this.programLoader = programLoader;
        this.ontologyReasoners = ontologyReasoners;
        this.trustRegistries = trustRegistries;
        this.settingsLocation = settingsLocation;
    }

    /**
     * Container-free construction, mainly for tests and command line use.
     */
    public InferenceEngineFactory(AiqlProgramLoader programLoader, InferenceSettings settings,
                                  OntologyReasoner ontologyReasoner, TrustRegistry trustRegistry) {
        this.programLoader = Objects.requireNonNull(programLoader, "programLoader");
        this.ontologyReasoners = null;
        this.trustRegistries = null;
        this.settingsLocation = null;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.ontologyReasoner = Objects.requireNonNull(ontologyReasoner, "ontologyReasoner");
        this.trustRegistry = Objects.requireNonNull(trustRegistry, "trustRegistry");
    }

    @PostConstruct
    void init() {
        this.settings = loadSettings();
        this.ontologyReasoner = ontologyReasoners != null && ontologyReasoners.isResolvable()
                ? ontologyReasoners.get() : OntologyReasoner.noop();
        this.trustRegistry = trustRegistries != null && trustRegistries.isResolvable()
                ? trustRegistries.get() : TrustRegistry.noop();
        LOG.infof("Inference settings loaded from %s: maxForwardSteps=%d, maxProofDepth=%d, lieThreshold=%s",
                settingsLocation, settings.maxForwardSteps(), settings.maxProofDepth(), settings.lieThreshold());
    }

    private InferenceSettings loadSettings() {
        InferenceSettingsLoader loader = new InferenceSettingsLoader();
        try {
            return loader.loadFromClasspath(settingsLocation);
        } catch (IOException e) {
            if (Thread.currentThread().getContextClassLoader().getResource(settingsLocation) == null) {
                LOG.warnf("Inference settings %s not found, using defaults", settingsLocation);
                return InferenceSettings.defaults();
            }
            throw new IllegalStateException("Failed to load inference settings from " + settingsLocation, e);
        }
    }

    public InferenceEngine create(Program program) {
        return new InferenceEngine(program, settings, ontologyReasoner, trustRegistry, programLoader);
    }

    public InferenceEngine create(String source) {
        return create(programLoader.parse(source));
    }

    public InferenceSettings settings() {
        return settings;
    }
}
