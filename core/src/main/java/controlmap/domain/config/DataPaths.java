package controlmap.domain.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;

/**
 * The locations of the record tables, their vector stores, and the files written by the pipelines.
 */
@ApplicationScoped
public class DataPaths {
    @Inject
    @ConfigProperty(name = "cm.data.controls", defaultValue = "data/scf_controls.csv")
    private String controls;

    @Inject
    @ConfigProperty(name = "cm.data.controlvectors", defaultValue = "data/embeddings/scf_controls.vec")
    private String controlVectors;

    @Inject
    @ConfigProperty(name = "cm.data.requirements", defaultValue = "data/erl_requirements.csv")
    private String requirements;

    @Inject
    @ConfigProperty(name = "cm.data.requirementvectors", defaultValue = "data/embeddings/erl_requirements.vec")
    private String requirementVectors;

    @Inject
    @ConfigProperty(name = "cm.data.clauses", defaultValue = "data/processed/policy_clauses.csv")
    private String clauses;

    @Inject
    @ConfigProperty(name = "cm.data.clausevectors", defaultValue = "data/embeddings/policy_clauses.vec")
    private String clauseVectors;

    @Inject
    @ConfigProperty(name = "cm.output.mappings", defaultValue = "output/mapping_results.json")
    private String mappings;

    @Inject
    @ConfigProperty(name = "cm.evidence.registry", defaultValue = "data/processed/evidence_registry.jsonl")
    private String evidenceRegistry;

    @Inject
    @ConfigProperty(name = "cm.evidence.artifacts", defaultValue = "data/evidence_artifacts")
    private String evidenceArtifacts;

    public Path getControls() {
        return Path.of(controls);
    }

    public Path getControlVectors() {
        return Path.of(controlVectors);
    }

    public Path getRequirements() {
        return Path.of(requirements);
    }

    public Path getRequirementVectors() {
        return Path.of(requirementVectors);
    }

    public Path getClauses() {
        return Path.of(clauses);
    }

    public Path getClauseVectors() {
        return Path.of(clauseVectors);
    }

    public Path getMappings() {
        return Path.of(mappings);
    }

    public Path getEvidenceRegistry() {
        return Path.of(evidenceRegistry);
    }

    public Path getEvidenceArtifacts() {
        return Path.of(evidenceArtifacts);
    }
}
