package controlmap.domain.mapping.impl;

import controlmap.domain.alignment.EmbeddingAlignmentManagerImpl;
import controlmap.domain.confidence.TemplateExplanationGenerator;
import controlmap.domain.confidence.ThresholdConfidenceClassifier;
import controlmap.domain.config.ConfidenceConfig;
import controlmap.domain.config.DataPaths;
import controlmap.domain.config.EmbeddingConfig;
import controlmap.domain.config.MappingConfig;
import controlmap.domain.config.MergeConfig;
import controlmap.domain.embedding.FakeEmbeddingModel;
import controlmap.domain.exceptionhandling.LoggingExceptionHandler;
import controlmap.domain.exceptions.SchemaError;
import controlmap.domain.json.JsonDeserializer;
import controlmap.domain.json.JsonDeserializerJackson;
import controlmap.domain.logger.Loggers;
import controlmap.domain.mapping.ClauseMappingPipeline;
import controlmap.domain.mapping.MappingExplanation;
import controlmap.domain.mapping.MappingResult;
import controlmap.domain.merge.MergeEngineImpl;
import controlmap.domain.merge.RatcliffObershelpSimilarity;
import controlmap.domain.persist.FileVectorStore;
import controlmap.domain.retrieval.CandidateRetrieverImpl;
import controlmap.domain.tables.CorpusTables;
import controlmap.domain.tables.CsvTableReader;
import controlmap.domain.vector.Vector;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(ClauseMappingPipelineImpl.class)
@AddBeanClasses(DataPaths.class)
@AddBeanClasses(MappingConfig.class)
@AddBeanClasses(CorpusTables.class)
@AddBeanClasses(CsvTableReader.class)
@AddBeanClasses(EmbeddingAlignmentManagerImpl.class)
@AddBeanClasses(FileVectorStore.class)
@AddBeanClasses(FakeEmbeddingModel.class)
@AddBeanClasses(EmbeddingConfig.class)
@AddBeanClasses(CandidateRetrieverImpl.class)
@AddBeanClasses(MergeEngineImpl.class)
@AddBeanClasses(MergeConfig.class)
@AddBeanClasses(RatcliffObershelpSimilarity.class)
@AddBeanClasses(ThresholdConfidenceClassifier.class)
@AddBeanClasses(ConfidenceConfig.class)
@AddBeanClasses(TemplateExplanationGenerator.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
class ClauseMappingPipelineImplTest {

    private static final String ENCRYPTION_CLAUSE = "All laptops must use full disk encryption.";
    private static final String MFA_CLAUSE = "Users sign in with a second factor.";
    private static final String UNRELATED_CLAUSE = "The cafeteria opens at nine every weekday.";

    @Inject
    private ClauseMappingPipeline clauseMappingPipeline;

    @Inject
    private FakeEmbeddingModel embeddingModel;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of(
                        "cm.data.controls", tempDir.resolve("controls.csv").toString(),
                        "cm.data.controlvectors", tempDir.resolve("embeddings/controls.vec").toString(),
                        "cm.data.clauses", tempDir.resolve("clauses.csv").toString(),
                        "cm.data.clausevectors", tempDir.resolve("embeddings/clauses.vec").toString(),
                        "cm.output.mappings", tempDir.resolve("output/mapping_results.json").toString()),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    private void writeControls() throws Exception {
        Files.writeString(tempDir.resolve("controls.csv"), """
                scf_id,domain,control_title,text
                CRY-05,Cryptographic Protections,Encrypting Data At Rest,Encrypt data at rest
                IAC-06,Identification & Authentication,Multi Factor Authentication,Enforce multi factor authentication
                MON-01,Continuous Monitoring,Logging,Log access events
                """);

        embeddingModel.register("Encrypt data at rest", new Vector(1f, 0f, 0f, 0f));
        embeddingModel.register("Enforce multi factor authentication", new Vector(0f, 1f, 0f, 0f));
        embeddingModel.register("Log access events", new Vector(0f, 0f, 1f, 0f));
    }

    @Test
    void testMapClauses() throws Exception {
        writeControls();
        Files.writeString(tempDir.resolve("clauses.csv"), String.join("\n",
                "policy_id,clause_index,clause_text",
                "access_policy,1," + ENCRYPTION_CLAUSE,
                "access_policy,2," + MFA_CLAUSE,
                "access_policy,3," + ENCRYPTION_CLAUSE,
                "access_policy,4," + UNRELATED_CLAUSE,
                ""));

        embeddingModel.register(ENCRYPTION_CLAUSE, new Vector(1f, 0f, 0f, 0.2f));
        embeddingModel.register(MFA_CLAUSE, new Vector(0f, 0.6f, 0f, 0.8f));
        embeddingModel.register(UNRELATED_CLAUSE, new Vector(0.3f, 0f, 0f, 1f));

        final List<MappingResult> results = clauseMappingPipeline.run();

        // the repeated encryption clause is dropped and the rest are renumbered
        assertEquals(List.of(0, 1, 2), results.stream().map(MappingResult::queryIndex).toList());
        assertTrue(results.stream().allMatch(result -> result.queryId().equals("access_policy")));

        final MappingExplanation encryption = results.get(0).explanations().get(0);
        assertEquals(1, results.get(0).explanations().size());
        assertEquals("CRY-05", encryption.matchedId());
        assertEquals("Cryptographic Protections", encryption.matchedCategory());
        assertEquals("High Confidence", encryption.confidence());

        final MappingExplanation mfa = results.get(1).explanations().get(0);
        assertEquals("IAC-06", mfa.matchedId());
        assertEquals("Medium Confidence", mfa.confidence());
        assertEquals("This clause likely aligns with control text that says: 'Enforce multi factor authentication'. "
                + "The semantic similarity score is 0.60, suggesting a medium confidence match.", mfa.explanation());

        final MappingExplanation fallback = results.get(2).explanations().get(0);
        assertEquals(1, results.get(2).explanations().size());
        assertEquals("CRY-05", fallback.matchedId());
        assertEquals("Very Low (Fallback, Sim=0.29)", fallback.confidence());

        final Path output = tempDir.resolve("output/mapping_results.json");
        final String json = Files.readString(output);
        assertTrue(json.contains("\"query_id\":\"access_policy\""));
        assertTrue(json.contains("\"mapping_explanations\""));
        assertEquals(results, jsonDeserializer.deserializeCollection(json, MappingResult.class));
    }

    @Test
    void testVectorsAreAlignedWithDeduplicatedClauses() throws Exception {
        writeControls();
        Files.writeString(tempDir.resolve("clauses.csv"), String.join("\n",
                "clause_text",
                ENCRYPTION_CLAUSE,
                ENCRYPTION_CLAUSE,
                MFA_CLAUSE,
                ""));

        clauseMappingPipeline.run();

        // three controls and two distinct clauses
        assertEquals(5, embeddingModel.getEmbeddedTexts().size());

        // a second run trusts both stores
        clauseMappingPipeline.run();
        assertEquals(5, embeddingModel.getEmbeddedTexts().size());
    }

    @Test
    void testMissingClauseColumn() throws Exception {
        writeControls();
        Files.writeString(tempDir.resolve("clauses.csv"), "policy_id,text\naccess_policy," + MFA_CLAUSE + "\n");

        assertThrows(SchemaError.class, () -> clauseMappingPipeline.run());
    }
}
