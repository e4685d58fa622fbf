package controlmap.domain.policy.impl;

import controlmap.domain.clause.SimpleClauseSplitter;
import controlmap.domain.config.DataPaths;
import controlmap.domain.converter.FileToTextContext;
import controlmap.domain.converter.PlainTextExtractor;
import controlmap.domain.converter.TikaTextExtractor;
import controlmap.domain.corpus.PolicyClause;
import controlmap.domain.exceptions.NotFound;
import controlmap.domain.logger.Loggers;
import controlmap.domain.policy.PolicyPreprocessor;
import controlmap.domain.tables.CorpusTables;
import controlmap.domain.tables.CsvTableReader;
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

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(PolicyPreprocessorImpl.class)
@AddBeanClasses(FileToTextContext.class)
@AddBeanClasses(PlainTextExtractor.class)
@AddBeanClasses(TikaTextExtractor.class)
@AddBeanClasses(SimpleClauseSplitter.class)
@AddBeanClasses(CorpusTables.class)
@AddBeanClasses(CsvTableReader.class)
@AddBeanClasses(DataPaths.class)
@AddBeanClasses(Loggers.class)
class PolicyPreprocessorImplTest {

    @Inject
    private PolicyPreprocessor policyPreprocessor;

    @Inject
    private CorpusTables corpusTables;

    @TempDir
    Path tempDir;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of("cm.data.clauses", tempDir.resolve("processed/clauses.csv").toString()),
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

    @Test
    void testPreprocess() throws Exception {
        final Path policy = tempDir.resolve("access_policy.txt");
        Files.writeString(policy, """
                Access Control Policy

                1. All users must authenticate with multi-factor authentication.
                2. Access rights are reviewed every quarter, by system owners.
                """);

        final List<PolicyClause> clauses = policyPreprocessor.preprocess(policy);

        assertEquals(List.of(
                new PolicyClause("access_policy", 1, "Access Control Policy"),
                new PolicyClause("access_policy", 2, "All users must authenticate with multi-factor authentication."),
                new PolicyClause("access_policy", 3, "Access rights are reviewed every quarter, by system owners.")), clauses);
        assertEquals(clauses, corpusTables.readClauses(tempDir.resolve("processed/clauses.csv")));
    }

    @Test
    void testMissingDocument() {
        assertThrows(NotFound.class, () -> policyPreprocessor.preprocess(tempDir.resolve("missing.pdf")));
    }
}
