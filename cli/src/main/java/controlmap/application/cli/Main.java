package controlmap.application.cli;

import controlmap.Marker;
import controlmap.domain.config.EvidenceConfig;
import controlmap.domain.evidenceprocessing.EvidenceProcessingPipeline;
import controlmap.domain.evidenceprocessing.EvidenceProcessingResult;
import controlmap.domain.exceptionhandling.ExceptionHandler;
import controlmap.domain.json.JsonDeserializer;
import controlmap.domain.logging.LogConfig;
import controlmap.domain.mapping.ClauseMappingPipeline;
import controlmap.domain.policy.PolicyPreprocessor;
import controlmap.domain.registry.EvidenceRegistry;
import io.vavr.control.Try;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;

import java.nio.file.Path;

public class Main {
    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  map                                   Map the clause table to controls",
            "  preprocess <policy file>              Split a policy document into the clause table",
            "  validate <evidence file> <control id> [threshold]",
            "                                        Validate evidence and record it in the registry",
            "  evidence <control id>                 List the registered evidence for a control",
            "  summary                               Summarize the evidence registry");

    @Inject
    private ClauseMappingPipeline clauseMappingPipeline;

    @Inject
    private PolicyPreprocessor policyPreprocessor;

    @Inject
    private EvidenceProcessingPipeline evidenceProcessingPipeline;

    @Inject
    private EvidenceRegistry evidenceRegistry;

    @Inject
    private EvidenceConfig evidenceConfig;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private ExceptionHandler exceptionHandler;

    public static void main(final String[] args) {
        LogConfig.init();

        final Weld weld = new Weld();
        /*
        The marker class sits in the root package shared by every module, so a recursive scan from it finds the
        beans in the core and service jars as well as this one, including Main itself.
         */
        final int exitCode;
        try (WeldContainer weldContainer = weld.addPackages(true, Marker.class).initialize()) {
            exitCode = weldContainer.select(Main.class).get().entry(args);
        }

        System.exit(exitCode);
    }

    public int entry(final String[] args) {
        if (args.length == 0) {
            System.err.println(USAGE);
            return 1;
        }

        return Try.of(() -> runCommand(args))
                .onFailure(e -> System.err.println("Failed to run " + args[0] + ": " + exceptionHandler.getExceptionMessage(e)))
                .getOrElse(1);
    }

    private int runCommand(final String[] args) {
        switch (args[0]) {
            case "map" -> {
                System.out.println(jsonDeserializer.serialize(clauseMappingPipeline.run()));
                return 0;
            }
            case "preprocess" -> {
                requireArguments(args, 2);
                System.out.println(jsonDeserializer.serialize(policyPreprocessor.preprocess(Path.of(args[1]))));
                return 0;
            }
            case "validate" -> {
                requireArguments(args, 3);
                final double threshold = args.length > 3
                        ? NumberUtils.toDouble(args[3], evidenceConfig.getThreshold())
                        : evidenceConfig.getThreshold();
                final EvidenceProcessingResult result = evidenceProcessingPipeline.process(Path.of(args[1]), args[2], threshold);
                evidenceRegistry.register(result, threshold);
                System.out.println(jsonDeserializer.serialize(result));
                return result.success() ? 0 : 1;
            }
            case "evidence" -> {
                requireArguments(args, 2);
                System.out.println(jsonDeserializer.serialize(evidenceRegistry.findByControlId(args[1])));
                return 0;
            }
            case "summary" -> {
                System.out.println(jsonDeserializer.serialize(evidenceRegistry.summary()));
                return 0;
            }
            default -> {
                System.err.println(USAGE);
                return 1;
            }
        }
    }

    private void requireArguments(final String[] args, final int count) {
        if (args.length < count) {
            throw new IllegalArgumentException("Expected " + (count - 1) + " argument(s)" + System.lineSeparator() + USAGE);
        }
    }
}
