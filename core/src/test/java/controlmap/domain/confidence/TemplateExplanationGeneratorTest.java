package controlmap.domain.confidence;

import controlmap.domain.retrieval.MatchCandidate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TemplateExplanationGeneratorTest {

    private final ExplanationGenerator explanationGenerator = new TemplateExplanationGenerator();

    private final MatchCandidate candidate = new MatchCandidate("policy", "CRY-05", "Encrypt data at rest", "Cryptography", 0.5678, 0);

    @Test
    void testExplain() {
        assertEquals("This clause likely aligns with control text that says: 'Encrypt data at rest'. "
                        + "The semantic similarity score is 0.57, suggesting a medium confidence match.",
                explanationGenerator.explain(candidate, ConfidenceBand.MEDIUM));
    }

    @Test
    void testFallback() {
        assertEquals("Very Low (Fallback, Sim=0.57)", explanationGenerator.fallbackLabel(candidate));
        assertEquals("No strong semantic match found, but this clause loosely relates to 'Encrypt data at rest' "
                + "with similarity 0.57.", explanationGenerator.explainFallback(candidate));
    }

    @Test
    void testScoreFormatRoundsTheBinaryValue() {
        assertEquals("0.12", ScoreFormat.format(0.125, 2));
        assertEquals("0.30", ScoreFormat.format(0.305, 2));
        assertEquals("0.80", ScoreFormat.format(0.8, 2));
        assertEquals("0.995", ScoreFormat.format(0.9949999, 3));
        assertEquals("-0.05", ScoreFormat.format(-0.05, 2));
    }
}
