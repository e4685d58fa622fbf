package controlmap.domain.confidence;

/**
 * Maps a similarity score to a confidence band.
 */
public interface ConfidenceClassifier {
    ConfidenceBand classify(double score);
}
