package controlmap.domain.exceptions;

/**
 * Marker interface for external exceptions raised by collaborators like the embedding model or the
 * text extractor. These exceptions might be transient and may be resolved by retrying.
 */
public interface ExternalException {
}
