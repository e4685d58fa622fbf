package controlmap.domain.exceptions;

/**
 * Marker interface for internal exceptions. Usually this means missing inputs, a malformed table or a
 * configuration error. These exceptions typically can not be resolved by retrying.
 */
public interface InternalException {
}
