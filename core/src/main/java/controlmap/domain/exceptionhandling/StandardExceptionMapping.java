package controlmap.domain.exceptionhandling;

import controlmap.domain.exceptions.ExternalException;
import controlmap.domain.exceptions.ExternalFailure;
import controlmap.domain.exceptions.InternalException;
import controlmap.domain.exceptions.InternalFailure;
import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Predicates.instanceOf;

/**
 * Maps all exceptions to either an InternalException or an ExternalException.
 * Exceptions that already carry one of the marker interfaces pass through unchanged, so callers can still
 * match on the specific type (e.g. SchemaError or EmbeddingGenerationFailed).
 * Everything else is wrapped in an InternalFailure.
 */
@ApplicationScoped
public class StandardExceptionMapping implements ExceptionMapping {
    @Override
    public <T> Try<T> map(final Try<T> tryObject) {
        checkNotNull(tryObject);

        return tryObject.mapFailure(
                API.Case(API.$(instanceOf(InternalException.class)), throwable -> throwable),
                API.Case(API.$(instanceOf(ExternalException.class)), throwable -> throwable),
                API.Case(API.$(), throwable -> new InternalFailure(throwable)));
    }
}
