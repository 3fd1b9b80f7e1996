package org.stianloader.jarresolver;

import org.jetbrains.annotations.NotNull;

/**
 * Common supertype of the fatal errors raised by jarresolver. A caller that wants to
 * react to configuration problems differently from unresolvable dependencies should catch the
 * subclasses {@link ConfigurationException} and {@link ResolutionException} respectively.
 *
 * <p>Neither kind is retried automatically. Persisted client state is left untouched by a failing call.
 */
public abstract class ResolverException extends RuntimeException {

    private static final long serialVersionUID = -6110947409117207716L;

    protected ResolverException(@NotNull String message) {
        super(message);
    }

    protected ResolverException(@NotNull String message, Throwable cause) {
        super(message, cause);
    }
}
