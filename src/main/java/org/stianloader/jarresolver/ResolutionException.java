package org.stianloader.jarresolver;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown if no consistent set of artifacts could be computed or deployed.
 * This includes dependencies for which no installed version exists, version conflicts
 * that cannot be reconciled and artifacts that disappeared between resolution and deployment.
 */
public class ResolutionException extends ResolverException {

    private static final long serialVersionUID = -4324467165318810482L;

    public ResolutionException(@NotNull String message) {
        super(message);
    }

    public ResolutionException(@NotNull String message, Throwable cause) {
        super(message, cause);
    }
}
