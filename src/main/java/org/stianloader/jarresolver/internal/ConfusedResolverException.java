package org.stianloader.jarresolver.internal;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown if a file within a repository does not follow the layout jarresolver expects,
 * for example if a maven-metadata.xml does not list any versions.
 */
public class ConfusedResolverException extends RuntimeException {

    private static final long serialVersionUID = 8151468431744212154L;

    public ConfusedResolverException(@NotNull String message) {
        super(message);
    }
}
