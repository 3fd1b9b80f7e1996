package org.stianloader.jarresolver;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown if the environment is not set up in a way that allows a repository to be located,
 * for example if a repository path refers to the SDK but no SDK path is known.
 * The message is suitable to be shown to the user verbatim.
 */
public class ConfigurationException extends ResolverException {

    private static final long serialVersionUID = 2969131573505337201L;

    public ConfigurationException(@NotNull String message) {
        super(message);
    }
}
