package org.stianloader.jarresolver;

import org.jetbrains.annotations.NotNull;

/**
 * A GAV stores the group, artifact and version of a dependency record as it is written down,
 * for example within the dependencies block of a POM or in a client dependency file.
 * The version is kept as the verbatim constraint string (e.g. "1.2+"), it is not necessarily
 * a concrete version.
 */
public final record GAV(@NotNull String group, @NotNull String artifact, @NotNull String version) {

    @Override
    @NotNull
    public String toString() {
        return this.group + ':' + this.artifact + ':' + this.version;
    }
}
