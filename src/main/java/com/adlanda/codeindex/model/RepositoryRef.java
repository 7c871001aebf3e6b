package com.adlanda.codeindex.model;

import java.util.Objects;

/**
 * Identifies a remote repository by owner and name.
 */
public record RepositoryRef(String owner, String name) {

    public RepositoryRef {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(name, "name");
        if (owner.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("owner and name must not be blank");
        }
    }

    /**
     * Parses an "owner/name" string.
     */
    public static RepositoryRef parse(String fullName) {
        int slash = fullName.indexOf('/');
        if (slash <= 0 || slash == fullName.length() - 1) {
            throw new IllegalArgumentException("expected owner/name, got '" + fullName + "'");
        }
        return new RepositoryRef(fullName.substring(0, slash).trim(), fullName.substring(slash + 1).trim());
    }

    @Override
    public String toString() {
        return owner + "/" + name;
    }
}
