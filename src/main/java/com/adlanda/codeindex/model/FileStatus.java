package com.adlanda.codeindex.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Index state of one path in a repository tree.
 */
public record FileStatus(String path, Status status) {

    public enum Status {
        INDEXED("indexed"),
        NOT_INDEXED("not-indexed");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}
