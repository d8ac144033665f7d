/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

/**
 * Field repetition types in a schema.
 */
public enum RepetitionType {
    REQUIRED(0), // Field must be present
    OPTIONAL(1), // Field may be null
    REPEATED(2); // Field can appear zero or more times

    private final int id;

    RepetitionType(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public static RepetitionType fromId(int value) {
        for (RepetitionType type : values()) {
            if (type.id == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown repetition type: " + value);
    }
}
