package com.contenttracker.domain.error;

/**
 * Sealed type representing identifier validation errors.
 * These are expected outcomes of parsing untrusted input, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    sealed interface IdError extends ValidationError {

        record Empty(String kind) implements IdError {
            @Override
            public String message() {
                return kind + " cannot be empty";
            }

            @Override
            public String code() {
                return "ID_EMPTY";
            }
        }

        record InvalidFormat(String kind, String value) implements IdError {
            @Override
            public String message() {
                return kind + " has an invalid format: " + value;
            }

            @Override
            public String code() {
                return "ID_INVALID_FORMAT";
            }
        }
    }
}
