package org.javai.result.http;

import java.util.Objects;

/**
 * An RFC 7807 problem document describing a failed result.
 *
 * @param type a URI identifying the problem type
 * @param title the error code name
 * @param status the HTTP status code
 * @param detail the error description
 */
public record ProblemDetails(String type, String title, int status, String detail) {

    public ProblemDetails {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(detail, "detail must not be null");
    }
}
