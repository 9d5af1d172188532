package org.javai.result.http;

import java.net.URI;
import java.util.Optional;

/**
 * A framework-neutral HTTP response: a status, a body and an optional location.
 *
 * @param status the HTTP status code
 * @param body the value of a success, a {@link ProblemDetails} for a failure, may be null
 * @param location the {@code Location} header of a created resource, may be null
 */
public record HttpResponse(int status, Object body, URI location) {

    public Optional<URI> locationHeader() {
        return Optional.ofNullable(location);
    }
}
