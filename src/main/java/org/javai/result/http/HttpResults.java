package org.javai.result.http;

import java.net.URI;
import java.util.Objects;
import java.util.function.Function;
import org.javai.result.ConflictError;
import org.javai.result.Error;
import org.javai.result.NotFoundError;
import org.javai.result.Result;
import org.javai.result.UnauthorizedError;
import org.javai.result.ValidationError;

/**
 * Maps results onto HTTP responses.
 *
 * <p>A success becomes a {@code 200 OK} carrying the value. A failure becomes a problem
 * document whose status follows the error variant:
 * <ul>
 *   <li>{@link NotFoundError} → 404</li>
 *   <li>{@link ValidationError} → 400</li>
 *   <li>{@link ConflictError} → 409</li>
 *   <li>{@link UnauthorizedError} → 401</li>
 *   <li>any other error → 400</li>
 * </ul>
 */
public final class HttpResults {

    public static final int OK = 200;
    public static final int CREATED = 201;
    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;

    static final String PROBLEM_TYPE_BASE = "https://httpstatuses.com/";

    private HttpResults() {
    }

    public static <T> HttpResponse toResponse(Result<T> result) {
        Objects.requireNonNull(result, "result must not be null");
        return result.match(
                value -> new HttpResponse(OK, value, null),
                HttpResults::problemResponse);
    }

    /**
     * Maps a success to {@code 201 Created} with the location computed from its value.
     */
    public static <T> HttpResponse toCreatedResponse(Result<T> result, Function<? super T, URI> location) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(location, "location must not be null");
        return result.match(
                value -> new HttpResponse(CREATED, value, location.apply(value)),
                HttpResults::problemResponse);
    }

    public static <T> HttpResponse toCreatedResponse(Result<T> result, URI location) {
        Objects.requireNonNull(location, "location must not be null");
        return toCreatedResponse(result, value -> location);
    }

    public static ProblemDetails toProblem(Error error) {
        Objects.requireNonNull(error, "error must not be null");
        int status = statusFor(error);
        return new ProblemDetails(
                PROBLEM_TYPE_BASE + status,
                error.getCode().name(),
                status,
                error.getDescription());
    }

    public static int statusFor(Error error) {
        if (error instanceof NotFoundError) {
            return NOT_FOUND;
        }
        if (error instanceof ConflictError) {
            return CONFLICT;
        }
        if (error instanceof UnauthorizedError) {
            return UNAUTHORIZED;
        }
        // validation and everything unrecognized
        return BAD_REQUEST;
    }

    private static HttpResponse problemResponse(Error error) {
        ProblemDetails problem = toProblem(error);
        return new HttpResponse(problem.status(), problem, null);
    }
}
