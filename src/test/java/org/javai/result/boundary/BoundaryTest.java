package org.javai.result.boundary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.javai.result.Error;
import org.javai.result.NotFoundError;
import org.javai.result.Result;
import org.javai.result.UnhandledExceptionError;
import org.javai.result.ValidationError;
import org.javai.result.ops.ErrorReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BoundaryTest {

    private Boundary boundary;
    private List<String> reported;

    @BeforeEach
    void setUp() {
        reported = new ArrayList<>();
        ErrorReporter reporter = (operation, error, cause) -> reported.add(operation + " -> " + error);
        boundary = Boundary.withReporter(reporter);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void call_success_returnsSuccess() {
        Result<String> result = boundary.call("TestOp", () -> "success");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOrThrow()).isEqualTo("success");
        assertThat(reported).isEmpty();
    }

    @Test
    void call_checkedException_returnsClassifiedFailure() {
        Result<String> result = boundary.call("TestOp", () -> {
            throw new IOException("disk error");
        });

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).isInstanceOf(UnhandledExceptionError.class);
        assertThat(result.error().getDescription()).isEqualTo("IOException: disk error");
        assertThat(reported).containsExactly("TestOp -> UnhandledExceptionError: IOException: disk error");
    }

    @Test
    void call_fileNotFound_isNotFoundError() {
        Result<String> result = boundary.call("Config.read", () -> {
            throw new FileNotFoundException("app.yml");
        });

        assertThat(result.error()).isInstanceOf(NotFoundError.class);
        assertThat(result.error().getDescription()).isEqualTo("Config.read: file not found: app.yml");
    }

    @Test
    void call_runtimeException_propagates() {
        assertThatThrownBy(() -> boundary.call("TestOp", () -> {
            throw new IllegalArgumentException("bad arg");
        }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad arg");

        assertThat(reported).isEmpty();
    }

    @Test
    void call_interrupted_restoresInterruptFlag() {
        Result<String> result = boundary.call("TestOp", () -> {
            throw new InterruptedException("stop");
        });

        assertThat(result.isFailure()).isTrue();
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void call_customClassifier_isUsed() {
        Boundary custom = Boundary.of((operation, e) -> Error.validation(operation + " rejected"), ErrorReporter.noOp());

        Result<Integer> result = custom.call("Parse", () -> {
            throw new IOException("malformed");
        });

        assertThat(result.error()).isInstanceOf(ValidationError.class);
        assertThat(result.error().getDescription()).isEqualTo("Parse rejected");
    }

    @Test
    void silent_failure_isNotReported() {
        Result<String> result = Boundary.silent().call("TestOp", () -> {
            throw new IOException("ignored");
        });

        assertThat(result.isFailure()).isTrue();
        assertThat(reported).isEmpty();
    }
}
