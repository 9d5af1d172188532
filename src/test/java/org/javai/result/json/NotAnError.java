package org.javai.result.json;

public final class NotAnError {

    public NotAnError(String description) {
    }
}
