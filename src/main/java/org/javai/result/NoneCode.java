package org.javai.result;

/**
 * Code of the {@link Result#NONE} sentinel. Never attached to a real error.
 */
final class NoneCode extends ErrorCode {

    static final NoneCode INSTANCE = new NoneCode();

    private NoneCode() {
        super("None");
    }
}
