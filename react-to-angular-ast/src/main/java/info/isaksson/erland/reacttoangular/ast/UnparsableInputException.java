package info.isaksson.erland.reacttoangular.ast;

import java.io.IOException;

/**
 * The input could not be read as a syntax tree: malformed JSON, or a root without a {@code type}
 * discriminator. Fatal for that input; no artifacts are produced from it.
 */
public class UnparsableInputException extends IOException {

    private static final long serialVersionUID = 1L;

    public UnparsableInputException(String message) {
        super(message);
    }

    public UnparsableInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
