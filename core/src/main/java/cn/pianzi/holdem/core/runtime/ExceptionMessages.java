package cn.pianzi.holdem.core.runtime;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class ExceptionMessages {
    private ExceptionMessages() {
    }

    /** Message of the innermost cause, or its class name when it has none. */
    static String describe(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        if (current instanceof CompletionException || current instanceof ExecutionException) {
            return current.getClass().getSimpleName();
        }
        String message = current.getMessage();
        return message == null || message.isBlank() ? current.getClass().getSimpleName() : message;
    }
}
