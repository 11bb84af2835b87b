package dev.newsroom.exception;

import lombok.Getter;

import java.util.Set;

/**
 * Single exception type for the admin article workflows. The {@link ErrorKind} decides the
 * HTTP status; the original failure, when there is one, is kept as the cause.
 */
@Getter
public class ArticleWorkflowException extends RuntimeException {

    private final ErrorKind kind;

    public ArticleWorkflowException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ArticleWorkflowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ArticleWorkflowException unauthorized(String message) {
        return new ArticleWorkflowException(ErrorKind.UNAUTHORIZED, message);
    }

    public static ArticleWorkflowException forbidden(String message) {
        return new ArticleWorkflowException(ErrorKind.FORBIDDEN, message);
    }

    public static ArticleWorkflowException notFound(String message) {
        return new ArticleWorkflowException(ErrorKind.NOT_FOUND, message);
    }

    public static ArticleWorkflowException badRequest(String message) {
        return new ArticleWorkflowException(ErrorKind.BAD_REQUEST, message);
    }

    public static ArticleWorkflowException internal(String message, Throwable cause) {
        return new ArticleWorkflowException(ErrorKind.INTERNAL, message, cause);
    }

    /**
     * Kind of an arbitrary failure; anything that is not an {@code ArticleWorkflowException} counts as INTERNAL.
     */
    public static ErrorKind kindOf(Throwable error) {
        return error instanceof ArticleWorkflowException workflow ? workflow.getKind() : ErrorKind.INTERNAL;
    }

    /**
     * Wraps {@code error} as BAD_REQUEST with {@code prefix + ": " + message}, unless it is an
     * authorization failure or already one of the {@code passThrough} kinds.
     */
    public static ArticleWorkflowException wrap(Throwable error, String prefix, Set<ErrorKind> passThrough) {
        return wrap(error, ErrorKind.BAD_REQUEST, prefix + ": " + describe(error), passThrough);
    }

    /**
     * Wraps {@code error} as {@code kind} with a fixed message, unless it is an authorization
     * failure or one of the {@code passThrough} kinds, in which case it is returned unchanged.
     */
    public static ArticleWorkflowException wrap(Throwable error, ErrorKind kind, String message, Set<ErrorKind> passThrough) {
        if (error instanceof ArticleWorkflowException workflow
                && (workflow.getKind().isAuthorization() || passThrough.contains(workflow.getKind()))) {
            return workflow;
        }
        return new ArticleWorkflowException(kind, message, error);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : "Unknown error";
    }
}
