package com.gauchoplan.backend.global.error;

/**
 * Application failure with a stable dotted code such as {@code catalog.course_not_found}.
 */
public class ProblemException extends RuntimeException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:gauchoplan:";

    private final ProblemKind kind;
    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(ProblemKind kind, String code) {
        this(kind, code, null, null);
    }

    public ProblemException(ProblemKind kind, String code, String detail) {
        this(kind, code, detail, null);
    }

    public ProblemException(ProblemKind kind, String code, String detail, Throwable cause) {
        super(code, cause);
        if (kind == null) {
            throw new IllegalArgumentException("ProblemException kind must not be null");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public static ProblemException notFound(String code, String detail) {
        return new ProblemException(ProblemKind.NOT_FOUND, code, detail);
    }

    public static ProblemException conflict(String code, String detail) {
        return new ProblemException(ProblemKind.CONFLICT, code, detail);
    }

    public static ProblemException invalid(String code, String detail) {
        return new ProblemException(ProblemKind.INVALID, code, detail);
    }

    public ProblemKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    @Override
    public String getMessage() {
        return code + ": " + detail;
    }
}
