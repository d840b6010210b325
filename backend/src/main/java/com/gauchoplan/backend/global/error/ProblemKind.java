package com.gauchoplan.backend.global.error;

public enum ProblemKind {
    INVALID,
    NOT_FOUND,
    CONFLICT
}
