package com.example.anttrack.exception;

import lombok.Getter;

/**
 * 带错误类别的分析异常
 */
@Getter
public class AnalysisException extends RuntimeException {

    private final ErrorKind kind;

    public AnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
