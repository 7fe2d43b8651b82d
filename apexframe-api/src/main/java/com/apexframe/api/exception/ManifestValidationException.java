package com.apexframe.api.exception;

import lombok.Getter;

import java.util.List;

/**
 * 清单校验失败，包含全部问题
 */
@Getter
public class ManifestValidationException extends ApexException {

    private final List<String> problems;

    public ManifestValidationException(String source, List<String> problems) {
        super(ErrorKind.MANIFEST_VALIDATION, "Invalid manifest " + source + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ManifestValidationException(String source, String problem, Throwable cause) {
        super(ErrorKind.MANIFEST_VALIDATION, "Invalid manifest " + source + ": " + problem, cause);
        this.problems = List.of(problem);
    }
}
