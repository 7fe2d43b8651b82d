package com.apexframe.api.exception;

import lombok.Getter;

import java.util.List;

/**
 * 动作输入不符合 input_schema
 */
@Getter
public class ActionInputException extends ApexException {

    private final List<String> problems;

    public ActionInputException(String action, List<String> problems) {
        super(ErrorKind.INVALID_INPUT, "Invalid input for action [" + action + "]: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
