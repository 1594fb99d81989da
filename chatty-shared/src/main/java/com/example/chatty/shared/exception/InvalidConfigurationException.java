package com.example.chatty.shared.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidConfigurationException extends RuntimeException {

    private final List<String> problems;

    public InvalidConfigurationException(List<String> problems) {
        super("Invalid gateway configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
