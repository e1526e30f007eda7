package dev.careerpath.ai;

public enum ResponseFormat {
    TEXT,
    JSON
}
