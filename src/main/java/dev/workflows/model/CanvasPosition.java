package dev.workflows.model;

public record CanvasPosition(int x, int y) {}
