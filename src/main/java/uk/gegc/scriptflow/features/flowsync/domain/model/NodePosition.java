package uk.gegc.scriptflow.features.flowsync.domain.model;

public record NodePosition(double x, double y) {
}
