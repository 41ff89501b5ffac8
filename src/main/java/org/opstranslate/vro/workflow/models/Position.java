package org.opstranslate.vro.workflow.models;

public record Position(double x, double y) {
}
