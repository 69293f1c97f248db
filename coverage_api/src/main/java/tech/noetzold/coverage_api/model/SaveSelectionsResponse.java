package tech.noetzold.coverage_api.model;

public record SaveSelectionsResponse(String message, int count) {}
