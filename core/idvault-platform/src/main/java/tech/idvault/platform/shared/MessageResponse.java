package tech.idvault.platform.shared;

public record MessageResponse(String message) {}
