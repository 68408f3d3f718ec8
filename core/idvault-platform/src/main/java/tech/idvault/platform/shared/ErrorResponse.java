package tech.idvault.platform.shared;

/**
 * Error body returned by every endpoint: a machine-readable code plus a short message.
 */
public record ErrorResponse(String error, String message) {}
