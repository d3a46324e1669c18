package app.mediarouter.gateway.provider;

public enum NormalizedStatus {
    processing,
    completed,
    failed
}
