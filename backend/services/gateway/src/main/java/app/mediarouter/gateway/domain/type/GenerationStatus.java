package app.mediarouter.gateway.domain.type;

public enum GenerationStatus {
    queued,
    processing,
    completed,
    failed,
    cancelled;

    public boolean isTerminal() {
        return this == completed || this == failed || this == cancelled;
    }
}
