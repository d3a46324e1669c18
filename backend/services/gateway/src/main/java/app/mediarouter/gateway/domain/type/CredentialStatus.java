package app.mediarouter.gateway.domain.type;

public enum CredentialStatus {
    active,
    invalid,
    quota_exceeded,
    revoked
}
