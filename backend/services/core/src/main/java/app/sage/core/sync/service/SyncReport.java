package app.sage.core.sync.service;

public record SyncReport(int attempted, int synced, int failed) {
}
