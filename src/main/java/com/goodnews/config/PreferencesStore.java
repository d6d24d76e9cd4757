package com.goodnews.config;

import com.goodnews.logging.AppLogger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Thin wrapper around {@link Preferences} that keeps the generator's persisted font choices.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/goodnews/generator";

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return forNode(ROOT_NODE);
    }

    public static PreferencesStore forNode(String nodePath) {
        return new PreferencesStore(Preferences.userRoot().node(nodePath));
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Path::of);
    }

    public void putPath(String key, Path path) {
        if (path == null) return;
        putString(key, path.toString());
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flush();
    }

    /**
     * Deletes this store's node and everything under it.
     */
    public void discard() {
        try {
            Preferences parent = delegate.parent();
            delegate.removeNode();
            parent.flush();
        } catch (BackingStoreException | IllegalStateException e) {
            AppLogger.get().warning("Could not discard preferences node " + delegate.absolutePath() + ": " + e.getMessage());
        }
    }

    private void flush() {
        try {
            delegate.flush();
        } catch (BackingStoreException e) {
            AppLogger.get().warning("Could not persist preferences: " + e.getMessage());
        }
    }
}
