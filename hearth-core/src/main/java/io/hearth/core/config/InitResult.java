package io.hearth.core.config;

import java.nio.file.Path;

public record InitResult(Path configPath, Path databasePath, boolean created, boolean overwritten) {
}
