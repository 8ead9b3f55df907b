package io.hearth.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HearthConfig(
    ConversationDefaults conversation,
    ProvidersConfig providers,
    StorageConfig storage
) {

    public static HearthConfig defaults() {
        return new HearthConfig(
            ConversationDefaults.defaults(),
            ProvidersConfig.defaults(),
            StorageConfig.defaults()
        );
    }
}
