package io.hearth.core.provider;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries each provider in order until one succeeds. Once a provider has forwarded a fragment the chain is
 * committed to it, since the caller has already seen part of that reply.
 */
public final class FallbackLlmProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmProvider.class);
    private final String name;
    private final List<LlmProvider> chain;

    public FallbackLlmProvider(String name, List<LlmProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse stream(LlmRequest request, StreamListener listener) {
        LlmResponse last = LlmResponse.failure("no providers in fallback chain " + name);
        for (LlmProvider provider : chain) {
            TrackingListener tracking = new TrackingListener(listener);
            try {
                last = provider.stream(request, tracking);
            } catch (RuntimeException e) {
                if (tracking.forwarded) {
                    throw e;
                }
                LOG.warn("Provider {} threw in chain {}", provider.name(), name, e);
                last = LlmResponse.failure(provider.name() + ": " + e.getMessage());
                continue;
            }
            if (!last.failed()) {
                LOG.debug("Provider {} served request for chain {}", provider.name(), name);
                return last;
            }
            if (tracking.forwarded) {
                LOG.warn("Provider {} failed mid-stream in chain {}: {}", provider.name(), name, truncate(last.error(), 300));
                return last;
            }
            LOG.warn(
                "Provider {} failed in chain {}: {}",
                provider.name(),
                name,
                truncate(last.error(), 300)
            );
        }
        return last;
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }

    private static final class TrackingListener implements StreamListener {
        private final StreamListener delegate;
        private boolean forwarded;

        private TrackingListener(StreamListener delegate) {
            this.delegate = delegate == null ? StreamListener.NONE : delegate;
        }

        @Override
        public boolean onDelta(String fragment) {
            forwarded = true;
            return delegate.onDelta(fragment);
        }

        @Override
        public boolean cancelled() {
            return delegate.cancelled();
        }
    }
}
