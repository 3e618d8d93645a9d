package it.berlink.dbmonitor.orm;

import it.berlink.dbmonitor.exception.UnsupportedModelOperationException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the ORM models reachable through {@link InstrumentedOrmClient}.
 *
 * Spring contributes every {@link ModelDelegate} bean; more can be registered
 * programmatically. Delegates are validated when registered, so lookups only
 * check presence.
 */
@Slf4j
@Component
public class ModelRegistry {

    private final Map<String, ModelDelegate> delegates = new ConcurrentHashMap<>();
    private final ObjectProvider<ModelDelegate> discovered;

    public ModelRegistry(ObjectProvider<ModelDelegate> discovered) {
        this.discovered = discovered;
    }

    @PostConstruct
    public void init() {
        discovered.orderedStream().forEach(this::register);
        log.info("Registered {} ORM model(s): {}", delegates.size(), delegates.keySet());
    }

    public void register(ModelDelegate delegate) {
        if (delegate.getName() == null || delegate.getName().isBlank()) {
            throw new IllegalArgumentException("ORM model delegate must have a name");
        }
        if (!delegate.supportsAny()) {
            throw new IllegalArgumentException("ORM model " + delegate.getName() + " supports no operation");
        }
        ModelDelegate previous = delegates.putIfAbsent(delegate.getName(), delegate);
        if (previous != null) {
            throw new IllegalStateException("ORM model already registered: " + delegate.getName());
        }
    }

    /**
     * Returns the delegate of the model, checking that it supports the operation.
     */
    public ModelDelegate resolve(String model, ModelOperation operation) {
        ModelDelegate delegate = model != null ? delegates.get(model) : null;
        if (delegate == null) {
            throw new UnsupportedModelOperationException("Model " + model + " not found");
        }
        if (!delegate.supports(operation)) {
            throw new UnsupportedModelOperationException(
                "Model " + model + " does not support " + operation.name().toLowerCase());
        }
        return delegate;
    }

    public Set<String> modelNames() {
        return Set.copyOf(delegates.keySet());
    }
}
