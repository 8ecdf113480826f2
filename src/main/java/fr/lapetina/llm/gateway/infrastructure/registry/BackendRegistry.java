package fr.lapetina.llm.gateway.infrastructure.registry;

import fr.lapetina.llm.gateway.domain.exception.ConfigurationException;
import fr.lapetina.llm.gateway.domain.exception.ErrorCode;
import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;
import fr.lapetina.llm.gateway.domain.model.BackendStatus;
import fr.lapetina.llm.gateway.domain.model.Capability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Catalog of routable backends.
 *
 * Maintains capability and provider indexes so lookups never scan the full
 * catalog. Descriptors are immutable; status updates replace the stored instance.
 */
public final class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<String, BackendDescriptor> backends = new ConcurrentHashMap<>();
    private final Map<Capability, Set<String>> capabilityIndex = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> providerIndex = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a new backend.
     *
     * @throws ConfigurationException if a backend with the same id is already registered
     */
    public void register(BackendDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        BackendDescriptor previous = backends.putIfAbsent(descriptor.getId(), descriptor);
        if (previous != null) {
            throw new ConfigurationException(ErrorCode.DUPLICATE_BACKEND, "id=" + descriptor.getId());
        }
        index(descriptor);
        log.info("Backend registered: {}", descriptor);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.ADDED, descriptor));
    }

    /**
     * Removes a backend by id.
     */
    public Optional<BackendDescriptor> unregister(String backendId) {
        BackendDescriptor removed = backends.remove(backendId);
        if (removed == null) {
            return Optional.empty();
        }
        for (Capability capability : removed.getCapabilities()) {
            Set<String> ids = capabilityIndex.get(capability);
            if (ids != null) {
                ids.remove(backendId);
            }
        }
        Set<String> providerIds = providerIndex.get(removed.getProvider());
        if (providerIds != null) {
            providerIds.remove(backendId);
        }
        log.info("Backend removed: {}", removed);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.REMOVED, removed));
        return Optional.of(removed);
    }

    public Optional<BackendDescriptor> get(String backendId) {
        return Optional.ofNullable(backends.get(backendId));
    }

    /**
     * Gets a backend by id.
     *
     * @throws ConfigurationException if the id is unknown
     */
    public BackendDescriptor getOrFail(String backendId) {
        BackendDescriptor descriptor = backends.get(backendId);
        if (descriptor == null) {
            throw new ConfigurationException(ErrorCode.BACKEND_NOT_FOUND, "id=" + backendId);
        }
        return descriptor;
    }

    /**
     * Returns active backends supporting every listed capability, ordered by id.
     * An empty requirement returns every active backend.
     */
    public List<BackendDescriptor> listByCapabilities(Collection<Capability> required) {
        if (required == null || required.isEmpty()) {
            return listActive();
        }

        Set<String> matching = null;
        for (Capability capability : required) {
            Set<String> ids = capabilityIndex.getOrDefault(capability, Set.of());
            if (matching == null) {
                matching = new HashSet<>(ids);
            } else {
                matching.retainAll(ids);
            }
            if (matching.isEmpty()) {
                return List.of();
            }
        }

        return matching.stream()
                .map(backends::get)
                .filter(Objects::nonNull)
                .filter(BackendDescriptor::isActive)
                .sorted(Comparator.comparing(BackendDescriptor::getId))
                .toList();
    }

    /**
     * Returns every active backend, ordered by id.
     */
    public List<BackendDescriptor> listActive() {
        return backends.values().stream()
                .filter(BackendDescriptor::isActive)
                .sorted(Comparator.comparing(BackendDescriptor::getId))
                .toList();
    }

    /**
     * Returns every backend that is not disabled, ordered by id.
     */
    public List<BackendDescriptor> listAvailable() {
        return backends.values().stream()
                .filter(b -> b.getStatus() != BackendStatus.DISABLED)
                .sorted(Comparator.comparing(BackendDescriptor::getId))
                .toList();
    }

    public List<BackendDescriptor> listByProvider(String provider) {
        return providerIndex.getOrDefault(provider, Set.of()).stream()
                .map(backends::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(BackendDescriptor::getId))
                .toList();
    }

    /**
     * Updates the status of a backend.
     *
     * @throws ConfigurationException if the id is unknown
     */
    public BackendDescriptor updateStatus(String backendId, BackendStatus status) {
        BackendDescriptor updated = backends.computeIfPresent(backendId, (id, current) ->
                current.getStatus() == status ? current : current.withStatus(status));
        if (updated == null) {
            throw new ConfigurationException(ErrorCode.BACKEND_NOT_FOUND, "id=" + backendId);
        }
        log.info("Backend status updated: backendId={}, status={}", backendId, status);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.STATUS_CHANGED, updated));
        return updated;
    }

    public Set<String> providers() {
        Set<String> providers = new TreeSet<>();
        providerIndex.forEach((provider, ids) -> {
            if (!ids.isEmpty()) {
                providers.add(provider);
            }
        });
        return providers;
    }

    public Set<Capability> capabilities() {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        capabilityIndex.forEach((capability, ids) -> {
            if (!ids.isEmpty()) {
                capabilities.add(capability);
            }
        });
        return capabilities;
    }

    /**
     * Returns counts for health reporting.
     */
    public RegistryStats stats() {
        Map<String, Integer> byProvider = new TreeMap<>();
        providerIndex.forEach((provider, ids) -> {
            if (!ids.isEmpty()) {
                byProvider.put(provider, ids.size());
            }
        });
        Map<Capability, Integer> byCapability = new EnumMap<>(Capability.class);
        capabilityIndex.forEach((capability, ids) -> {
            if (!ids.isEmpty()) {
                byCapability.put(capability, ids.size());
            }
        });
        int active = (int) backends.values().stream().filter(BackendDescriptor::isActive).count();
        return new RegistryStats(backends.size(), active, byProvider, byCapability);
    }

    public int size() {
        return backends.size();
    }

    /**
     * Adds a listener for registry events.
     */
    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void index(BackendDescriptor descriptor) {
        for (Capability capability : descriptor.getCapabilities()) {
            capabilityIndex.computeIfAbsent(capability, k -> ConcurrentHashMap.newKeySet())
                    .add(descriptor.getId());
        }
        providerIndex.computeIfAbsent(descriptor.getProvider(), k -> ConcurrentHashMap.newKeySet())
                .add(descriptor.getId());
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    /**
     * Event for registry changes.
     */
    public record RegistryEvent(Type type, BackendDescriptor backend) {
        public enum Type {
            ADDED,
            REMOVED,
            STATUS_CHANGED
        }
    }

    /**
     * Snapshot of registry counts.
     */
    public record RegistryStats(
            int totalBackends,
            int activeBackends,
            Map<String, Integer> backendsByProvider,
            Map<Capability, Integer> backendsByCapability
    ) {
        public RegistryStats {
            backendsByProvider = Map.copyOf(backendsByProvider);
            backendsByCapability = Map.copyOf(backendsByCapability);
        }
    }
}
