package com.acme.pubsub.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Channels known to this process, keyed by channel type and by wire name.
 * <p>
 * Registration is append-only and happens before any listener starts; afterwards the
 * registry is only read. Each application builds its own instance, tests included.
 */
public final class ChannelRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ChannelRegistry.class);

    private final Function<Class<?>, String> wireNaming;
    private final Map<Class<?>, ChannelEntry<?>> byType = new LinkedHashMap<>();
    private final Map<String, ChannelEntry<?>> byWireName = new LinkedHashMap<>();
    private final Map<String, TriggerRegistration> triggers = new LinkedHashMap<>();

    public ChannelRegistry() {
        this(ChannelNames::wireName);
    }

    ChannelRegistry(Function<Class<?>, String> wireNaming) {
        this.wireNaming = wireNaming;
    }

    /**
     * Subscribes a listener to a channel, declaring the channel on first use.
     */
    public synchronized <C extends Channel> ChannelEntry<C> register(Class<C> type, Listener<? super C> listener) {
        ChannelEntry<C> entry = declare(type);
        entry.addListener(listener);
        LOG.debug("Registered listener on {}", entry);
        return entry;
    }

    /**
     * Declares a channel without listeners, e.g. in a process that only publishes.
     */
    @SuppressWarnings("unchecked")
    public synchronized <C extends Channel> ChannelEntry<C> declare(Class<C> type) {
        ChannelEntry<?> existing = byType.get(type);
        if (existing != null) {
            return (ChannelEntry<C>) existing;
        }
        ChannelEntry<C> entry = ChannelEntry.create(type, wireNaming.apply(type));
        ChannelEntry<?> clash = byWireName.get(entry.wireName());
        if (clash != null) {
            throw new ChannelConfigurationException("Channels " + clash.type().getName() + " and "
                + type.getName() + " share the wire name " + entry.wireName());
        }
        byType.put(type, entry);
        byWireName.put(entry.wireName(), entry);
        return entry;
    }

    /**
     * Binds row changes to a trigger channel. Registering the same trigger twice is a no-op.
     */
    public synchronized TriggerRegistration registerTrigger(TriggerRegistration registration) {
        ChannelEntry<?> entry = declare(registration.channel());
        String name = registration.triggerName(entry.wireName());
        TriggerRegistration existing = triggers.putIfAbsent(name, registration);
        return existing != null ? existing : registration;
    }

    public TriggerRegistration registerTrigger(Class<? extends TriggerChannel<?>> channel, TriggerTiming timing,
                                               TriggerOperation first, TriggerOperation... rest) {
        return registerTrigger(TriggerRegistration.of(channel, timing, first, rest));
    }

    public ChannelEntry<?> resolve(String wireName) {
        ChannelEntry<?> entry = byWireName.get(wireName);
        if (entry == null) {
            throw new ChannelNotFoundException(wireName);
        }
        return entry;
    }

    @SuppressWarnings("unchecked")
    public <C extends Channel> ChannelEntry<C> resolve(Class<C> type) {
        ChannelEntry<?> entry = byType.get(type);
        if (entry == null) {
            throw new ChannelNotFoundException(type.getName());
        }
        return (ChannelEntry<C>) entry;
    }

    /**
     * Resolves a channel by wire name, logical name or fully qualified class name.
     */
    public ChannelEntry<?> resolveName(String name) {
        ChannelEntry<?> entry = byWireName.get(name);
        if (entry != null) {
            return entry;
        }
        return byType.values().stream()
            .filter(e -> e.logicalName().equals(name) || e.type().getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new ChannelNotFoundException(name));
    }

    public Collection<ChannelEntry<?>> entries() {
        return Collections.unmodifiableCollection(byType.values());
    }

    public Collection<TriggerRegistration> triggers() {
        return Collections.unmodifiableCollection(triggers.values());
    }

    /**
     * Channels a listener should subscribe to: all registered channels when no names or types
     * are given, otherwise the named ones. An empty result is a configuration error.
     */
    public List<ChannelEntry<?>> select(Collection<String> names, Collection<Class<? extends Channel>> types) {
        List<ChannelEntry<?>> selected = new ArrayList<>();
        if (names.isEmpty() && types.isEmpty()) {
            selected.addAll(byType.values());
        } else {
            for (String name : names) {
                addOnce(selected, resolveName(name));
            }
            for (Class<? extends Channel> type : types) {
                addOnce(selected, resolve(type));
            }
        }
        if (selected.isEmpty()) {
            throw new ChannelConfigurationException("No channels selected to listen on");
        }
        return List.copyOf(selected);
    }

    private static void addOnce(List<ChannelEntry<?>> selected, ChannelEntry<?> entry) {
        if (!selected.contains(entry)) {
            selected.add(entry);
        }
    }
}
