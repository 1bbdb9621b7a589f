package com.boundplan.tools;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tool catalog keyed by name. Populated once at startup and read-only afterwards.
 */
@Slf4j
public class ToolCapabilityRegistry {

    private final Map<String, ToolDescriptor> tools;

    public ToolCapabilityRegistry(Collection<ToolDescriptor> descriptors) {
        Map<String, ToolDescriptor> index = new LinkedHashMap<>();
        for (ToolDescriptor descriptor : descriptors) {
            if (descriptor == null || descriptor.name() == null || descriptor.name().isBlank()) {
                continue;
            }
            ToolDescriptor previous = index.putIfAbsent(descriptor.name().trim(), descriptor);
            if (previous != null) {
                log.warn("Duplicate tool '{}' ignored; keeping the first registration.", descriptor.name());
            }
        }
        this.tools = Collections.unmodifiableMap(index);
    }

    public static ToolCapabilityRegistry of(ToolDescriptor... descriptors) {
        return new ToolCapabilityRegistry(List.of(descriptors));
    }

    public Optional<ToolDescriptor> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<ToolDescriptor> descriptors() {
        return List.copyOf(tools.values());
    }

    public int size() {
        return tools.size();
    }
}
