package com.clapgrow.fleet.session.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All registered command descriptors, indexed by command name and alias.
 * Built once at startup; duplicate names fail the startup.
 */
@Component
@Slf4j
public class CommandRegistry {

    private final List<CommandDescriptor> descriptors;
    private final Map<String, CommandDescriptor> byName = new HashMap<>();
    private final List<CommandDescriptor> passive = new ArrayList<>();

    public CommandRegistry(List<CommandPlugin> plugins) {
        List<CommandDescriptor> all = new ArrayList<>();
        for (CommandPlugin plugin : plugins) {
            all.addAll(plugin.commands());
        }
        for (CommandDescriptor descriptor : all) {
            if (descriptor.trigger().isPassive()) {
                passive.add(descriptor);
                continue;
            }
            index(descriptor.pattern(), descriptor);
            descriptor.aliases().forEach(alias -> index(alias, descriptor));
        }
        this.descriptors = List.copyOf(all);
        log.info("Loaded {} commands ({} passive) from {} plugin(s)", all.size(), passive.size(), plugins.size());
    }

    /**
     * Command whose pattern equals the name, falling back to one listing it as an alias.
     */
    public Optional<CommandDescriptor> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public List<CommandDescriptor> passiveUnits() {
        return List.copyOf(passive);
    }

    public List<CommandDescriptor> prefixCommands() {
        return descriptors.stream()
            .filter(descriptor -> !descriptor.trigger().isPassive())
            .toList();
    }

    private void index(String name, CommandDescriptor descriptor) {
        CommandDescriptor existing = byName.putIfAbsent(name.toLowerCase(), descriptor);
        if (existing != null && existing != descriptor) {
            throw new IllegalStateException("Command name '" + name + "' is registered by both '"
                + existing.pattern() + "' and '" + descriptor.pattern() + "'");
        }
    }
}
