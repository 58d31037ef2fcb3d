package com.clapgrow.fleet.session.command.builtin;

import com.clapgrow.fleet.session.command.CommandDescriptor;
import com.clapgrow.fleet.session.command.CommandInvocation;
import com.clapgrow.fleet.session.command.CommandPlugin;
import com.clapgrow.fleet.session.command.CommandRegistry;
import com.clapgrow.fleet.session.config.FleetProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * ping, alive and menu.
 */
@Component
public class CorePlugin implements CommandPlugin {

    private final FleetProperties fleetProperties;
    private final ObjectProvider<CommandRegistry> commandRegistry;
    private final Clock clock;

    public CorePlugin(FleetProperties fleetProperties, ObjectProvider<CommandRegistry> commandRegistry, Clock clock) {
        this.fleetProperties = fleetProperties;
        this.commandRegistry = commandRegistry;
        this.clock = clock;
    }

    @Override
    public List<CommandDescriptor> commands() {
        return List.of(
            CommandDescriptor.command("ping", "main", "Check response time", this::ping).withReact("🏓"),
            CommandDescriptor.command("alive", "main", "Show that the bot is running", this::alive),
            CommandDescriptor.command("menu", "main", "List available commands", this::menu).withAliases("help", "list"));
    }

    void ping(CommandInvocation invocation) {
        Long sentAt = invocation.message().messageTimestamp();
        long latencyMs = sentAt == null ? 0 : Math.max(0, clock.millis() - sentAt * 1000);
        invocation.reply("*Pong!* " + latencyMs + " ms");
    }

    void alive(CommandInvocation invocation) {
        Duration uptime = Duration.between(invocation.session().createdAt(), clock.instant());
        invocation.reply("*" + fleetProperties.getBotName() + " is alive*\n"
            + "Uptime: " + formatUptime(uptime) + "\n"
            + "Prefix: " + fleetProperties.getCommandPrefix() + "\n"
            + "Mode: " + fleetProperties.getMode());
    }

    void menu(CommandInvocation invocation) {
        Map<String, StringBuilder> sections = new TreeMap<>();
        String prefix = fleetProperties.getCommandPrefix();
        for (CommandDescriptor descriptor : commandRegistry.getObject().prefixCommands()) {
            sections.computeIfAbsent(descriptor.category(), c -> new StringBuilder())
                .append("│ ").append(prefix).append(descriptor.pattern());
            if (descriptor.description() != null) {
                sections.get(descriptor.category()).append(" - ").append(descriptor.description());
            }
            sections.get(descriptor.category()).append('\n');
        }
        StringBuilder text = new StringBuilder("*").append(fleetProperties.getBotName()).append(" MENU*\n");
        sections.forEach((category, lines) ->
            text.append("\n*").append(category.toUpperCase()).append("*\n").append(lines));
        invocation.reply(text.toString().trim());
    }

    static String formatUptime(Duration uptime) {
        long seconds = Math.max(0, uptime.getSeconds());
        return String.format("%dh %dm %ds", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
