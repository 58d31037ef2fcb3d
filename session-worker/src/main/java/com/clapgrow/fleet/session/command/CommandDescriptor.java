package com.clapgrow.fleet.session.command;

import java.util.List;
import java.util.Objects;

/**
 * One registered automation unit.
 * 
 * @param pattern Command name matched after the prefix (COMMAND trigger), or a unit name for passive triggers
 * @param aliases Alternative command names
 * @param trigger What makes the unit fire
 * @param react Emoji reaction sent before the handler runs, or null
 * @param description Shown in the menu
 * @param category Menu section
 * @param handler Handler invoked with the event
 */
public record CommandDescriptor(
    String pattern,
    List<String> aliases,
    CommandTrigger trigger,
    String react,
    String description,
    String category,
    CommandHandler handler
) {

    public CommandDescriptor {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(handler, "handler");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        category = category == null ? "misc" : category;
    }

    public static CommandDescriptor command(String pattern, String category, String description, CommandHandler handler) {
        return new CommandDescriptor(pattern, List.of(), CommandTrigger.COMMAND, null, description, category, handler);
    }

    public static CommandDescriptor on(CommandTrigger trigger, String name, String description, CommandHandler handler) {
        return new CommandDescriptor(name, List.of(), trigger, null, description, null, handler);
    }

    public CommandDescriptor withAliases(String... names) {
        return new CommandDescriptor(pattern, List.of(names), trigger, react, description, category, handler);
    }

    public CommandDescriptor withReact(String emoji) {
        return new CommandDescriptor(pattern, aliases, trigger, emoji, description, category, handler);
    }

    public boolean answersTo(String name) {
        return trigger == CommandTrigger.COMMAND && (pattern.equals(name) || aliases.contains(name));
    }
}
