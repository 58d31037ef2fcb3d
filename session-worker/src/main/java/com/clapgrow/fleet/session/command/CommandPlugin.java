package com.clapgrow.fleet.session.command;

import java.util.List;

/**
 * Source of command descriptors. Every Spring bean implementing this is
 * collected by {@link CommandRegistry} at startup.
 */
public interface CommandPlugin {
    List<CommandDescriptor> commands();
}
