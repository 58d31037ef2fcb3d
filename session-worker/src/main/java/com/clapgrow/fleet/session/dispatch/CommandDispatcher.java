package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.message.MessageContent;
import com.clapgrow.fleet.session.command.CommandDescriptor;
import com.clapgrow.fleet.session.command.CommandInvocation;
import com.clapgrow.fleet.session.command.CommandRegistry;
import com.clapgrow.fleet.session.config.FleetProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Routes an event to command handlers.
 * 
 * <p>The prefixed-command path and the passive-trigger path are independent:
 * one event may fire a command and any number of passive units.
 */
@Component
@Slf4j
public class CommandDispatcher {

    private final CommandRegistry commandRegistry;
    private final FleetProperties fleetProperties;
    private final Counter failureCounter;

    public CommandDispatcher(CommandRegistry commandRegistry, FleetProperties fleetProperties, MeterRegistry meterRegistry) {
        this.commandRegistry = commandRegistry;
        this.fleetProperties = fleetProperties;
        this.failureCounter = Counter.builder("fleet.dispatch.handler.failures")
            .description("Command handler invocations that threw")
            .register(meterRegistry);
    }

    /**
     * Run the command named by the event, if any.
     * 
     * @return outcome of the handler, or empty when no command matched or it was not allowed
     */
    public Optional<HandlerOutcome> dispatchCommand(CommandInvocation invocation) {
        MessageContext context = invocation.context();
        if (!context.isCmd() || context.command().isEmpty()) {
            return Optional.empty();
        }
        Optional<CommandDescriptor> match = commandRegistry.find(context.command());
        if (match.isEmpty()) {
            return Optional.empty();
        }
        CommandDescriptor descriptor = match.get();
        if (fleetProperties.isPrivateWorkType() && !context.isOwner()) {
            log.debug("Ignoring command {} from non-owner {} in private mode", descriptor.pattern(), context.senderNumber());
            return Optional.empty();
        }
        if (descriptor.react() != null) {
            try {
                invocation.react(descriptor.react());
            } catch (RuntimeException e) {
                log.warn("Reaction for command {} failed on tenant {}: {}",
                    descriptor.pattern(), invocation.session().tenant(), e.getMessage());
            }
        }
        return Optional.of(run(descriptor, invocation));
    }

    /**
     * Run every passive unit whose trigger matches the event.
     */
    public List<HandlerOutcome> dispatchPassive(CommandInvocation invocation) {
        List<HandlerOutcome> outcomes = new ArrayList<>();
        for (CommandDescriptor descriptor : commandRegistry.passiveUnits()) {
            if (matches(descriptor, invocation.context())) {
                outcomes.add(run(descriptor, invocation));
            }
        }
        return outcomes;
    }

    static boolean matches(CommandDescriptor descriptor, MessageContext context) {
        return switch (descriptor.trigger()) {
            case BODY -> !context.body().isEmpty();
            case TEXT -> context.quotedText().isPresent();
            case IMAGE -> MessageContent.IMAGE.equals(context.contentType());
            case STICKER -> MessageContent.STICKER.equals(context.contentType());
            case COMMAND -> false;
        };
    }

    private HandlerOutcome run(CommandDescriptor descriptor, CommandInvocation invocation) {
        HandlerOutcome outcome = HandlerOutcome.invoke(descriptor.pattern(),
            () -> descriptor.handler().handle(invocation));
        if (!outcome.success()) {
            failureCounter.increment();
            log.error("Handler {} failed on tenant {}: {}", descriptor.pattern(),
                invocation.session().tenant(), outcome.failure().getMessage(), outcome.failure());
        }
        return outcome;
    }
}
