package com.clapgrow.fleet.session.command;

@FunctionalInterface
public interface CommandHandler {
    void handle(CommandInvocation invocation);
}
