package me.golemcore.scheduler.domain.model.task;

import java.util.ArrayList;
import java.util.List;

/**
 * Program started by the host scheduler when a task fires.
 */
public record ExecAction(String executable, List<String> arguments) {

    public ExecAction {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public List<String> commandLine() {
        List<String> commandLine = new ArrayList<>();
        commandLine.add(executable);
        commandLine.addAll(arguments);
        return commandLine;
    }
}
