package io.shotmatrix.device;

import io.shotmatrix.runtime.CancellationToken;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Records every command and answers from a list of (prefix, responder) rules; unmatched commands succeed.
 */
final class ScriptedCommandRunner extends CommandRunner {
    final List<List<String>> commands = new CopyOnWriteArrayList<>();
    private final List<Rule> rules = new ArrayList<>();

    ScriptedCommandRunner on(String joinedPrefix, Function<List<String>, CommandResult> responder) {
        rules.add(new Rule(joinedPrefix, responder));
        return this;
    }

    ScriptedCommandRunner on(String joinedPrefix, int exitCode, String stdout, String stderr) {
        return on(joinedPrefix, command -> result(exitCode, stdout, stderr));
    }

    static CommandResult result(int exitCode, String stdout, String stderr) {
        return new CommandResult(exitCode, stdout, stderr, Duration.ZERO);
    }

    @Override
    public CommandResult run(List<String> command, Duration timeout, CancellationToken token) {
        commands.add(List.copyOf(command));
        String joined = String.join(" ", command);
        for (Rule rule : rules) {
            if (joined.startsWith(rule.prefix())) {
                return rule.responder().apply(command);
            }
        }
        return result(0, "", "");
    }

    @Override
    public Process start(List<String> command) {
        commands.add(List.copyOf(command));
        throw new UnsupportedOperationException("no child processes in tests");
    }

    List<String> joined() {
        List<String> out = new ArrayList<>();
        for (List<String> command : commands) {
            out.add(String.join(" ", command));
        }
        return out;
    }

    private record Rule(String prefix, Function<List<String>, CommandResult> responder) {
    }
}
