package org.tsticker.commands;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

public class Commands {

    private static final Map<String, Command> commands = new HashMap<>();
    private static final Map<String, SubparserAttacher> commandSubparserAttacher = new TreeMap<>();

    static {
        addCommand(new DownloadCommand());
        addCommand(new InitCommand());
        addCommand(new LoginCommand());
        addCommand(new LogoutCommand());
        addCommand(new PushCommand());
        addCommand(new SyncCommand());
        addCommand(new TraceCommand());
        addCommand(new VersionCommand());
    }

    public static Map<String, SubparserAttacher> getCommandSubparserAttachers() {
        return commandSubparserAttacher;
    }

    public static Command getCommand(String commandKey) {
        if (!commands.containsKey(commandKey)) {
            return null;
        }
        return commands.get(commandKey);
    }

    private static void addCommand(Command command) {
        commands.put(command.getName(), command);
        if (command instanceof CliCommand cliCommand) {
            commandSubparserAttacher.put(command.getName(), cliCommand::attachToSubparser);
        }
    }
}
