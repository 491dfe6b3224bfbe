package org.tsticker.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.tsticker.OutputType;
import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.commands.exceptions.IOErrorException;
import org.tsticker.commands.exceptions.UserErrorException;
import org.tsticker.manager.StickerAccountFiles;
import org.tsticker.manager.api.AppInitException;
import org.tsticker.manager.api.Credential;
import org.tsticker.manager.api.InvalidCredentialException;
import org.tsticker.output.JsonWriter;
import org.tsticker.output.OutputWriter;
import org.tsticker.output.PlainTextWriter;

import java.io.IOException;
import java.util.List;

public class LoginCommand implements AccountCommand {

    @Override
    public String getName() {
        return "login";
    }

    @Override
    public List<OutputType> getSupportedOutputTypes() {
        return List.of(OutputType.PLAIN_TEXT, OutputType.JSON);
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Validate a bot token and store it for the following commands.");
        subparser.addArgument("-t", "--token")
                .required(true)
                .help("Bot token as issued by @BotFather, e.g. 123456:ABC-DEF1234ghIkl-zyx57W2v1u123ew11");
        subparser.addArgument("-u", "--user")
                .required(true)
                .help("Numeric id of the user that will own created sticker packs.");
        subparser.addArgument("-p", "--proxy").help("Proxy for all bot requests, e.g. socks5://127.0.0.1:1080");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final StickerAccountFiles accountFiles, final OutputWriter outputWriter
    ) throws CommandException {
        final var token = ns.getString("token");
        final var user = ns.getString("user");
        final var proxy = ns.getString("proxy");

        final Credential credential;
        try {
            credential = accountFiles.login(token, user, proxy);
        } catch (InvalidCredentialException e) {
            throw new UserErrorException("Invalid credential: " + e.getMessage(), e);
        } catch (AppInitException e) {
            throw new UserErrorException(e.getMessage(), e);
        } catch (IOException e) {
            throw new IOErrorException("Failed to store credential: " + e.getMessage(), e);
        }

        final var operator = credential.operator();
        if (outputWriter instanceof JsonWriter jsonWriter) {
            jsonWriter.write(new JsonLogin(operator.id(), operator.username(), credential.ownerId()));
        } else if (outputWriter instanceof PlainTextWriter plainTextWriter) {
            plainTextWriter.println("Logged in as @{} ({}).", operator.username(), operator.id());
            plainTextWriter.println("Sticker packs created by this bot can only be managed by this bot.");
        }
    }

    private record JsonLogin(String botId, String botUsername, String ownerId) {}
}
