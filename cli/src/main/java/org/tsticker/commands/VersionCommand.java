package org.tsticker.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.tsticker.BaseConfig;
import org.tsticker.OutputType;
import org.tsticker.manager.StickerAccountFiles;
import org.tsticker.output.JsonWriter;
import org.tsticker.output.OutputWriter;
import org.tsticker.output.PlainTextWriter;

import java.util.List;
import java.util.Map;

public class VersionCommand implements AccountCommand {

    @Override
    public String getName() {
        return "version";
    }

    @Override
    public List<OutputType> getSupportedOutputTypes() {
        return List.of(OutputType.PLAIN_TEXT, OutputType.JSON);
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Show the version of this tool.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final StickerAccountFiles accountFiles, final OutputWriter outputWriter
    ) {
        final var projectName = BaseConfig.PROJECT_NAME == null ? "tsticker" : BaseConfig.PROJECT_NAME;
        final var version = BaseConfig.PROJECT_VERSION == null ? "unknown" : BaseConfig.PROJECT_VERSION;

        if (outputWriter instanceof JsonWriter jsonWriter) {
            jsonWriter.write(Map.of("version", version));
        } else if (outputWriter instanceof PlainTextWriter plainTextWriter) {
            plainTextWriter.println("{} {}", projectName, version);
        }
    }
}
