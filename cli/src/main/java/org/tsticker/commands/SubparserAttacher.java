package org.tsticker.commands;

import net.sourceforge.argparse4j.inf.Subparser;

public interface SubparserAttacher {

    void attachToSubparser(Subparser subparser);
}
