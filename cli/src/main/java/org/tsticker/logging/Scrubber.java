package org.tsticker.logging;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks bot tokens and numeric account ids in log output.
 */
public class Scrubber {

    private Scrubber() {
    }

    private static final Pattern BOT_TOKEN_PATTERN = Pattern.compile("\\b(\\d{5,}):[A-Za-z0-9_-]{30,}");
    private static final Pattern ACCOUNT_ID_PATTERN = Pattern.compile("(?<![\\w:])\\d{6,}(\\d{2})(?![\\w:])");

    public static String scrub(CharSequence s) {
        s = scrubBotTokens(s);
        s = scrubAccountIds(s);
        return s.toString();
    }

    private static CharSequence scrubBotTokens(CharSequence s) {
        return BOT_TOKEN_PATTERN.matcher(s).replaceAll("$1:[redacted]");
    }

    private static CharSequence scrubAccountIds(CharSequence s) {
        return ACCOUNT_ID_PATTERN.matcher(s)
                .replaceAll(m -> Matcher.quoteReplacement("********" + m.group(1)));
    }
}
