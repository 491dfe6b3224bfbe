package org.tsticker.manager.util;

import java.util.ArrayList;
import java.util.List;

public class EmojiUtils {

    private static final int VARIATION_SELECTOR_16 = 0xFE0F;
    private static final int ZERO_WIDTH_JOINER = 0x200D;

    private EmojiUtils() {
    }

    /**
     * Extracts the emoji contained in a file name, e.g. "cat_😺" yields ["😺"].
     * Variation selectors and joiners are kept attached to the preceding emoji.
     */
    public static List<String> extractEmojis(final String text) {
        final var result = new ArrayList<String>();
        final var codePoints = text.codePoints().toArray();
        StringBuilder current = null;
        for (var i = 0; i < codePoints.length; i++) {
            final var cp = codePoints[i];
            if (current != null && (cp == VARIATION_SELECTOR_16 || isSkinTone(cp))) {
                current.appendCodePoint(cp);
                continue;
            }
            if (current != null && cp == ZERO_WIDTH_JOINER && i + 1 < codePoints.length && isEmoji(codePoints[i + 1])) {
                current.appendCodePoint(cp).appendCodePoint(codePoints[++i]);
                continue;
            }
            if (current != null) {
                result.add(current.toString());
                current = null;
            }
            if (isEmoji(cp)) {
                current = new StringBuilder().appendCodePoint(cp);
                // a flag is a pair of regional indicators
                if (isRegionalIndicator(cp) && i + 1 < codePoints.length && isRegionalIndicator(codePoints[i + 1])) {
                    current.appendCodePoint(codePoints[++i]);
                }
            }
        }
        if (current != null) {
            result.add(current.toString());
        }
        return result;
    }

    static boolean isEmoji(final int cp) {
        return (cp >= 0x1F300 && cp <= 0x1FAFF) // pictographs, emoticons, transport, supplemental symbols
                || (cp >= 0x2600 && cp <= 0x27BF) // misc symbols and dingbats
                || (cp >= 0x1F000 && cp <= 0x1F2FF) // mahjong, playing cards, enclosed characters
                || (cp >= 0x2B00 && cp <= 0x2BFF) // arrows, stars
                || cp == 0x2764
                || cp == 0x203C
                || cp == 0x2049;
    }

    private static boolean isRegionalIndicator(final int cp) {
        return cp >= 0x1F1E6 && cp <= 0x1F1FF;
    }

    private static boolean isSkinTone(final int cp) {
        return cp >= 0x1F3FB && cp <= 0x1F3FF;
    }
}
