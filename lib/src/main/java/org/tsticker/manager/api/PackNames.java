package org.tsticker.manager.api;

import java.util.regex.Pattern;

public class PackNames {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_]+$");
    private static final int MAX_TITLE_LENGTH = 64;
    private static final String BOT_SUFFIX = "_by_";

    private PackNames() {
    }

    public static boolean isValidName(final String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    public static void validateName(final String name) throws InvalidPackException {
        if (!isValidName(name)) {
            throw new InvalidPackException("Invalid pack name '"
                    + name
                    + "': only letters, digits and underscores are allowed");
        }
    }

    public static void validateTitle(final String title) throws InvalidPackException {
        if (title == null || title.isEmpty() || title.length() > MAX_TITLE_LENGTH) {
            throw new InvalidPackException("Invalid pack title '"
                    + title
                    + "': length must be between 1 and "
                    + MAX_TITLE_LENGTH
                    + " characters");
        }
    }

    /**
     * Collections created by a bot must end with "_by_&lt;bot username&gt;".
     */
    public static String toCollectionName(final String packName, final String botUsername) {
        if (packName.contains(BOT_SUFFIX)) {
            return packName;
        }
        return packName + BOT_SUFFIX + botUsername;
    }
}
