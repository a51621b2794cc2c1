package in.questkeeper.util;

import java.util.regex.Pattern;

/**
 * Identifier format checks. Stored ids are 24 lowercase hex characters.
 */
public final class Ids {

    private static final Pattern OBJECT_ID = Pattern.compile("^[0-9a-fA-F]{24}$");

    public static boolean isValid(String id) {
        return id != null && OBJECT_ID.matcher(id).matches();
    }

    private Ids() {}
}
