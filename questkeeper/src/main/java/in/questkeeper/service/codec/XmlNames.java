package in.questkeeper.service.codec;

/**
 * Reversible mapping between arbitrary object keys and XML element names.
 *
 * A character that cannot appear in a name at its position is written as
 * {@code _xHHHH_} (UTF-16 code unit in upper-case hex); an underscore followed
 * by {@code x} is escaped the same way so decoding is unambiguous. The empty key
 * becomes {@code _x_}. Ordinary camelCase field names pass through unchanged.
 */
final class XmlNames {

    static final String EMPTY = "_x_";

    static String encode(String key) {
        if (key.isEmpty()) {
            return EMPTY;
        }
        StringBuilder sb = new StringBuilder(key.length() + 8);
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            boolean escapedUnderscore = c == '_' && i + 1 < key.length() && key.charAt(i + 1) == 'x';
            if (!escapedUnderscore && (i == 0 ? isNameStart(c) : isNameChar(c))) {
                sb.append(c);
            } else {
                sb.append(String.format("_x%04X_", (int) c));
            }
        }
        return sb.toString();
    }

    static String decode(String name) {
        if (EMPTY.equals(name)) {
            return "";
        }
        if (name.indexOf("_x") < 0) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length());
        int i = 0;
        while (i < name.length()) {
            if (isEscape(name, i)) {
                sb.append((char) Integer.parseInt(name.substring(i + 2, i + 6), 16));
                i += 7;
            } else {
                sb.append(name.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }

    private static boolean isEscape(String name, int i) {
        if (i + 7 > name.length() || name.charAt(i) != '_' || name.charAt(i + 1) != 'x' || name.charAt(i + 6) != '_') {
            return false;
        }
        for (int j = i + 2; j < i + 6; j++) {
            if (Character.digit(name.charAt(j), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }

    private XmlNames() {}
}
