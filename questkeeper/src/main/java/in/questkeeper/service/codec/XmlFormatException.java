package in.questkeeper.service.codec;

/**
 * Malformed XML. Carries the character offset where reading stopped.
 */
public class XmlFormatException extends Exception {

    private final int position;

    public XmlFormatException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
