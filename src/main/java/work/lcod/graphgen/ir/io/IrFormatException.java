package work.lcod.graphgen.ir.io;

/**
 * Serialized IR that cannot be turned into a {@code GraphInfo}; the message names the source and the offending key.
 */
public final class IrFormatException extends IllegalStateException {
    private final String source;

    public IrFormatException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public IrFormatException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
