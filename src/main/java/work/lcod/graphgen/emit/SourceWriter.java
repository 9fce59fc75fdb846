package work.lcod.graphgen.emit;

/**
 * Line-oriented text builder with four-space indentation.
 */
final class SourceWriter {
    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth;

    SourceWriter(int depth) {
        this.depth = depth;
    }

    SourceWriter line(String text) {
        if (!text.isEmpty()) {
            out.append(INDENT.repeat(depth)).append(text);
        }
        out.append('\n');
        return this;
    }

    SourceWriter blank() {
        out.append('\n');
        return this;
    }

    SourceWriter open(String text) {
        line(text);
        depth++;
        return this;
    }

    SourceWriter close(String text) {
        depth--;
        return line(text);
    }

    /**
     * Ends the current block and starts a sibling block such as a catch clause.
     */
    SourceWriter reopen(String text) {
        depth--;
        line(text);
        depth++;
        return this;
    }

    /**
     * Appends pre-rendered text verbatim.
     */
    SourceWriter raw(String text) {
        out.append(text);
        return this;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
