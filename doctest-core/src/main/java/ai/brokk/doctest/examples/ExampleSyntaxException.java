package ai.brokk.doctest.examples;

/** Documentation text contains something that looks like an example but breaks the example grammar. */
public class ExampleSyntaxException extends RuntimeException {
    private final String blockName;
    private final int line;

    public ExampleSyntaxException(String blockName, int line, String message) {
        super("line %d of the docstring for %s %s".formatted(line, blockName, message));
        this.blockName = blockName;
        this.line = line;
    }

    public String getBlockName() {
        return blockName;
    }

    /** 1-based line inside the documentation text. */
    public int getLine() {
        return line;
    }
}
