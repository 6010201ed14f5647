package ai.brokk.doctest.namespace;

/** A dotted name could not be imported or one of its attributes does not exist. */
public class NameResolutionException extends Exception {
    private final String name;

    public NameResolutionException(String name, String message) {
        super(message);
        this.name = name;
    }

    public NameResolutionException(String name, String message, Throwable cause) {
        super(message, cause);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
