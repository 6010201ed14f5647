package ai.brokk.doctest.api;

/**
 * Raised when the address of a discovered test cannot be computed, typically because the dotted name it was
 * discovered under no longer resolves to anything.
 */
public class AddressResolutionException extends Exception {
    private final String name;

    public AddressResolutionException(String name, String message) {
        super(message);
        this.name = name;
    }

    public AddressResolutionException(String name, String message, Throwable cause) {
        super(message, cause);
        this.name = name;
    }

    /** The dotted name or identity whose address was requested. */
    public String getName() {
        return name;
    }
}
