package ai.brokk.doctest.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

/**
 * Where a discovered test lives, in the shape host reporting and filtering layers expect: the source file, the dotted
 * module name, and the dotted call path inside that module. Module-level tests have no call path; tests read from
 * standalone text files have neither module name nor call path.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"filename", "moduleName", "callPath"})
public record TestAddress(
        @JsonProperty("filename") @Nullable String filename,
        @JsonProperty("moduleName") @Nullable String moduleName,
        @JsonProperty("callPath") @Nullable String callPath) {

    public static TestAddress forFile(String filename) {
        return new TestAddress(filename, null, null);
    }

    /**
     * Returns this address with {@code leaf} appended to the call path. Used for members that can only be located
     * through their owner, such as properties.
     */
    public TestAddress appendToCallPath(String leaf) {
        if (leaf.isEmpty()) {
            throw new IllegalArgumentException("Call path segment must not be empty");
        }
        var joined = callPath == null ? leaf : callPath + "." + leaf;
        return new TestAddress(filename, moduleName, joined);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(filename == null ? "?" : filename);
        if (moduleName != null) {
            sb.append(" [").append(moduleName).append(']');
        }
        if (callPath != null) {
            sb.append(':').append(callPath);
        }
        return sb.toString();
    }
}
