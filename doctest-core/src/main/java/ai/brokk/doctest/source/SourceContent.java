package ai.brokk.doctest.source;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/**
 * Python source text together with its UTF-8 bytes. tree-sitter reports node boundaries as UTF-8 byte offsets, so
 * node text has to be cut from the bytes rather than from the Java string.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private static final char BOM = '\uFEFF';

    private final String text;
    private final byte[] utf8Bytes;

    private SourceContent(String text) {
        this.text = text;
        this.utf8Bytes = text.getBytes(StandardCharsets.UTF_8);
    }

    /** Wraps {@code src}, dropping a leading byte order mark if present. */
    public static SourceContent of(String src) {
        if (!src.isEmpty() && src.charAt(0) == BOM) {
            src = src.substring(1);
        }
        return new SourceContent(src);
    }

    /** Turns {@code \r\n} and lone {@code \r} into {@code \n}, the way Python reads source and text files. */
    public static String normalizeLineEndings(String text) {
        if (text.indexOf('\r') < 0) {
            return text;
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Extracts the text in the UTF-8 byte range [startByte, endByte). Out-of-range requests yield the empty string
     * (logged), an end past the last byte is clamped.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte || startByte > utf8Bytes.length) {
            log.warn(
                    "Byte range [{}, {}) is outside source of {} bytes", startByte, endByte, utf8Bytes.length);
            return "";
        }
        int end = Math.min(endByte, utf8Bytes.length);
        if (end == startByte) {
            return "";
        }
        return new String(utf8Bytes, startByte, end - startByte, StandardCharsets.UTF_8);
    }

    public String substringFrom(TSNode node) {
        if (node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + utf8Bytes.length + ']';
    }
}
