package dev.ccast.treesitter;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Source text of tree-sitter nodes. Tree-sitter reports UTF-8 byte offsets, so text is cut from the raw bytes. */
final class NodeText {
    private static final Logger logger = LogManager.getLogger(NodeText.class);

    private NodeText() {}

    static String of(@Nullable TSNode node, byte[] source) {
        if (node == null || node.isNull()) {
            return "";
        }
        return slice(source, node.getStartByte(), node.getEndByte());
    }

    static String slice(byte[] source, int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            logger.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    source.length,
                    startByte,
                    endByte);
            return "";
        }
        // zero-width nodes are produced for missing tokens
        if (startByte == endByte || startByte >= source.length) {
            return "";
        }
        if (endByte > source.length) {
            logger.warn("End byte offset {} exceeds source byte length {}, truncating", endByte, source.length);
            endByte = source.length;
        }
        return new String(source, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    static byte[] stripUtf8Bom(byte[] bytes) {
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            byte[] withoutBom = new byte[bytes.length - 3];
            System.arraycopy(bytes, 3, withoutBom, 0, bytes.length - 3);
            return withoutBom;
        }
        return bytes;
    }

    /** Single-line excerpt for messages: newlines and tabs escaped, long text cut at {@code max} characters. */
    static String excerpt(String text, int max) {
        var oneLine = text.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t");
        return oneLine.length() <= max ? oneLine : oneLine.substring(0, max) + "...";
    }
}
