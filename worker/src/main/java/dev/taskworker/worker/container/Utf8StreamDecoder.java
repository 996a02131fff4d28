package dev.taskworker.worker.container;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes a byte stream that arrives in arbitrary chunks. A multi-byte character split across
 * two chunks is held back until its remaining bytes arrive.
 */
final class Utf8StreamDecoder {

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private ByteBuffer pending = ByteBuffer.allocate(0);

    synchronized String decode(byte[] chunk) {
        var in = ByteBuffer.allocate(pending.remaining() + chunk.length);
        in.put(pending);
        in.put(chunk);
        in.flip();
        var out = CharBuffer.allocate(in.remaining() + 1);
        decoder.decode(in, out, false);
        pending = in.slice();
        out.flip();
        return out.toString();
    }

    /** Decodes whatever is still held back; an incomplete trailing character becomes U+FFFD. */
    synchronized String flush() {
        var out = CharBuffer.allocate(pending.remaining() + 2);
        decoder.decode(pending, out, true);
        decoder.flush(out);
        decoder.reset();
        pending = ByteBuffer.allocate(0);
        out.flip();
        return out.toString();
    }
}
