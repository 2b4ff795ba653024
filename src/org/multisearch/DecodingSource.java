/*
 * @LICENSE@
 */
package org.multisearch;

import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * A {@link CodePointSource} which decodes bytes from a channel, one code point
 * at a time, and reports the exact number of bytes each code point consumed.
 * Malformed or unmappable input is replaced with U+FFFD; the width of the
 * replacement is the number of bytes that were skipped.
 * <p>
 * Input is decoded as UTF-8 unless a charset is named. A byte order mark
 * consumed by the decoder is counted as part of the first code point, so
 * offsets stay byte offsets into the input; term lengths never include one.
 */
public final class DecodingSource implements CodePointSource, Closeable {

    /**
     * The input byte buffer capacity.
     * <p>
     * Not <code>private</code> or <code>final</code> in order to facilitate
     * testing.
     */
    static int BYTE_BUFFER_CAPACITY = 8192;

    private final ReadableByteChannel rbc;
    private final CharsetDecoder dec;
    private final CharsetEncoder enc;     // null for UTF-8
    private final ByteBuffer bb;
    private final CharBuffer cb = CharBuffer.allocate(2);
    private boolean endOfInput = false;
    private boolean flushed = false;
    private int width = 0;

    /**
     * Constructs a new <code>DecodingSource</code> which reads UTF-8 input from
     * the specified file.
     *
     * @param file
     *            The input file
     * @throws FileNotFoundException
     *             if <code>file</code> is not found.
     */
    public DecodingSource(File file) throws FileNotFoundException {
        this(new FileInputStream(file).getChannel(), StandardCharsets.UTF_8);
    }

    public DecodingSource(File file, String charsetName) throws FileNotFoundException {
        this(new FileInputStream(file).getChannel(), Charset.forName(charsetName));
    }

    public DecodingSource(InputStream in) {
        this(Channels.newChannel(in), StandardCharsets.UTF_8);
    }

    public DecodingSource(InputStream in, String charsetName) {
        this(Channels.newChannel(in), Charset.forName(charsetName));
    }

    public DecodingSource(ReadableByteChannel rbc) {
        this(rbc, StandardCharsets.UTF_8);
    }

    public DecodingSource(ReadableByteChannel rbc, Charset charset) {
        if (rbc == null) {
            throw new NullPointerException("rbc");
        }
        this.rbc = rbc;
        this.dec = charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        this.enc = StandardCharsets.UTF_8.equals(charset) ? null : charset
            .newEncoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        this.bb = ByteBuffer.allocate(BYTE_BUFFER_CAPACITY);
        bb.flip();
    }

    /**
     * Decodes the next code point. Reads from the channel only when the byte
     * buffer runs dry.
     */
    public int read() throws IOException {
        cb.clear();
        cb.limit(1);
        width = 0;
        while (true) {
            int mark = bb.position();
            CoderResult cr = flushed ? CoderResult.UNDERFLOW
                    : dec.decode(bb, cb, endOfInput);
            width += bb.position() - mark;
            if (cr.isError()) {
                cr.throwException();   // can't happen with REPLACE
            }
            if (cb.position() > 0 && (cb.limit() == 2 || !pending())) {
                break;
            }
            if (cr.isOverflow()) {
                // supplementary char needs room for the pair
                cb.limit(2);
                continue;
            }
            if (endOfInput) {
                if (!flushed) {
                    dec.flush(cb);
                    flushed = true;
                    if (cb.position() > 0) {
                        break;
                    }
                }
                return EOF;
            }
            fill();
        }
        cb.flip();
        char c = cb.get();
        if (cb.hasRemaining() && Character.isSurrogatePair(c, cb.get(1))) {
            return Character.toCodePoint(c, cb.get());
        }
        return c;
    }

    /*
     * A high surrogate on its own with more input left: the low half is coming.
     */
    private boolean pending() {
        return cb.position() == 1 && Character.isHighSurrogate(cb.get(0)) && cb.limit() == 1;
    }

    private void fill() throws IOException {
        bb.compact();
        int n;
        try {
            while ((n = rbc.read(bb)) == 0) ;      // got something, or EOF
        } finally {
            bb.flip();
        }
        if (n == -1) {
            endOfInput = true;
        }
    }

    public int width() {
        return width;
    }

    public int encodedLength(CharSequence term) {
        return enc == null ? Misc.utf8Length(term) : CharSequenceSource.encodedLength(enc, term);
    }

    public void close() throws IOException {
        rbc.close();
    }

    @Override
    public String toString() {
        return "DecodingSource: " + dec.charset() + (endOfInput ? " (eoi)" : "");
    }
}
