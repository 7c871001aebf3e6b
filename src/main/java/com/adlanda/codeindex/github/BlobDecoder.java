package com.adlanda.codeindex.github;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Turns raw blob bytes into text, or decides the blob is not text.
 *
 * Tried in order: UTF-8 with byte-order mark (mark stripped), strict UTF-8,
 * UTF-16 with byte-order mark, and UTF-16LE when NUL bytes make up more than
 * one fiftieth of the content. Anything else is treated as binary.
 */
public final class BlobDecoder {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final byte[] UTF16_LE_BOM = {(byte) 0xFF, (byte) 0xFE};
    private static final byte[] UTF16_BE_BOM = {(byte) 0xFE, (byte) 0xFF};

    private BlobDecoder() {
    }

    /**
     * @return The decoded text, or null if no supported encoding decodes the bytes cleanly
     */
    public static String decode(byte[] raw) {
        if (raw == null) {
            return null;
        }
        if (startsWith(raw, UTF8_BOM)) {
            String text = decodeStrict(raw, UTF8_BOM.length, StandardCharsets.UTF_8);
            if (text != null) {
                return text;
            }
        }

        String utf8 = decodeStrict(raw, 0, StandardCharsets.UTF_8);
        if (utf8 != null) {
            return utf8;
        }

        if (startsWith(raw, UTF16_LE_BOM) || startsWith(raw, UTF16_BE_BOM)) {
            // The UTF-16 charset reads the mark and drops it
            String text = decodeStrict(raw, 0, StandardCharsets.UTF_16);
            if (text != null) {
                return text;
            }
        }

        if (countNulBytes(raw) > Math.max(1, raw.length / 50)) {
            return decodeStrict(raw, 0, StandardCharsets.UTF_16LE);
        }
        return null;
    }

    private static String decodeStrict(byte[] raw, int offset, Charset charset) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw, offset, raw.length - offset))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static boolean startsWith(byte[] raw, byte[] prefix) {
        if (raw.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (raw[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static int countNulBytes(byte[] raw) {
        int count = 0;
        for (byte b : raw) {
            if (b == 0) {
                count++;
            }
        }
        return count;
    }
}
