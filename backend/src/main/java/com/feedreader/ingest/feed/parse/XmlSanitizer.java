package com.feedreader.ingest.feed.parse;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Removes what XML 1.0 forbids before the document reaches the parser: malformed UTF-8, control
 * characters other than tab, LF and CR, unpaired surrogates, and U+FFFE/U+FFFF.
 */
public final class XmlSanitizer {

    private XmlSanitizer() {
    }

    public static String sanitize(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return "";
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            CharBuffer decoded = decoder.decode(ByteBuffer.wrap(payload));
            return sanitize(decoded.toString());
        } catch (CharacterCodingException e) {
            // IGNORE never reports, kept for the checked signature
            return sanitize(new String(payload, StandardCharsets.UTF_8));
        }
    }

    public static String sanitize(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(input.length());
        int length = input.length();
        int start = 0;
        if (input.charAt(0) == '\uFEFF') {
            start = 1;
        }
        for (int i = start; i < length; i++) {
            char c = input.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < length && Character.isLowSurrogate(input.charAt(i + 1))) {
                    out.append(c).append(input.charAt(i + 1));
                    i++;
                }
                continue;
            }
            if (Character.isLowSurrogate(c)) {
                continue;
            }
            if (isAllowed(c)) {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static boolean isAllowed(char c) {
        if (c == '\t' || c == '\n' || c == '\r') {
            return true;
        }
        if (c < 0x20) {
            return false;
        }
        return c != '\uFFFE' && c != '\uFFFF';
    }
}
