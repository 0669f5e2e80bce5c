package io.github.flameyossnowy.simpledb.http.signing;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding used for both the signature base string and the request
 * body. Only {@code A-Z a-z 0-9 - _ . ~} are kept as is; every other byte of
 * the UTF-8 form becomes {@code %XX} with upper-case hex digits. A space is
 * {@code %20}, never {@code +}.
 */
public final class UrlEncoding {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private UrlEncoding() {}

    public static String encode(@NotNull String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        StringBuilder builder = new StringBuilder(bytes.length + 16);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (isUnreserved(c)) {
                builder.append((char) c);
            } else {
                builder.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return builder.toString();
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'A' && c <= 'Z')
            || (c >= 'a' && c <= 'z')
            || (c >= '0' && c <= '9')
            || c == '-' || c == '_' || c == '.' || c == '~';
    }
}
