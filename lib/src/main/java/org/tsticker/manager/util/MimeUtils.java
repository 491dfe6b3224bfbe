package org.tsticker.manager.util;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public class MimeUtils {

    public static final String WEBP = "webp";
    public static final String PNG = "png";
    public static final String JPEG = "jpg";
    public static final String GIF = "gif";
    public static final String WEBM = "webm";
    public static final String TGS = "tgs";
    public static final String BINARY = "bin";

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n'};
    private static final byte[] JPEG_SIGNATURE = {(byte) 0xff, (byte) 0xd8, (byte) 0xff};
    private static final byte[] EBML_SIGNATURE = {0x1a, 0x45, (byte) 0xdf, (byte) 0xa3};
    private static final byte[] GZIP_SIGNATURE = {0x1f, (byte) 0x8b};

    private MimeUtils() {
    }

    /**
     * Guess the file extension from the leading bytes of the content.
     * Animated stickers are gzip compressed lottie files and are reported as "tgs".
     */
    public static String detectExtension(final byte[] data) {
        if (startsWith(data, PNG_SIGNATURE)) {
            return PNG;
        }
        if (data.length >= 12 && ascii(data, 0, 4).equals("RIFF") && ascii(data, 8, 12).equals("WEBP")) {
            return WEBP;
        }
        if (startsWith(data, JPEG_SIGNATURE)) {
            return JPEG;
        }
        if (data.length >= 6 && (ascii(data, 0, 6).equals("GIF87a") || ascii(data, 0, 6).equals("GIF89a"))) {
            return GIF;
        }
        if (startsWith(data, EBML_SIGNATURE)) {
            return WEBM;
        }
        if (startsWith(data, GZIP_SIGNATURE)) {
            return TGS;
        }
        return BINARY;
    }

    private static boolean startsWith(final byte[] data, final byte[] prefix) {
        return data.length >= prefix.length && Arrays.equals(data, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static String ascii(final byte[] data, final int from, final int to) {
        return new String(data, from, to - from, StandardCharsets.US_ASCII);
    }
}
