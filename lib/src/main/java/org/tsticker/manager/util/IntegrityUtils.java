package org.tsticker.manager.util;

import org.tsticker.manager.api.StickerType;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

public class IntegrityUtils {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private IntegrityUtils() {
    }

    /**
     * Tag binding a collection name and type to the operator allowed to change it.
     *
     * @return lower case hex encoded HMAC-SHA256 of "name:type", keyed with the operator id
     */
    public static String computeIntegrityTag(
            final String operatorId, final String name, final StickerType stickerType
    ) {
        try {
            final var mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(operatorId.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            final var message = name + ":" + stickerType.getValue();
            return HexFormat.of().formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new AssertionError(e);
        }
    }

    /**
     * Constant time comparison of a stored tag against the expected one.
     */
    public static boolean matches(final String expected, final String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }
}
