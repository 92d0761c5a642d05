package com.grorchestrator.orchestration.util;

import org.apache.commons.lang3.StringUtils;

import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TlsUtils {
    private static final Pattern PRIVATE_KEY_PEM_PATTERN = Pattern.compile(
            "-----BEGIN ((?:RSA |EC |ENCRYPTED )?PRIVATE KEY)-----\\s*([A-Za-z0-9+/=\\s]+?)\\s*-----END \\1-----",
            Pattern.DOTALL
    );

    /**
     * Checks that value is a single PEM encoded private key with valid base64 body.
     */
    public static boolean isValidPrivateKeyPem(String value) {
        if (StringUtils.isBlank(value)) {
            return false;
        }

        Matcher matcher = PRIVATE_KEY_PEM_PATTERN.matcher(value.trim());
        if (!matcher.matches()) {
            return false;
        }

        String body = matcher.group(2).replaceAll("\\s", "");
        if (body.isEmpty()) {
            return false;
        }

        try {
            Base64.getDecoder().decode(body);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Operators often pass keys with escaped line breaks.
     */
    public static String normalizePem(String value) {
        return value.replace("\\n", "\n").trim() + "\n";
    }

    private TlsUtils() {
    }
}
