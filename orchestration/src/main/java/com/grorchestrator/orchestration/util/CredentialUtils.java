package com.grorchestrator.orchestration.util;

import org.apache.commons.lang3.RandomStringUtils;

import java.security.SecureRandom;

public class CredentialUtils {
    public static final int PASSWORD_LENGTH = 24;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private CredentialUtils() {
    }

    /**
     * @return password of ASCII letters and digits generated by a cryptographically secure source
     */
    public static String generatePassword() {
        return RandomStringUtils.random(PASSWORD_LENGTH, 0, 0, true, true, null, SECURE_RANDOM);
    }

    public static String generateClusterName() {
        return "cluster-" + RandomStringUtils.random(8, 0, 0, true, true, null, SECURE_RANDOM).toLowerCase();
    }

    public static String generateClusterSetName() {
        return "cluster-set-" + RandomStringUtils.random(8, 0, 0, true, true, null, SECURE_RANDOM).toLowerCase();
    }

    public static String relationUsername(int relationId) {
        return "relation-" + relationId;
    }
}
