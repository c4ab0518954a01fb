package com.tripbooking.trip.domain.reference;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * 22 alphanumeric characters drawn from {@link SecureRandom}, about 131 bits of entropy.
 * Case-sensitive, URL-safe, short enough to read out over the phone.
 */
@Component
public class RandomReferenceGenerator implements ReferenceGenerator {

    static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";
    static final int LENGTH = 22;

    private final SecureRandom random = new SecureRandom();

    @Override
    public String next() {
        char[] ref = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            ref[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
        }
        return new String(ref);
    }
}
