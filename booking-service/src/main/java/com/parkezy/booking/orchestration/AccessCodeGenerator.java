package com.parkezy.booking.orchestration;

import com.parkezy.common.util.Constants;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Zero-padded numeric code shown at the gate to prove booking ownership.
 */
@Component
public class AccessCodeGenerator {

    private static final int BOUND = (int) Math.pow(10, Constants.ACCESS_CODE_DIGITS);
    private static final String FORMAT = "%0" + Constants.ACCESS_CODE_DIGITS + "d";

    private final SecureRandom random = new SecureRandom();

    public String next() {
        return String.format(FORMAT, random.nextInt(BOUND));
    }
}
