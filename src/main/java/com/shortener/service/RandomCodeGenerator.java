package com.shortener.service;

import com.shortener.config.ShortenerProperties;
import java.security.SecureRandom;
import java.util.Base64;
import org.springframework.stereotype.Component;

/**
 * Random codes over the URL-safe base64 alphabet ({@code A-Z a-z 0-9 - _}),
 * giving 64^length possible values.
 */
@Component
public class RandomCodeGenerator implements CodeGenerator {

    private static final SecureRandom random = new SecureRandom();
    private static final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();

    private final int codeLength;

    public RandomCodeGenerator(ShortenerProperties properties) {
        this.codeLength = properties.codeLength();
    }

    @Override
    public String generate() {
        // 6 bits per output character, one spare byte so the encoding is never shorter than needed
        byte[] randomBytes = new byte[codeLength * 6 / 8 + 1];
        random.nextBytes(randomBytes);
        return encoder.encodeToString(randomBytes).substring(0, codeLength);
    }

    public int getCodeLength() {
        return codeLength;
    }
}
