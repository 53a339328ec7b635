package com.gt.flashstudy.util;

import com.gt.flashstudy.exception.ValidationException;

import java.util.regex.Pattern;

// Guest sessions are keyed by a token the client generates itself. Only random (version 4) UUIDs are accepted so that
// tokens cannot be guessed from one another.
public class GuestTokenUtil {

    private static final Pattern GUEST_TOKEN_PATTERN =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    public static boolean isValidGuestToken(String guestToken) {
        return guestToken != null && GUEST_TOKEN_PATTERN.matcher(guestToken).matches();
    }

    public static String requireValidGuestToken(String guestToken) {
        if (!isValidGuestToken(guestToken)) {
            throw new ValidationException("Guest token must be a version 4 UUID");
        }
        return guestToken;
    }

    public static boolean tokensMatch(String guestToken, String storedGuestToken) {
        return storedGuestToken != null && storedGuestToken.equalsIgnoreCase(guestToken);
    }
}
