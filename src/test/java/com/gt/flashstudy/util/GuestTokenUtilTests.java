package com.gt.flashstudy.util;

import com.gt.flashstudy.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class GuestTokenUtilTests {

    @Test
    public void testIsValidGuestToken() {
        assertTrue(GuestTokenUtil.isValidGuestToken(UUID.randomUUID().toString()));
        assertTrue(GuestTokenUtil.isValidGuestToken(UUID.randomUUID().toString().toUpperCase()));

        assertFalse(GuestTokenUtil.isValidGuestToken(null));
        assertFalse(GuestTokenUtil.isValidGuestToken(""));
        assertFalse(GuestTokenUtil.isValidGuestToken("guest-123"));
        // name based (version 3) UUID
        assertFalse(GuestTokenUtil.isValidGuestToken(UUID.nameUUIDFromBytes(new byte[] { 1, 2, 3 }).toString()));
    }

    @Test
    public void testRequireValidGuestToken() {
        String token = UUID.randomUUID().toString();

        assertEquals(token, GuestTokenUtil.requireValidGuestToken(token));
        assertThrows(ValidationException.class, () -> GuestTokenUtil.requireValidGuestToken("not-a-uuid"));
    }

    @Test
    public void testTokensMatch() {
        String token = UUID.randomUUID().toString();

        assertTrue(GuestTokenUtil.tokensMatch(token, token));
        assertTrue(GuestTokenUtil.tokensMatch(token.toUpperCase(), token));
        assertFalse(GuestTokenUtil.tokensMatch(token, UUID.randomUUID().toString()));
        assertFalse(GuestTokenUtil.tokensMatch(token, null));
    }
}
