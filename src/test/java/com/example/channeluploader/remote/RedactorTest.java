package com.example.channeluploader.remote;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class RedactorTest {
    private static final String TOKEN = "123456789:" + "A".repeat(35);

    @Test
    void masksConfiguredSecretAndTokenShapes() {
        Redactor redactor = new Redactor("s3cret-value");

        String text = redactor.redact("GET /bot" + TOKEN + "/getMe failed with s3cret-value");

        assertEquals("GET /bot***/getMe failed with ***", text);
    }

    @Test
    void leavesOrdinaryTextAlone() {
        Redactor redactor = new Redactor(TOKEN);

        assertEquals("Connection refused", redactor.redact("Connection refused"));
        assertFalse(redactor.redact("token=" + TOKEN).contains(TOKEN));
    }
}
