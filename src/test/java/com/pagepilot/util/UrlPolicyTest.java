package com.pagepilot.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlPolicyTest {

    @Test
    void onlyHttpPagesAreAutomatable() {
        assertTrue(UrlPolicy.isAutomatable("https://example.com/"));
        assertTrue(UrlPolicy.isAutomatable("http://localhost:3000"));
        assertFalse(UrlPolicy.isAutomatable("chrome://settings"));
        assertFalse(UrlPolicy.isAutomatable("file:///tmp/a.html"));
        assertFalse(UrlPolicy.isAutomatable(null));
    }

    @Test
    void emptyAllowListAllowsEverything() {
        assertTrue(UrlPolicy.isAllowedDomain("https://anything.test/", ""));
        assertTrue(UrlPolicy.isAllowedDomain("https://anything.test/", " , "));
        assertTrue(UrlPolicy.isAllowedDomain("https://anything.test/", null));
    }

    @Test
    void hostMustMatchOrBeSubdomain() {
        String allow = " Example.COM , other.org";

        assertTrue(UrlPolicy.isAllowedDomain("https://example.com/a", allow));
        assertTrue(UrlPolicy.isAllowedDomain("https://shop.EXAMPLE.com/cart", allow));
        assertTrue(UrlPolicy.isAllowedDomain("http://other.org:8080/", allow));
        assertFalse(UrlPolicy.isAllowedDomain("https://evilexample.com/", allow));
        assertFalse(UrlPolicy.isAllowedDomain("https://example.com.evil.net/", allow));
        assertFalse(UrlPolicy.isAllowedDomain("not a url", allow));
    }

    @Test
    void navigationUrlsNeedHttpSchemeAndHost() {
        assertEquals("https://example.com/a?b=1", UrlPolicy.normalizeNavigationUrl("  https://example.com/a?b=1 "));
        assertNull(UrlPolicy.normalizeNavigationUrl("javascript:alert(1)"));
        assertNull(UrlPolicy.normalizeNavigationUrl("ftp://example.com/file"));
        assertNull(UrlPolicy.normalizeNavigationUrl("example.com/path"));
        assertNull(UrlPolicy.normalizeNavigationUrl("https:///nohost"));
        assertNull(UrlPolicy.normalizeNavigationUrl(""));
    }
}
