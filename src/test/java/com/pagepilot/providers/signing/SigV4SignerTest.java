package com.pagepilot.providers.signing;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SigV4SignerTest {

    private static final Instant NOW = Instant.parse("2024-01-02T03:04:05Z");

    @Test
    void derivesKnownSigningKey() {
        byte[] key = SigV4Signer.deriveSigningKey("wJalrXUtnFEMI/K7MDENG+bPxRfiCYEXAMPLEKEY", "20120215", "us-east-1", "iam");
        assertEquals("f4780e2d9f65fa895f9c67b32ce1baf0b0d8a43505a000a1a9e090d414db404d", SigV4Signer.toHex(key));
    }

    @Test
    void hashesEmptyPayload() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", SigV4Signer.sha256Hex(""));
    }

    @Test
    void buildsCanonicalRequestWithSortedHeaders() {
        SigV4Signer signer = new SigV4Signer("AKIDEXAMPLE", "secret", null, "us-east-1", "bedrock");
        SignedRequest signed = signer.sign("post", "bedrock-runtime.us-east-1.amazonaws.com", "/model/m/converse", "{}", NOW);

        String[] lines = signed.getCanonicalRequest().split("\n", -1);
        assertEquals("POST", lines[0]);
        assertEquals("/model/m/converse", lines[1]);
        assertEquals("", lines[2]);
        assertEquals("content-type:application/json", lines[3]);
        assertEquals("host:bedrock-runtime.us-east-1.amazonaws.com", lines[4]);
        assertEquals("x-amz-content-sha256:" + SigV4Signer.sha256Hex("{}"), lines[5]);
        assertEquals("x-amz-date:20240102T030405Z", lines[6]);
        assertEquals("", lines[7]);
        assertEquals("content-type;host;x-amz-content-sha256;x-amz-date", lines[8]);
        assertEquals(SigV4Signer.sha256Hex("{}"), lines[9]);
    }

    @Test
    void stringToSignReferencesScopeAndCanonicalHash() {
        SigV4Signer signer = new SigV4Signer("AKIDEXAMPLE", "secret", "", "eu-west-1", "bedrock");
        SignedRequest signed = signer.sign("POST", "example.com", "/x", "body", NOW);

        String[] lines = signed.getStringToSign().split("\n");
        assertEquals(4, lines.length);
        assertEquals("AWS4-HMAC-SHA256", lines[0]);
        assertEquals("20240102T030405Z", lines[1]);
        assertEquals("20240102/eu-west-1/bedrock/aws4_request", lines[2]);
        assertEquals(SigV4Signer.sha256Hex(signed.getCanonicalRequest()), lines[3]);

        byte[] key = SigV4Signer.deriveSigningKey("secret", "20240102", "eu-west-1", "bedrock");
        assertEquals(SigV4Signer.toHex(SigV4Signer.hmacSha256(key, signed.getStringToSign())), signed.getSignature());
    }

    @Test
    void authorizationHeaderHasCredentialScopeAndSignature() {
        SigV4Signer signer = new SigV4Signer("AKIDEXAMPLE", "secret", null, "us-east-1", "bedrock");
        SignedRequest signed = signer.sign("POST", "example.com", "/x", "{}", NOW);

        String auth = signed.getAuthorization();
        assertTrue(auth.startsWith("AWS4-HMAC-SHA256 Credential=AKIDEXAMPLE/20240102/us-east-1/bedrock/aws4_request, "
            + "SignedHeaders=content-type;host;x-amz-content-sha256;x-amz-date, Signature="));
        assertTrue(auth.endsWith(signed.getSignature()));
        assertEquals(64, signed.getSignature().length());
        assertEquals("20240102T030405Z", signed.getHeaders().get("X-Amz-Date"));
        assertEquals("application/json", signed.getHeaders().get("Content-Type"));
        assertFalse(signed.getHeaders().containsKey("Host"));
        assertFalse(signed.getHeaders().containsKey("X-Amz-Security-Token"));
    }

    @Test
    void sessionTokenIsSignedAndSent() {
        SigV4Signer signer = new SigV4Signer("AKIDEXAMPLE", "secret", "token-123", "us-east-1", "bedrock");
        SignedRequest signed = signer.sign("POST", "example.com", "/x", "{}", NOW);

        assertEquals("token-123", signed.getHeaders().get("X-Amz-Security-Token"));
        assertTrue(signed.getAuthorization().contains("SignedHeaders=content-type;host;x-amz-content-sha256;x-amz-date;x-amz-security-token,"));
        assertTrue(signed.getCanonicalRequest().contains("\nx-amz-security-token:token-123\n"));
    }

    @Test
    void signingIsDeterministicForSameInputs() {
        SigV4Signer signer = new SigV4Signer("AKIDEXAMPLE", "secret", null, "us-east-1", "bedrock");
        SignedRequest first = signer.sign("POST", "example.com", "/x", "{\"a\":1}", NOW);
        SignedRequest second = signer.sign("POST", "example.com", "/x", "{\"a\":1}", NOW);
        SignedRequest other = signer.sign("POST", "example.com", "/x", "{\"a\":2}", NOW);

        assertEquals(first.getSignature(), second.getSignature());
        assertNotEquals(first.getSignature(), other.getSignature());
    }

    @Test
    void canonicalUriEncodesEachSegmentAgain() {
        assertEquals("/model/us.anthropic.claude-3-5-sonnet-20241022-v2%3A0/converse",
            SigV4Signer.canonicalUri("/model/us.anthropic.claude-3-5-sonnet-20241022-v2:0/converse"));
        assertEquals("/model/a%253Ab/converse", SigV4Signer.canonicalUri("/model/a%3Ab/converse"));
        assertEquals("/", SigV4Signer.canonicalUri(""));
        assertEquals("/a%20b", SigV4Signer.canonicalUri("a b"));
    }

    @Test
    void rejectsMissingCredentials() {
        assertThrows(IllegalArgumentException.class, () -> new SigV4Signer("", "secret", null, "us-east-1", "bedrock"));
        assertThrows(IllegalArgumentException.class, () -> new SigV4Signer("AKID", " ", null, "us-east-1", "bedrock"));
        assertThrows(IllegalArgumentException.class, () -> new SigV4Signer("AKID", "secret", null, "", "bedrock"));
    }

    @Test
    void collapsesHeaderWhitespace() {
        assertEquals("a b c", SigV4Signer.normalizeHeaderValue("  a   b\tc "));
    }
}
