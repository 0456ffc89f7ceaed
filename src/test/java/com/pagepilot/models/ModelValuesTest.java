package com.pagepilot.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelValuesTest {

    @Test
    void providerTypeSerializesAsId() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"bedrock_direct\"", mapper.writeValueAsString(ProviderType.BEDROCK_DIRECT));
        assertEquals(ProviderType.GEMINI_DIRECT, mapper.readValue("\"GEMINI_DIRECT\"", ProviderType.class));
        assertEquals(ProviderType.LITELLM, ProviderType.fromValue(null));
    }

    @Test
    void actionTypeLookupIsCaseInsensitive() {
        assertEquals(ActionType.CLICK_AT, ActionType.fromWire(" Click_At "));
        assertNull(ActionType.fromWire("drag"));
        assertNull(ActionType.fromWire(null));
    }

    @Test
    void screenshotHashIsStable() {
        assertEquals("1505", Screenshot.hash(""));
        assertEquals("2b5c4", Screenshot.hash("a"));
        assertEquals(Screenshot.hash("data:image/png;base64,AAAA"), Screenshot.of("data:image/png;base64,AAAA").getHash());
        assertNotEquals(Screenshot.hash("ab"), Screenshot.hash("ba"));
        assertNull(Screenshot.of("  "));
    }

    @Test
    void approvalFirstDecisionWins() {
        Approval approval = new Approval("a-1", 3, new BrowserAction(ActionType.CLICK), "click Buy",
            "keyword: buy", "Buy", 100L);

        assertFalse(approval.isResolved());
        assertFalse(approval.resolve(null, 150L));
        assertTrue(approval.resolve(ApprovalDecision.APPROVED, 200L));
        assertFalse(approval.resolve(ApprovalDecision.REJECTED, 300L));

        assertEquals(ApprovalDecision.APPROVED, approval.getDecision());
        assertEquals(200L, approval.getDecidedAt());
    }

    @Test
    void chatMessageCoercesRoleAndStripsImage() {
        ChatMessage message = new ChatMessage("m", "tool", null, 1L,
            java.util.Map.of(ChatMessage.META_IMAGE, "data:image/png;base64,AAAA", ChatMessage.META_KIND, "screenshot"));

        ChatMessage stripped = message.withoutImage();

        assertEquals("system", message.getRole());
        assertEquals("", message.getText());
        assertTrue(message.getMeta().containsKey(ChatMessage.META_IMAGE));
        assertFalse(stripped.getMeta().containsKey(ChatMessage.META_IMAGE));
        assertEquals("screenshot", stripped.getMeta().get(ChatMessage.META_KIND));
    }
}
