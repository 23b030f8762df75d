package me.growmies.assistant.adapter.outbound.membership;

import me.growmies.assistant.infrastructure.config.AssistantProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredMembershipAdapterTest {

    @Test
    void configuredUsersAreVip() {
        AssistantProperties properties = new AssistantProperties();
        properties.getBilling().setVipUsers(List.of("u-vip"));
        ConfiguredMembershipAdapter adapter = new ConfiguredMembershipAdapter(properties);

        assertTrue(adapter.isVip("u-vip", "g1"));
        assertFalse(adapter.isVip("u-other", "g1"));
        assertFalse(adapter.isVip(null, "g1"));
    }
}
